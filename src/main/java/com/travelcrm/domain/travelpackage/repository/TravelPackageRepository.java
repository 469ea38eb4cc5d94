package com.travelcrm.domain.travelpackage.repository;

import com.travelcrm.domain.travelpackage.entity.TravelPackage;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface TravelPackageRepository extends ReactiveCrudRepository<TravelPackage, Long> {

    // 패키지 행 잠금. 같은 패키지의 잔여석 확인 → 예약 저장 구간을 트랜잭션 안에서 직렬화
    @Query("SELECT * FROM travel_packages WHERE id = :id FOR UPDATE")
    Mono<TravelPackage> findByIdForUpdate(Long id);
}
