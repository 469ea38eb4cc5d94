package com.travelcrm.domain.travelpackage.service;

import com.travelcrm.domain.booking.repository.BookingRepository;
import com.travelcrm.domain.travelpackage.dto.AvailabilityResponse;
import com.travelcrm.domain.travelpackage.entity.TravelPackage;
import com.travelcrm.domain.travelpackage.repository.TravelPackageRepository;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 패키지 잔여 인원 계산.
 * 정원 점유 상태(PENDING, PAID, CONFIRMED) 예약의 인원 합계를 quota 에서 뺀 값이 잔여석이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackageAvailabilityService {

    private final TravelPackageRepository travelPackageRepository;
    private final BookingRepository bookingRepository;

    // 잔여석 조회 (읽기 전용)
    public Mono<AvailabilityResponse> checkAvailability(Long packageId, int requestedParticipants) {
        if (requestedParticipants < 1) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_INPUT, "인원은 1명 이상이어야 합니다"));
        }
        return travelPackageRepository.findById(packageId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PACKAGE_NOT_FOUND)))
                .flatMap(this::requireActive)
                .flatMap(travelPackage -> calculate(travelPackage, requestedParticipants));
    }

    // 패키지 행을 잠그고 조회. 반드시 트랜잭션 안에서 호출해야 잠금이 커밋 시점까지 유지된다.
    public Mono<TravelPackage> lockPackage(Long packageId) {
        return travelPackageRepository.findByIdForUpdate(packageId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PACKAGE_NOT_FOUND)))
                .flatMap(this::requireActive);
    }

    public Mono<AvailabilityResponse> calculate(TravelPackage travelPackage, int requestedParticipants) {
        return bookingRepository.sumSlotHoldingParticipantsByPackageId(travelPackage.getId())
                .defaultIfEmpty(0L)
                .map(booked -> {
                    int quota = travelPackage.getQuota() != null ? travelPackage.getQuota() : 0;
                    long availableSlots = quota - booked;
                    return AvailabilityResponse.builder()
                            .packageId(travelPackage.getId())
                            .quota(quota)
                            .bookedParticipants(booked)
                            .availableSlots(availableSlots)
                            .requestedParticipants(requestedParticipants)
                            .available(availableSlots >= requestedParticipants)
                            .build();
                })
                .doOnNext(result -> log.debug("잔여석 계산: packageId={}, quota={}, booked={}, requested={}, available={}",
                        result.getPackageId(), result.getQuota(), result.getBookedParticipants(),
                        requestedParticipants, result.isAvailable()));
    }

    private Mono<TravelPackage> requireActive(TravelPackage travelPackage) {
        if (!Boolean.TRUE.equals(travelPackage.getIsActive())) {
            return Mono.error(new BusinessException(ErrorCode.PACKAGE_INACTIVE));
        }
        return Mono.just(travelPackage);
    }
}
