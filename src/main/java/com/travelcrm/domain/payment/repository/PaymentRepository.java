package com.travelcrm.domain.payment.repository;

import com.travelcrm.domain.payment.entity.Payment;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface PaymentRepository extends ReactiveCrudRepository<Payment, Long> {

    Mono<Payment> findByOrderId(String orderId);

    Mono<Payment> findByBookingId(Long bookingId);

    // 결제 행 잠금. 같은 order_id 알림이 동시에 들어와도 결제·예약 상태 갱신이 순차 처리된다
    @Query("SELECT * FROM payments WHERE order_id = :orderId FOR UPDATE")
    Mono<Payment> findByOrderIdForUpdate(String orderId);

    // 대사(reconciliation) 대상: 생성 후 일정 시간이 지나도 PENDING 인 결제
    @Query("SELECT * FROM payments WHERE status = 'PENDING' AND created_at < :before ORDER BY created_at")
    Flux<Payment> findPendingCreatedBefore(LocalDateTime before);
}
