package com.travelcrm.domain.booking.repository;

import com.travelcrm.domain.booking.entity.Booking;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface BookingRepository extends ReactiveCrudRepository<Booking, Long> {

    Mono<Booking> findByBookingCode(String bookingCode);

    // 예약 행 잠금. 수정·취소·상태 변경이 같은 예약을 동시에 건드리지 않도록 한다
    @Query("SELECT * FROM bookings WHERE id = :id FOR UPDATE")
    Mono<Booking> findByIdForUpdate(Long id);

    // 패키지의 정원 점유 인원 합계 (PENDING, PAID, CONFIRMED)
    @Query("SELECT COALESCE(SUM(participants), 0) FROM bookings " +
           "WHERE package_id = :packageId AND status IN ('PENDING', 'PAID', 'CONFIRMED')")
    Mono<Long> sumSlotHoldingParticipantsByPackageId(Long packageId);

    // 고객 등급 산정용 결제 예약 수 (PAID, CONFIRMED, COMPLETED)
    @Query("SELECT COUNT(*) FROM bookings " +
           "WHERE customer_id = :customerId AND status IN ('PAID', 'CONFIRMED', 'COMPLETED')")
    Mono<Long> countPaidBookingsByCustomerId(Long customerId);
}
