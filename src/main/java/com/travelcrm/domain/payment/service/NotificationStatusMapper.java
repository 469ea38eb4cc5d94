package com.travelcrm.domain.payment.service;

import com.travelcrm.domain.booking.entity.BookingStatus;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Midtrans transaction_status / fraud_status → 내부 결제·예약 상태.
 * bookingStatus 가 null 이면 예약 상태를 건드리지 않는다.
 */
@Component
public class NotificationStatusMapper {

    public StatusMapping map(String transactionStatus, String fraudStatus) {
        if (transactionStatus == null) {
            return StatusMapping.pending();
        }
        return switch (transactionStatus) {
            case "capture" -> "accept".equals(fraudStatus)
                    ? new StatusMapping(PaymentStatus.SUCCESS, BookingStatus.PAID)
                    : StatusMapping.pending();  // challenge: 수동 검토 대기
            case "settlement" -> new StatusMapping(PaymentStatus.SUCCESS, BookingStatus.PAID);
            case "cancel", "deny" -> new StatusMapping(PaymentStatus.FAILED, BookingStatus.CANCELED);
            case "expire" -> new StatusMapping(PaymentStatus.EXPIRED, BookingStatus.CANCELED);
            case "refund" -> new StatusMapping(PaymentStatus.REFUND, null);
            default -> StatusMapping.pending();
        };
    }

    @Getter
    @RequiredArgsConstructor
    public static class StatusMapping {
        private final PaymentStatus paymentStatus;
        private final BookingStatus bookingStatus;

        static StatusMapping pending() {
            return new StatusMapping(PaymentStatus.PENDING, null);
        }
    }
}
