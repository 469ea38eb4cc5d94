package com.travelcrm.domain.payment.service;

import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.booking.entity.BookingStatus;
import com.travelcrm.domain.booking.repository.BookingRepository;
import com.travelcrm.domain.booking.service.BookingEventProducer;
import com.travelcrm.domain.booking.service.BookingService;
import com.travelcrm.domain.payment.dto.MidtransNotification;
import com.travelcrm.domain.payment.dto.TransactionStatusResponse;
import com.travelcrm.domain.payment.entity.Payment;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import com.travelcrm.domain.payment.repository.PaymentRepository;
import com.travelcrm.domain.payment.service.NotificationStatusMapper.StatusMapping;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Midtrans 결제 결과 반영.
 * <p>
 * 같은 주문의 알림은 결제 행 잠금(FOR UPDATE)으로 직렬화되고, 결제·예약·고객 등급 변경은 한 트랜잭션으로 커밋된다.
 * 중복 알림은 무시되며 종료 상태는 SUCCESS → REFUND 외에는 바뀌지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentNotificationService {

    private static final String LATE_SETTLEMENT_REASON = "canceled booking settled";
    private static final String PROVIDER_REFUND_REASON = "provider refund";

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;
    private final BookingService bookingService;
    private final BookingEventProducer bookingEventProducer;
    private final MidtransSignatureVerifier signatureVerifier;
    private final NotificationStatusMapper statusMapper;
    private final TransactionalOperator transactionalOperator;

    // Webhook 처리
    public Mono<Payment> processNotification(MidtransNotification notification) {
        // 1. 서명 검증 (실패 시 상태 변경 없음)
        if (!signatureVerifier.verify(notification)) {
            log.warn("Webhook 서명 불일치: orderId={}", notification.getOrderId());
            return Mono.error(new BusinessException(ErrorCode.INVALID_SIGNATURE));
        }
        log.info("Webhook 수신: orderId={}, transactionStatus={}, fraudStatus={}",
                notification.getOrderId(), notification.getTransactionStatus(), notification.getFraudStatus());

        return apply(notification.getOrderId(), notification.getGrossAmount(),
                statusMapper.map(notification.getTransactionStatus(), notification.getFraudStatus()),
                notification.getPaymentType());
    }

    // PG 상태 조회 결과 반영 (스케줄러 전용, 서명 검증 없음)
    public Mono<Payment> synchronize(TransactionStatusResponse status) {
        return apply(status.getOrderId(), status.getGrossAmount(),
                statusMapper.map(status.getTransactionStatus(), status.getFraudStatus()),
                status.getPaymentType());
    }

    private Mono<Payment> apply(String orderId, String grossAmount, StatusMapping mapping, String paymentType) {
        return transactionalOperator.transactional(
                        // 2. 결제 행 잠금
                        paymentRepository.findByOrderIdForUpdate(orderId)
                                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PAYMENT_NOT_FOUND)))
                                // 3. 금액 검증
                                .flatMap(payment -> verifyAmount(payment, grossAmount))
                                // 4. 결제 상태 전이 → 예약 상태 반영
                                .flatMap(payment -> applyPaymentStatus(payment, mapping, paymentType)))
                // 5. 커밋 이후 이벤트 발행
                .flatMap(this::publishEvents);
    }

    private Mono<Payment> verifyAmount(Payment payment, String grossAmount) {
        if (grossAmount == null) {
            return Mono.error(new BusinessException(ErrorCode.PAYMENT_AMOUNT_MISMATCH, "결제 금액이 누락되었습니다"));
        }
        BigDecimal notified;
        try {
            notified = new BigDecimal(grossAmount);
        } catch (NumberFormatException e) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_INPUT, "결제 금액 형식이 올바르지 않습니다: " + grossAmount, e));
        }
        if (notified.compareTo(payment.getAmount()) != 0) {
            log.warn("결제 금액 불일치: orderId={}, expected={}, notified={}",
                    payment.getOrderId(), payment.getAmount(), grossAmount);
            return Mono.error(new BusinessException(ErrorCode.PAYMENT_AMOUNT_MISMATCH));
        }
        return Mono.just(payment);
    }

    private Mono<NotificationOutcome> applyPaymentStatus(Payment payment, StatusMapping mapping, String paymentType) {
        PaymentStatus current = payment.getStatus();
        PaymentStatus next = mapping.getPaymentStatus();

        if (current == next) {
            log.info("중복 알림 무시: orderId={}, status={}", payment.getOrderId(), current);
            return Mono.just(new NotificationOutcome(payment));
        }
        if (!current.canTransitionTo(next)) {
            log.warn("허용되지 않는 결제 상태 전이 무시: orderId={}, {} -> {}", payment.getOrderId(), current, next);
            return Mono.just(new NotificationOutcome(payment));
        }

        LocalDateTime now = LocalDateTime.now();
        payment.setStatus(next);
        payment.setPaymentType(paymentType);
        payment.setPaidAt(next == PaymentStatus.SUCCESS ? now : null);
        payment.setUpdatedAt(now);

        return paymentRepository.save(payment)
                .doOnSuccess(saved -> log.info("결제 상태 변경: orderId={}, {} -> {}", saved.getOrderId(), current, next))
                .flatMap(saved -> applyBookingStatus(saved, mapping.getBookingStatus()));
    }

    // PENDING 예약만 PAID/CANCELED 로 이동한다
    private Mono<NotificationOutcome> applyBookingStatus(Payment payment, BookingStatus target) {
        NotificationOutcome outcome = new NotificationOutcome(payment);
        outcome.paymentChanged = true;
        if (target == null) {
            return Mono.just(outcome);
        }

        return bookingRepository.findByIdForUpdate(payment.getBookingId())
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_FOUND)))
                .flatMap(booking -> {
                    BookingStatus current = booking.getStatus();
                    if (current == target) {
                        return Mono.just(outcome);
                    }
                    if (current != BookingStatus.PENDING) {
                        if (current == BookingStatus.CANCELED && target == BookingStatus.PAID) {
                            log.warn("취소된 예약에 결제 완료 통지, 수동 환불 필요: bookingId={}, orderId={}",
                                    booking.getId(), payment.getOrderId());
                            outcome.refundRequired = true;
                        } else {
                            log.warn("예약 상태 변경 생략: bookingId={}, current={}, target={}",
                                    booking.getId(), current, target);
                        }
                        return Mono.just(outcome);
                    }
                    return bookingService.updateBookingStatus(booking, target)
                            .map(updated -> {
                                outcome.booking = updated;
                                return outcome;
                            });
                });
    }

    private Mono<Payment> publishEvents(NotificationOutcome outcome) {
        Payment payment = outcome.getPayment();
        Mono<Void> bookingEvent = outcome.getBooking() != null
                ? bookingEventProducer.sendBookingStatusEvent(outcome.getBooking())
                : Mono.empty();

        Mono<Void> refundEvent = Mono.empty();
        if (outcome.isPaymentChanged() && payment.getStatus() == PaymentStatus.REFUND) {
            refundEvent = bookingEventProducer.sendRefundEvent(payment, PROVIDER_REFUND_REASON);
        } else if (outcome.isRefundRequired()) {
            refundEvent = bookingEventProducer.sendRefundEvent(payment, LATE_SETTLEMENT_REASON);
        }

        return bookingEvent.then(refundEvent).thenReturn(payment);
    }

    @Getter
    private static class NotificationOutcome {
        private final Payment payment;
        private boolean paymentChanged;
        private Booking booking;            // 상태가 바뀐 경우에만 설정
        private boolean refundRequired;

        NotificationOutcome(Payment payment) {
            this.payment = payment;
        }
    }
}
