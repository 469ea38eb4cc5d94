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
import com.travelcrm.global.config.MidtransProperties;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentNotificationServiceTest {

    private static final String ORDER_ID = "TRV-BK261019-0A1B2C3D-1760000000000-ABC123";

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private BookingService bookingService;

    @Mock
    private BookingEventProducer bookingEventProducer;

    @Mock
    private TransactionalOperator transactionalOperator;

    private MidtransSignatureVerifier signatureVerifier;

    private PaymentNotificationService paymentNotificationService;

    private Payment payment;

    private Booking booking;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        MidtransProperties properties = new MidtransProperties();
        properties.setServerKey("SB-Mid-server-test");
        signatureVerifier = new MidtransSignatureVerifier(properties);

        paymentNotificationService = new PaymentNotificationService(paymentRepository, bookingRepository,
                bookingService, bookingEventProducer, signatureVerifier, new NotificationStatusMapper(),
                transactionalOperator);

        payment = Payment.builder()
                .id(20L)
                .bookingId(10L)
                .orderId(ORDER_ID)
                .token("snap-token")
                .amount(new BigDecimal("7000000"))
                .status(PaymentStatus.PENDING)
                .expiredAt(LocalDateTime.now().plusHours(24))
                .build();
        booking = Booking.builder()
                .id(10L)
                .bookingCode("BK261019-0A1B2C3D")
                .customerId(1L)
                .packageId(1L)
                .participants(2)
                .totalAmount(new BigDecimal("7000000"))
                .status(BookingStatus.PENDING)
                .build();

        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        when(paymentRepository.findByOrderIdForUpdate(ORDER_ID)).thenAnswer(inv -> Mono.just(payment));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(bookingRepository.findByIdForUpdate(10L)).thenAnswer(inv -> Mono.just(booking));
        when(bookingService.updateBookingStatus(any(Booking.class), any(BookingStatus.class))).thenAnswer(inv -> {
            Booking target = inv.getArgument(0);
            target.setStatus(inv.getArgument(1));
            return Mono.just(target);
        });
        when(bookingEventProducer.sendBookingStatusEvent(any())).thenReturn(Mono.empty());
        when(bookingEventProducer.sendRefundEvent(any(), anyString())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("settlement 알림 → 결제 SUCCESS, 예약 PAID")
    void settlementMarksPaymentSuccessAndBookingPaid() {
        StepVerifier.create(paymentNotificationService.processNotification(notification("settlement", null)))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
                    assertThat(result.getPaidAt()).isNotNull();
                    assertThat(result.getPaymentType()).isEqualTo("bank_transfer");
                })
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PAID);
        // 동시 취소와 겹쳐도 덮어쓰지 않도록 예약 행을 잠그고 읽는다
        verify(bookingRepository).findByIdForUpdate(10L);
        verify(bookingRepository, never()).findById(anyLong());
        verify(bookingService).updateBookingStatus(booking, BookingStatus.PAID);
        verify(bookingEventProducer).sendBookingStatusEvent(booking);
        verify(bookingEventProducer, never()).sendRefundEvent(any(), anyString());
    }

    @Test
    @DisplayName("같은 알림을 두 번 받아도 상태와 paidAt 이 그대로")
    void redeliveredNotificationIsNoOp() {
        MidtransNotification settlement = notification("settlement", null);
        paymentNotificationService.processNotification(settlement).block();
        LocalDateTime paidAt = payment.getPaidAt();

        StepVerifier.create(paymentNotificationService.processNotification(settlement))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
                    assertThat(result.getPaidAt()).isEqualTo(paidAt);
                })
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PAID);
        verify(paymentRepository).save(any(Payment.class));
        verify(bookingService).updateBookingStatus(any(Booking.class), any(BookingStatus.class));
        verify(bookingEventProducer).sendBookingStatusEvent(any());
    }

    @Test
    @DisplayName("서명이 틀리면 아무것도 변경하지 않고 INVALID_SIGNATURE")
    void invalidSignatureLeavesStateUntouched() {
        MidtransNotification forged = MidtransNotification.builder()
                .orderId(ORDER_ID)
                .statusCode("200")
                .grossAmount("7000000.00")
                .transactionStatus("settlement")
                .signatureKey("deadbeef")
                .build();

        StepVerifier.create(paymentNotificationService.processNotification(forged))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_SIGNATURE))
                .verify();

        verifyNoInteractions(paymentRepository, bookingRepository, bookingService, bookingEventProducer);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    void terminalSuccessIsNotRegressedByLateExpire() {
        payment.setStatus(PaymentStatus.SUCCESS);
        booking.setStatus(BookingStatus.PAID);

        StepVerifier.create(paymentNotificationService.processNotification(notification("expire", null)))
                .assertNext(result -> assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS))
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PAID);
        verify(paymentRepository, never()).save(any());
    }

    @Test
    void pendingNotificationDoesNotRegressSuccess() {
        payment.setStatus(PaymentStatus.SUCCESS);

        StepVerifier.create(paymentNotificationService.processNotification(notification("pending", null)))
                .assertNext(result -> assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS))
                .verifyComplete();

        verify(paymentRepository, never()).save(any());
    }

    @Test
    void refundAfterSuccessPublishesRefundEvent() {
        payment.setStatus(PaymentStatus.SUCCESS);
        payment.setPaidAt(LocalDateTime.now().minusDays(1));
        booking.setStatus(BookingStatus.PAID);

        StepVerifier.create(paymentNotificationService.processNotification(notification("refund", null)))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(PaymentStatus.REFUND);
                    assertThat(result.getPaidAt()).isNull();
                })
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PAID);
        verify(bookingRepository, never()).findByIdForUpdate(anyLong());
        verify(bookingEventProducer).sendRefundEvent(eq(payment), anyString());
    }

    @Test
    void expireCancelsPendingBooking() {
        StepVerifier.create(paymentNotificationService.processNotification(notification("expire", null)))
                .assertNext(result -> assertThat(result.getStatus()).isEqualTo(PaymentStatus.EXPIRED))
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELED);
    }

    @Test
    void challengedCaptureStaysPending() {
        StepVerifier.create(paymentNotificationService.processNotification(notification("capture", "challenge")))
                .assertNext(result -> assertThat(result.getStatus()).isEqualTo(PaymentStatus.PENDING))
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        verify(paymentRepository, never()).save(any());
    }

    @Test
    @DisplayName("취소된 예약에 늦은 결제 완료가 오면 예약은 되살리지 않고 환불 이벤트 발행")
    void lateSettlementDoesNotReviveCanceledBooking() {
        booking.setStatus(BookingStatus.CANCELED);

        StepVerifier.create(paymentNotificationService.processNotification(notification("settlement", null)))
                .assertNext(result -> assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS))
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELED);
        verify(bookingService, never()).updateBookingStatus(any(Booking.class), any(BookingStatus.class));
        verify(bookingEventProducer, never()).sendBookingStatusEvent(any());
        verify(bookingEventProducer).sendRefundEvent(eq(payment), anyString());
    }

    @Test
    void amountMismatchIsRejected() {
        String grossAmount = "100.00";
        MidtransNotification tampered = MidtransNotification.builder()
                .orderId(ORDER_ID)
                .statusCode("200")
                .grossAmount(grossAmount)
                .transactionStatus("settlement")
                .signatureKey(signatureVerifier.sign(ORDER_ID, "200", grossAmount))
                .build();

        StepVerifier.create(paymentNotificationService.processNotification(tampered))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PAYMENT_AMOUNT_MISMATCH))
                .verify();

        verify(paymentRepository, never()).save(any());
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void unknownOrderFailsWithNotFound() {
        String orderId = "TRV-UNKNOWN";
        MidtransNotification unknown = MidtransNotification.builder()
                .orderId(orderId)
                .statusCode("200")
                .grossAmount("7000000.00")
                .transactionStatus("settlement")
                .signatureKey(signatureVerifier.sign(orderId, "200", "7000000.00"))
                .build();
        when(paymentRepository.findByOrderIdForUpdate(orderId)).thenReturn(Mono.empty());

        StepVerifier.create(paymentNotificationService.processNotification(unknown))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PAYMENT_NOT_FOUND))
                .verify();
    }

    @Test
    void synchronizeAppliesPulledStatusWithoutSignature() {
        TransactionStatusResponse status = TransactionStatusResponse.builder()
                .orderId(ORDER_ID)
                .statusCode("200")
                .transactionStatus("settlement")
                .paymentType("qris")
                .grossAmount("7000000.00")
                .build();

        StepVerifier.create(paymentNotificationService.synchronize(status))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
                    assertThat(result.getPaymentType()).isEqualTo("qris");
                })
                .verifyComplete();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PAID);
    }

    private MidtransNotification notification(String transactionStatus, String fraudStatus) {
        String statusCode = "settlement".equals(transactionStatus) || "capture".equals(transactionStatus) ? "200" : "201";
        String grossAmount = "7000000.00";
        return MidtransNotification.builder()
                .orderId(ORDER_ID)
                .statusCode(statusCode)
                .grossAmount(grossAmount)
                .transactionStatus(transactionStatus)
                .fraudStatus(fraudStatus)
                .paymentType("bank_transfer")
                .signatureKey(signatureVerifier.sign(ORDER_ID, statusCode, grossAmount))
                .build();
    }
}
