package com.travelcrm.domain.booking.service;

import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.payment.entity.Payment;
import com.travelcrm.global.config.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;

    // 예약 상태 변경 이벤트 발행 → booking-status 토픽
    // key: bookingId (같은 예약의 이벤트 순서 보장)
    public Mono<Void> sendBookingStatusEvent(Booking booking) {
        String message = String.format(
                "{\"bookingId\":%d,\"bookingCode\":\"%s\",\"customerId\":%d,\"packageId\":%d,\"status\":\"%s\"}",
                booking.getId(), booking.getBookingCode(), booking.getCustomerId(),
                booking.getPackageId(), booking.getStatus()
        );

        return Mono.fromCallable(() -> kafkaTemplate.send(
                        KafkaTopics.BOOKING_STATUS,
                        String.valueOf(booking.getId()),
                        message))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("[Kafka] booking-status 발행: bookingId={}, status={}",
                        booking.getId(), booking.getStatus()))
                .doOnError(e -> log.error("[Kafka] booking-status 발행 실패: bookingId={}, error={}",
                        booking.getId(), e.getMessage()))
                .then();
    }

    // 환불 처리 요청 이벤트 발행 → payment-refund 토픽 (환불 실행은 운영팀 담당)
    public Mono<Void> sendRefundEvent(Payment payment, String reason) {
        String message = String.format(
                "{\"paymentId\":%d,\"bookingId\":%d,\"orderId\":\"%s\",\"amount\":\"%s\",\"status\":\"%s\",\"reason\":\"%s\"}",
                payment.getId(), payment.getBookingId(), payment.getOrderId(),
                payment.getAmount().toPlainString(), payment.getStatus(), reason
        );

        return Mono.fromCallable(() -> kafkaTemplate.send(
                        KafkaTopics.PAYMENT_REFUND,
                        String.valueOf(payment.getId()),
                        message))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("[Kafka] payment-refund 발행: paymentId={}, reason={}",
                        payment.getId(), reason))
                .doOnError(e -> log.error("[Kafka] payment-refund 발행 실패: paymentId={}, error={}",
                        payment.getId(), e.getMessage()))
                .then();
    }
}
