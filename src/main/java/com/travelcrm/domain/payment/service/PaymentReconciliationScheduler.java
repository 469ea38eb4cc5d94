package com.travelcrm.domain.payment.service;

import com.travelcrm.domain.payment.client.MidtransClient;
import com.travelcrm.domain.payment.repository.PaymentRepository;
import com.travelcrm.global.config.MidtransProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

// Webhook 유실 대비: 오래 PENDING 으로 남은 결제를 PG 상태 조회 결과로 동기화
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentReconciliationScheduler {

    private final PaymentRepository paymentRepository;
    private final MidtransClient midtransClient;
    private final PaymentNotificationService paymentNotificationService;
    private final MidtransProperties midtransProperties;

    @Scheduled(fixedDelayString = "${travelcrm.midtrans.reconcile.interval-minutes:5}", timeUnit = TimeUnit.MINUTES)
    public void reconcilePendingPayments() {
        if (!midtransProperties.getReconcile().isEnabled()) {
            return;
        }
        reconcile()
                .onErrorResume(e -> {
                    log.warn("결제 동기화 스케줄러 오류: {}", e.getMessage());
                    return Mono.just(0L);
                })
                .subscribe();
    }

    // 처리 시도한 결제 건수 반환. 개별 실패는 로그만 남기고 다음 건으로 진행
    public Mono<Long> reconcile() {
        LocalDateTime threshold = LocalDateTime.now()
                .minusMinutes(midtransProperties.getReconcile().getStaleAfterMinutes());

        return paymentRepository.findPendingCreatedBefore(threshold)
                .concatMap(payment -> midtransClient.getTransactionStatus(payment.getOrderId())
                        .flatMap(paymentNotificationService::synchronize)
                        .doOnNext(synced -> log.debug("결제 동기화: orderId={}, status={}",
                                synced.getOrderId(), synced.getStatus()))
                        .onErrorResume(e -> {
                            log.warn("결제 동기화 실패: orderId={}, error={}", payment.getOrderId(), e.getMessage());
                            return Mono.just(payment);
                        }))
                .doOnSubscribe(s -> log.debug("결제 동기화 스캔 시작: threshold={}", threshold))
                .count()
                .doOnSuccess(count -> {
                    if (count > 0) {
                        log.info("결제 동기화 처리: {}건", count);
                    }
                });
    }
}
