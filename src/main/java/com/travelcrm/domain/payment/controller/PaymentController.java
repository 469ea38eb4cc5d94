package com.travelcrm.domain.payment.controller;

import com.travelcrm.domain.payment.dto.MidtransNotification;
import com.travelcrm.domain.payment.dto.TransactionStatusResponse;
import com.travelcrm.domain.payment.dto.WebhookResponse;
import com.travelcrm.domain.payment.service.PaymentNotificationService;
import com.travelcrm.domain.payment.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Tag(name = "Payment", description = "결제 API")
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final PaymentNotificationService paymentNotificationService;

    @Operation(
            summary = "Midtrans Webhook",
            description = "Midtrans HTTP notification 수신. signature_key 로 검증합니다. 중복 수신은 무시됩니다."
    )
    @PostMapping("/webhook")
    public Mono<ResponseEntity<WebhookResponse>> handleNotification(@RequestBody MidtransNotification notification) {
        return paymentNotificationService.processNotification(notification)
                .map(payment -> ResponseEntity.ok(WebhookResponse.processed(payment)));
    }

    @Operation(summary = "PG 거래 상태 조회")
    @GetMapping("/{orderId}/status")
    public Mono<ResponseEntity<TransactionStatusResponse>> getTransactionStatus(@PathVariable String orderId) {
        return paymentService.getTransactionStatus(orderId)
                .map(ResponseEntity::ok);
    }
}
