package com.travelcrm.domain.payment.dto;

import com.travelcrm.domain.payment.entity.Payment;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Builder
public class PaymentInitResponse {
    private Long paymentId;
    private Long bookingId;
    private String orderId;
    private String token;
    private String redirectUrl;
    private BigDecimal amount;
    private PaymentStatus status;
    private LocalDateTime expiredAt;
    private boolean alreadyInitiated;   // 유효한 기존 결제를 그대로 돌려준 경우 true

    public static PaymentInitResponse of(Payment payment, boolean alreadyInitiated) {
        return PaymentInitResponse.builder()
                .paymentId(payment.getId())
                .bookingId(payment.getBookingId())
                .orderId(payment.getOrderId())
                .token(payment.getToken())
                .redirectUrl(payment.getRedirectUrl())
                .amount(payment.getAmount())
                .status(payment.getStatus())
                .expiredAt(payment.getExpiredAt())
                .alreadyInitiated(alreadyInitiated)
                .build();
    }
}
