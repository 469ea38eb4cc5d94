package com.travelcrm.domain.payment.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Table("payments")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    private Long id;

    private Long bookingId;

    // Midtrans order_id
    private String orderId;

    // Snap token / redirect_url (PG 응답 그대로 저장)
    private String token;

    private String redirectUrl;

    private BigDecimal amount;

    private PaymentStatus status;

    private String paymentType;

    private LocalDateTime paidAt;

    private LocalDateTime expiredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    // 아직 결제 가능한 Snap 토큰이 살아 있는지
    public boolean isReusableAt(LocalDateTime now) {
        return status == PaymentStatus.PENDING
                && token != null
                && (expiredAt == null || now.isBefore(expiredAt));
    }

    // 토큰이 살아 있고 청구 금액도 그대로일 때만 재사용
    public boolean isReusableFor(BigDecimal chargeAmount, LocalDateTime now) {
        return isReusableAt(now)
                && amount != null
                && amount.compareTo(chargeAmount) == 0;
    }
}
