package com.travelcrm.domain.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

// Midtrans HTTP notification 본문. 사용하지 않는 필드는 무시한다
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MidtransNotification {
    private String orderId;
    private String statusCode;
    private String grossAmount;
    private String signatureKey;
    private String transactionStatus;
    private String fraudStatus;
    private String paymentType;
    private String transactionId;
    private String transactionTime;
}
