package com.travelcrm.domain.payment.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class TransactionStatusResponse {
    private String orderId;
    private String statusCode;
    private String transactionStatus;
    private String fraudStatus;
    private String paymentType;
    private String grossAmount;
    private String transactionTime;
}
