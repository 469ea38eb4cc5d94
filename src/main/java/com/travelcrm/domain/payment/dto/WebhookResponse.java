package com.travelcrm.domain.payment.dto;

import com.travelcrm.domain.payment.entity.Payment;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class WebhookResponse {
    private boolean success;
    private String message;
    private Data data;

    public static WebhookResponse processed(Payment payment) {
        return new WebhookResponse(true, "Notification processed",
                new Data(payment.getId(), payment.getStatus()));
    }

    @Getter
    @AllArgsConstructor
    public static class Data {
        private Long paymentId;
        private PaymentStatus status;
    }
}
