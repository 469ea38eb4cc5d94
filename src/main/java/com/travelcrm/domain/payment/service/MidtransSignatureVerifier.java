package com.travelcrm.domain.payment.service;

import com.travelcrm.domain.payment.dto.MidtransNotification;
import com.travelcrm.global.config.MidtransProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

// signature_key = SHA-512(order_id + status_code + gross_amount + server_key), 소문자 hex
@Component
@RequiredArgsConstructor
public class MidtransSignatureVerifier {

    private final MidtransProperties midtransProperties;

    public boolean verify(MidtransNotification notification) {
        if (notification.getSignatureKey() == null
                || notification.getOrderId() == null
                || notification.getStatusCode() == null
                || notification.getGrossAmount() == null) {
            return false;
        }
        String expected = sign(notification.getOrderId(), notification.getStatusCode(), notification.getGrossAmount());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                notification.getSignatureKey().getBytes(StandardCharsets.UTF_8));
    }

    public String sign(String orderId, String statusCode, String grossAmount) {
        String payload = orderId + statusCode + grossAmount + midtransProperties.getServerKey();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}
