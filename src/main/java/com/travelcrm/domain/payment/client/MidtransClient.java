package com.travelcrm.domain.payment.client;

import com.travelcrm.domain.payment.dto.TransactionStatusResponse;
import com.travelcrm.global.config.MidtransProperties;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Midtrans Snap / Core API 클라이언트.
 * 인증은 server key 를 username 으로 한 Basic 인증.
 */
@Slf4j
@Component
@SuppressWarnings("unchecked")
public class MidtransClient {

    private static final String NOT_FOUND_STATUS_CODE = "404";

    private final WebClient snapClient;
    private final WebClient apiClient;

    public MidtransClient(WebClient.Builder webClientBuilder, MidtransProperties properties) {
        String serverKey = properties.getServerKey() != null ? properties.getServerKey() : "";
        this.snapClient = webClientBuilder.clone()
                .baseUrl(properties.getSnapBaseUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(serverKey, ""))
                .build();
        this.apiClient = webClientBuilder.clone()
                .baseUrl(properties.getApiBaseUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(serverKey, ""))
                .build();
    }

    // Snap 트랜잭션 생성 → token, redirect_url
    public Mono<SnapTransaction> createSnapTransaction(Map<String, Object> parameter) {
        Object orderId = ((Map<String, Object>) parameter.get("transaction_details")).get("order_id");

        return snapClient.post()
                .uri("/snap/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(parameter)
                .retrieve()
                .bodyToMono(Map.class)
                .<SnapTransaction>handle((response, sink) -> {
                    String token = (String) response.get("token");
                    if (token == null) {
                        sink.error(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                                "Midtrans 응답에 token 이 없습니다"));
                        return;
                    }
                    sink.next(SnapTransaction.builder()
                            .token(token)
                            .redirectUrl((String) response.get("redirect_url"))
                            .build());
                })
                .doOnSuccess(result -> log.info("Snap 트랜잭션 생성 완료: orderId={}", orderId))
                .onErrorResume(WebClientResponseException.class, e -> {
                    log.error("Snap 트랜잭션 생성 실패: orderId={}, status={}, body={}",
                            orderId, e.getStatusCode(), e.getResponseBodyAsString());
                    return Mono.error(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                            "Midtrans 트랜잭션 생성 실패: " + e.getResponseBodyAsString(), e));
                })
                .onErrorResume(e -> !(e instanceof BusinessException), e -> {
                    log.error("Snap 트랜잭션 생성 중 오류: orderId={}, error={}", orderId, e.getMessage());
                    return Mono.error(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                            "Midtrans 연결 실패: " + e.getMessage(), e));
                });
    }

    // 거래 상태 조회. 존재하지 않는 거래는 HTTP 200 + status_code "404" 로 응답된다
    public Mono<TransactionStatusResponse> getTransactionStatus(String orderId) {
        return apiClient.get()
                .uri("/v2/{orderId}/status", orderId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(Map.class)
                .<TransactionStatusResponse>handle((response, sink) -> {
                    String statusCode = asString(response.get("status_code"));
                    if (NOT_FOUND_STATUS_CODE.equals(statusCode)) {
                        sink.error(new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                                "Midtrans 에 거래가 없습니다: " + orderId));
                        return;
                    }
                    sink.next(TransactionStatusResponse.builder()
                            .orderId(asString(response.get("order_id")))
                            .statusCode(statusCode)
                            .transactionStatus(asString(response.get("transaction_status")))
                            .fraudStatus(asString(response.get("fraud_status")))
                            .paymentType(asString(response.get("payment_type")))
                            .grossAmount(asString(response.get("gross_amount")))
                            .transactionTime(asString(response.get("transaction_time")))
                            .build());
                })
                .doOnSuccess(result -> log.debug("거래 상태 조회: orderId={}, status={}",
                        orderId, result.getTransactionStatus()))
                .onErrorResume(WebClientResponseException.class, e -> {
                    log.error("거래 상태 조회 실패: orderId={}, status={}, body={}",
                            orderId, e.getStatusCode(), e.getResponseBodyAsString());
                    return Mono.error(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                            "Midtrans 상태 조회 실패: " + e.getResponseBodyAsString(), e));
                })
                .onErrorResume(e -> !(e instanceof BusinessException), e -> {
                    log.error("거래 상태 조회 중 오류: orderId={}, error={}", orderId, e.getMessage());
                    return Mono.error(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                            "Midtrans 연결 실패: " + e.getMessage(), e));
                });
    }

    private static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    @Getter
    @Builder
    public static class SnapTransaction {
        private String token;
        private String redirectUrl;
    }
}
