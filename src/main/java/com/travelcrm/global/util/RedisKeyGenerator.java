package com.travelcrm.global.util;

// Redis 키 생성을 위한 유틸리티 클래스
public class RedisKeyGenerator {

    private RedisKeyGenerator() {
        throw new UnsupportedOperationException("유틸리티 클래스는 인스턴스화할 수 없습니다.");
    }

    // 결제 시작 중복 호출 방지 락 (String+TTL) - lock:payment-init:{bookingId}
    public static String paymentInitLockKey(Long bookingId) {
        return String.format("lock:payment-init:%d", bookingId);
    }

    // 분당 요청 수 카운터 (String+TTL, 60초) - rate-limit:{identifier}
    public static String rateLimitKey(String identifier) {
        return String.format("rate-limit:%s", identifier);
    }
}
