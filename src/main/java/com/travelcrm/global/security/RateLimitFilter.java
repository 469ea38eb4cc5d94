package com.travelcrm.global.security;

import com.travelcrm.global.config.RateLimitProperties;
import com.travelcrm.global.util.RedisKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis 기반 Rate Limiting WebFilter.
 * 클라이언트 IP 기준으로 분당 요청 수를 제한하고, 초과 시 429 Too Many Requests 반환.
 * Midtrans 결제 Webhook 은 재전송 정책을 PG 가 관리하므로 제한하지 않는다.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@RequiredArgsConstructor
public class RateLimitFilter implements WebFilter {

    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final String WEBHOOK_PATH = "/api/v1/payments/webhook";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RateLimitProperties rateLimitProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (WEBHOOK_PATH.equals(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        String identifier = getClientIp(exchange);
        String key = RedisKeyGenerator.rateLimitKey(identifier);
        int limit = rateLimitProperties.getRequestsPerMinute();

        return redisTemplate.opsForValue().increment(key)
                .flatMap(count -> {
                    if (count == 1) {
                        return redisTemplate.expire(key, WINDOW)
                                .thenReturn(count);
                    }
                    return Mono.just(count);
                })
                .flatMap(count -> {
                    if (count > limit) {
                        log.warn("Rate limit exceeded: identifier={}, count={}", identifier, count);
                        exchange.getResponse().setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
                        exchange.getResponse().getHeaders().add("X-RateLimit-Retry-After", "60");
                        return exchange.getResponse().setComplete();
                    }

                    exchange.getResponse().getHeaders().add("X-RateLimit-Remaining",
                            String.valueOf(limit - count));
                    return chain.filter(exchange);
                });
    }

    private String getClientIp(ServerWebExchange exchange) {
        String forwarded = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.split(",")[0].trim();
        }
        var remoteAddress = exchange.getRequest().getRemoteAddress();
        return remoteAddress != null ? remoteAddress.getAddress().getHostAddress() : "unknown";
    }
}
