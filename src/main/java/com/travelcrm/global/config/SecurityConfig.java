package com.travelcrm.global.config;

import com.travelcrm.global.security.JwtAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.HttpStatusServerEntryPoint;
import org.springframework.security.web.server.authorization.HttpStatusServerAccessDeniedHandler;

/**
 * Spring Security WebFlux 설정.
 * CSRF/httpBasic/formLogin 비활성화, JWT 필터 등록, 경로·역할별 인가 설정.
 * 역할: ADMIN, SALES, CS, MANAGER (직원) / CUSTOMER (고객)
 */
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String ADMIN = "ADMIN";
    private static final String SALES = "SALES";
    private static final String CS = "CS";
    private static final String CUSTOMER = "CUSTOMER";

    private final JwtAuthenticationFilter jwtAuthenticationFilter;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(new HttpStatusServerEntryPoint(HttpStatus.UNAUTHORIZED))
                        .accessDeniedHandler(new HttpStatusServerAccessDeniedHandler(HttpStatus.FORBIDDEN)))
                .authorizeExchange(exchanges -> exchanges
                        // 인증 불필요
                        .pathMatchers(HttpMethod.POST, "/api/v1/auth/**").permitAll()
                        // Midtrans Webhook (서버→서버 호출, 서명으로 검증)
                        .pathMatchers(HttpMethod.POST, "/api/v1/payments/webhook").permitAll()
                        // PG 거래 상태 조회
                        .pathMatchers(HttpMethod.GET, "/api/v1/payments/*/status").hasAnyRole(ADMIN, SALES, CS)
                        // 예약
                        .pathMatchers(HttpMethod.POST, "/api/v1/bookings").hasAnyRole(ADMIN, SALES, CUSTOMER)
                        .pathMatchers(HttpMethod.POST, "/api/v1/bookings/*/pay").hasAnyRole(ADMIN, SALES, CS, CUSTOMER)
                        .pathMatchers(HttpMethod.PUT, "/api/v1/bookings/*").hasAnyRole(ADMIN, SALES)
                        .pathMatchers(HttpMethod.PATCH, "/api/v1/bookings/*/cancel").hasAnyRole(ADMIN, SALES)
                        .pathMatchers(HttpMethod.PATCH, "/api/v1/bookings/*/status").hasRole(ADMIN)
                        .pathMatchers(HttpMethod.GET, "/api/v1/bookings/code/*").hasAnyRole(ADMIN, SALES, CS)
                        // Actuator
                        .pathMatchers("/actuator/**").permitAll()
                        // Swagger (WebFlux)
                        .pathMatchers("/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs/**", "/webjars/**").permitAll()
                        // 나머지 인증 필요
                        .anyExchange().authenticated()
                )
                .addFilterAt(jwtAuthenticationFilter, SecurityWebFiltersOrder.AUTHENTICATION)
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
