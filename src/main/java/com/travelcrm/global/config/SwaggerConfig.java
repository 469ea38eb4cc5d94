package com.travelcrm.global.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 문서. 예약/패키지/인증 API 와 Midtrans 연동 API 를 그룹으로 나눠 노출한다.
 */
@Configuration
public class SwaggerConfig {

    private static final String BEARER_SCHEME = "Bearer Token";

    @Bean
    public OpenAPI travelCrmOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Travel CRM API")
                        .version("v1")
                        .description("여행 패키지 예약, 잔여석 관리, Midtrans 결제 연동 API"))
                .externalDocs(new ExternalDocumentation()
                        .description("Midtrans HTTP notification")
                        .url("https://docs.midtrans.com/docs/https-notification-webhooks"))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .name(BEARER_SCHEME)
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi bookingApi() {
        return GroupedOpenApi.builder()
                .group("booking")
                .pathsToMatch("/api/v1/bookings/**", "/api/v1/packages/**", "/api/v1/auth/**")
                .build();
    }

    // Webhook 은 서명으로 검증하므로 JWT 불필요
    @Bean
    public GroupedOpenApi paymentApi() {
        return GroupedOpenApi.builder()
                .group("payment")
                .pathsToMatch("/api/v1/payments/**")
                .build();
    }
}
