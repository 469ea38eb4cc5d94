package com.travelcrm.domain.auth.controller;

import com.travelcrm.domain.auth.dto.AuthResponse;
import com.travelcrm.domain.auth.dto.LoginRequest;
import com.travelcrm.domain.auth.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "Auth", description = "인증 API")
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @Operation(summary = "직원 로그인")
    @PostMapping("/login")
    public Mono<ResponseEntity<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "고객 로그인")
    @PostMapping("/customer/login")
    public Mono<ResponseEntity<AuthResponse>> customerLogin(@Valid @RequestBody LoginRequest request) {
        return authService.customerLogin(request)
                .map(ResponseEntity::ok);
    }
}
