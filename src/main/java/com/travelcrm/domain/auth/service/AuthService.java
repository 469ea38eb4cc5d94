package com.travelcrm.domain.auth.service;

import com.travelcrm.domain.auth.dto.AuthResponse;
import com.travelcrm.domain.auth.dto.LoginRequest;
import com.travelcrm.domain.customer.repository.CustomerRepository;
import com.travelcrm.domain.user.entity.Role;
import com.travelcrm.domain.user.repository.UserRepository;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import com.travelcrm.global.security.JwtProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final CustomerRepository customerRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtProvider jwtProvider;

    // 직원 로그인
    public Mono<AuthResponse> login(LoginRequest request) {
        return userRepository.findByEmail(request.getEmail())
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.UNAUTHORIZED)))
                .flatMap(user -> {
                    if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
                        return Mono.<AuthResponse>error(new BusinessException(ErrorCode.UNAUTHORIZED));
                    }
                    if (!Boolean.TRUE.equals(user.getIsActive())) {
                        log.warn("비활성 계정 로그인 시도: userId={}", user.getId());
                        return Mono.<AuthResponse>error(new BusinessException(ErrorCode.ACCOUNT_DISABLED));
                    }

                    String token = jwtProvider.createToken(user.getId(), user.getEmail(), user.getRole());
                    return Mono.just(AuthResponse.builder()
                            .id(user.getId())
                            .email(user.getEmail())
                            .name(user.getName())
                            .role(user.getRole())
                            .token(token)
                            .expiresIn(jwtProvider.getExpirationMs())
                            .build());
                });
    }

    // 고객 로그인. 비밀번호가 설정되지 않은 고객은 로그인할 수 없다
    public Mono<AuthResponse> customerLogin(LoginRequest request) {
        return customerRepository.findByEmail(request.getEmail())
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.UNAUTHORIZED)))
                .flatMap(customer -> {
                    if (customer.getPassword() == null
                            || !passwordEncoder.matches(request.getPassword(), customer.getPassword())) {
                        return Mono.<AuthResponse>error(new BusinessException(ErrorCode.UNAUTHORIZED));
                    }

                    String token = jwtProvider.createToken(customer.getId(), customer.getEmail(), Role.CUSTOMER);
                    return Mono.just(AuthResponse.builder()
                            .id(customer.getId())
                            .email(customer.getEmail())
                            .name(customer.getName())
                            .role(Role.CUSTOMER)
                            .token(token)
                            .expiresIn(jwtProvider.getExpirationMs())
                            .build());
                });
    }
}
