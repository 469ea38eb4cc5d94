package com.travelcrm.domain.auth.service;

import com.travelcrm.domain.auth.dto.LoginRequest;
import com.travelcrm.domain.customer.entity.Customer;
import com.travelcrm.domain.customer.repository.CustomerRepository;
import com.travelcrm.domain.user.entity.Role;
import com.travelcrm.domain.user.entity.User;
import com.travelcrm.domain.user.repository.UserRepository;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import com.travelcrm.global.security.JwtProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtProvider jwtProvider;

    @InjectMocks
    private AuthService authService;

    @Test
    void staffLoginIssuesToken() {
        User user = User.builder().id(3L).email("sales@travelcrm.com").password("hash")
                .name("Sari").role(Role.SALES).isActive(true).build();
        when(userRepository.findByEmail("sales@travelcrm.com")).thenReturn(Mono.just(user));
        when(passwordEncoder.matches("password123", "hash")).thenReturn(true);
        when(jwtProvider.createToken(3L, "sales@travelcrm.com", Role.SALES)).thenReturn("jwt");
        when(jwtProvider.getExpirationMs()).thenReturn(86_400_000L);

        StepVerifier.create(authService.login(new LoginRequest("sales@travelcrm.com", "password123")))
                .assertNext(response -> {
                    assertThat(response.getToken()).isEqualTo("jwt");
                    assertThat(response.getRole()).isEqualTo(Role.SALES);
                    assertThat(response.getExpiresIn()).isEqualTo(86_400_000L);
                })
                .verifyComplete();
    }

    @Test
    void inactiveStaffIsRejected() {
        User user = User.builder().id(3L).email("old@travelcrm.com").password("hash")
                .role(Role.CS).isActive(false).build();
        when(userRepository.findByEmail("old@travelcrm.com")).thenReturn(Mono.just(user));
        when(passwordEncoder.matches("password123", "hash")).thenReturn(true);

        StepVerifier.create(authService.login(new LoginRequest("old@travelcrm.com", "password123")))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ACCOUNT_DISABLED))
                .verify();

        verify(jwtProvider, never()).createToken(any(), any(), any());
    }

    @Test
    void wrongPasswordIsUnauthorized() {
        User user = User.builder().id(3L).email("sales@travelcrm.com").password("hash")
                .role(Role.SALES).isActive(true).build();
        when(userRepository.findByEmail("sales@travelcrm.com")).thenReturn(Mono.just(user));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        StepVerifier.create(authService.login(new LoginRequest("sales@travelcrm.com", "wrong")))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UNAUTHORIZED))
                .verify();
    }

    @Test
    void customerLoginUsesCustomerRole() {
        Customer customer = Customer.builder().id(1L).email("budi@example.com").password("hash").name("Budi").build();
        when(customerRepository.findByEmail("budi@example.com")).thenReturn(Mono.just(customer));
        when(passwordEncoder.matches("password123", "hash")).thenReturn(true);
        when(jwtProvider.createToken(1L, "budi@example.com", Role.CUSTOMER)).thenReturn("jwt");

        StepVerifier.create(authService.customerLogin(new LoginRequest("budi@example.com", "password123")))
                .assertNext(response -> {
                    assertThat(response.getId()).isEqualTo(1L);
                    assertThat(response.getRole()).isEqualTo(Role.CUSTOMER);
                })
                .verifyComplete();
    }

    @Test
    void customerWithoutPasswordCannotLogIn() {
        Customer customer = Customer.builder().id(1L).email("walkin@example.com").build();
        when(customerRepository.findByEmail("walkin@example.com")).thenReturn(Mono.just(customer));

        StepVerifier.create(authService.customerLogin(new LoginRequest("walkin@example.com", "password123")))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UNAUTHORIZED))
                .verify();
    }
}
