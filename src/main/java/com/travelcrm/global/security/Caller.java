package com.travelcrm.global.security;

import com.travelcrm.domain.user.entity.Role;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;

/**
 * 요청 주체. 직원이면 users.id, 고객이면 customers.id 를 가진다.
 */
@Getter
@RequiredArgsConstructor
public class Caller {

    static final String ROLE_PREFIX = "ROLE_";

    private final Long id;
    private final Role role;

    public boolean isCustomer() {
        return role == Role.CUSTOMER;
    }

    // 고객은 본인 소유 데이터만 접근 가능
    public boolean canAccessCustomer(Long customerId) {
        return !isCustomer() || id.equals(customerId);
    }

    public static Mono<Caller> current() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .map(Caller::from)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.ACCESS_DENIED)));
    }

    static Caller from(Authentication authentication) {
        Role role = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(authority -> authority.startsWith(ROLE_PREFIX))
                .map(authority -> Role.valueOf(authority.substring(ROLE_PREFIX.length())))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_DENIED));
        return new Caller((Long) authentication.getPrincipal(), role);
    }
}
