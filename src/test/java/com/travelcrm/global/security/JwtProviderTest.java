package com.travelcrm.global.security;

import com.travelcrm.domain.user.entity.Role;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JwtProviderTest {

    private static final String SECRET = "travelcrm-test-secret-key-which-is-long-enough-0123456789";

    private final JwtProvider jwtProvider = new JwtProvider(SECRET, 60_000L);

    @Test
    void tokenCarriesIdAndRole() {
        String token = jwtProvider.createToken(42L, "sales@travelcrm.com", Role.SALES);

        assertThat(jwtProvider.validateToken(token)).isTrue();
        assertThat(jwtProvider.getId(token)).isEqualTo(42L);
        assertThat(jwtProvider.getRole(token)).isEqualTo(Role.SALES);
        assertThat(jwtProvider.getClaims(token).get("email", String.class)).isEqualTo("sales@travelcrm.com");
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtProvider other = new JwtProvider("another-secret-key-for-signing-tokens-0123456789abcdef", 60_000L);
        String token = other.createToken(1L, "budi@example.com", Role.CUSTOMER);

        assertThat(jwtProvider.validateToken(token)).isFalse();
    }

    @Test
    void expiredTokenIsRejected() {
        JwtProvider shortLived = new JwtProvider(SECRET, -1_000L);
        String token = shortLived.createToken(1L, "budi@example.com", Role.CUSTOMER);

        assertThat(jwtProvider.validateToken(token)).isFalse();
    }

    @Test
    void garbageIsRejected() {
        assertThat(jwtProvider.validateToken("not-a-jwt")).isFalse();
    }
}
