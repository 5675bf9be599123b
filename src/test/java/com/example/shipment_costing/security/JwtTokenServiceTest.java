package com.example.shipment_costing.security;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.shipment_costing.entity.UserRole;

class JwtTokenServiceTest {

    private static final String DEFAULT_SECRET = "default-secret-test-key-32-bytes-long";
    private static final String STRONG_SECRET = "secure-and-long-enough-secret-for-production";

    @Test
    void defaultSecretIsRefusedInProdAndReal() {
        assertThrows(IllegalStateException.class, service(DEFAULT_SECRET, "prod")::init);
        assertThrows(IllegalStateException.class, service(DEFAULT_SECRET, "dev,real")::init);
    }

    @Test
    void defaultSecretIsAllowedOutsideProduction() {
        JwtTokenService s = service(DEFAULT_SECRET, "dev");

        assertDoesNotThrow(s::init);
        assertTrue(s.isUsingDefaultSecret());
    }

    @Test
    void strongSecretIsAcceptedInProd() {
        JwtTokenService s = service(STRONG_SECRET, "prod");

        assertDoesNotThrow(s::init);
        assertFalse(s.isUsingDefaultSecret());
    }

    @Test
    void shortSecretIsRejected() {
        assertThrows(IllegalStateException.class, service("short", "dev")::init);
    }

    @Test
    void tokenCarriesUsernameAndRole() {
        JwtTokenService s = service(STRONG_SECRET, "");
        s.init();

        String token = s.generateToken("amira", UserRole.ACCOUNTANT);
        JwtTokenService.TokenUser user = s.validateToken(token);

        assertEquals("amira", user.username());
        assertEquals(UserRole.ACCOUNTANT, user.role());
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService issuer = service("another-secret-that-is-also-long-enough", "");
        issuer.init();
        JwtTokenService verifier = service(STRONG_SECRET, "");
        verifier.init();

        assertNull(verifier.validateToken(issuer.generateToken("amira", UserRole.ADMIN)));
        assertNull(verifier.validateToken("not-a-jwt"));
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenService s = service(STRONG_SECRET, "");
        ReflectionTestUtils.setField(s, "expirationHours", -1);
        s.init();

        assertNull(s.validateToken(s.generateToken("amira", UserRole.VIEWER)));
    }

    private static JwtTokenService service(String secret, String profile) {
        JwtTokenService service = new JwtTokenService();
        ReflectionTestUtils.setField(service, "jwtSecret", secret);
        ReflectionTestUtils.setField(service, "activeProfile", profile);
        ReflectionTestUtils.setField(service, "expirationHours", 24);
        return service;
    }
}
