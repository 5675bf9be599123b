package com.example.shipment_costing.security;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.shipment_costing.entity.UserRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;

@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);
    private static final int MINIMUM_SECRET_LENGTH = 32;
    private static final String DEFAULT_SECRET_PREFIX = "default-secret";
    private static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret:default-secret-key-change-in-production-at-least-32-bytes}")
    private String jwtSecret;

    @Value("${jwt.expiration-hours:24}")
    private int expirationHours;

    @Value("${spring.profiles.active:}")
    private String activeProfile;

    private SecretKey key;
    private boolean usingDefaultSecret = false;

    @PostConstruct
    public void init() {
        if (jwtSecret == null || jwtSecret.isBlank() || jwtSecret.startsWith(DEFAULT_SECRET_PREFIX)) {
            usingDefaultSecret = true;
            if (isProductionProfile()) {
                throw new IllegalStateException(
                        "Default JWT secret is not allowed in profile '" + activeProfile + "'. Set JWT_SECRET.");
            }
            log.warn("Default JWT secret in use (profile '{}'); set JWT_SECRET before going live", activeProfile);
        }

        if (jwtSecret.length() < MINIMUM_SECRET_LENGTH) {
            log.error("JWT secret is too short! Minimum {} characters required, got {}.",
                    MINIMUM_SECRET_LENGTH, jwtSecret.length());
            throw new IllegalStateException(
                    "JWT secret must be at least " + MINIMUM_SECRET_LENGTH + " characters. " +
                            "Set JWT_SECRET environment variable with a secure value.");
        }

        byte[] keyBytes = jwtSecret.getBytes(StandardCharsets.UTF_8);
        this.key = Keys.hmacShaKeyFor(keyBytes);
        log.info("JWT service initialized. Token expiration: {} hours", expirationHours);
    }

    public String generateToken(String username, UserRole role) {
        if (usingDefaultSecret) {
            log.warn("Generating JWT with default secret - NOT SECURE for production!");
        }

        Instant now = Instant.now();
        Instant expiry = now.plusSeconds(expirationHours * 3600L);

        return Jwts.builder()
                .subject(username)
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(key)
                .compact();
    }

    /**
     * @return the token's user, or null when the token is invalid or expired
     */
    public TokenUser validateToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getExpiration().before(new Date())) {
                return null;
            }
            String role = claims.get(ROLE_CLAIM, String.class);
            return new TokenUser(claims.getSubject(), role == null ? UserRole.VIEWER : UserRole.valueOf(role));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected JWT: {}", e.getMessage());
            return null;
        }
    }

    public boolean isUsingDefaultSecret() {
        return usingDefaultSecret;
    }

    private boolean isProductionProfile() {
        if (activeProfile == null) {
            return false;
        }
        for (String p : activeProfile.split(",")) {
            String profile = p.trim();
            if ("prod".equals(profile) || "real".equals(profile)) {
                return true;
            }
        }
        return false;
    }

    public record TokenUser(String username, UserRole role) {
    }
}
