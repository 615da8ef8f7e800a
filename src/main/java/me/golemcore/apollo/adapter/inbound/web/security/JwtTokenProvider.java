package me.golemcore.apollo.adapter.inbound.web.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies bearer tokens. Tokens are issued elsewhere with the shared HMAC
 * secret; this service only checks signature, expiry and token type.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String CLAIM_TYPE = "type";
    static final String TYPE_ACCESS = "access";
    private static final int MIN_SECRET_BYTES = 32;

    private final ApolloProperties properties;
    private SecretKey signingKey;

    public JwtTokenProvider(ApolloProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        String secret = properties.getSecurity().getJwtSecret();
        if (secret == null || secret.isBlank()) {
            byte[] randomBytes = new byte[64];
            new SecureRandom().nextBytes(randomBytes);
            secret = Base64.getEncoder().encodeToString(randomBytes);
            log.warn("[Security] No JWT secret configured, generated an ephemeral one (no external token will verify)");
        }
        this.signingKey = signingKey(secret);
    }

    /**
     * Derives the HMAC key for a configured secret. Short secrets are zero-padded
     * to the minimum HS256 key length.
     */
    static SecretKey signingKey(String secret) {
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            byte[] padded = new byte[MIN_SECRET_BYTES];
            System.arraycopy(keyBytes, 0, padded, 0, keyBytes.length);
            keyBytes = padded;
        }
        return Keys.hmacShaKeyFor(keyBytes);
    }

    /**
     * Returns the user id of a valid access token.
     */
    public Optional<String> authenticate(String token) {
        try {
            Claims claims = parseClaims(token);
            if (!TYPE_ACCESS.equals(claims.get(CLAIM_TYPE, String.class))) {
                log.debug("[Security] Rejected non-access token");
                return Optional.empty();
            }
            String subject = claims.getSubject();
            return subject == null || subject.isBlank() ? Optional.empty() : Optional.of(subject);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[Security] Invalid JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
