package me.golemcore.apollo.adapter.inbound.web.security;

import io.jsonwebtoken.Jwts;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hmac-sha256-algorithm";

    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        provider = providerWithSecret(SECRET);
    }

    @Test
    void shouldAuthenticateValidAccessToken() {
        String token = token(SECRET, "user-1", JwtTokenProvider.TYPE_ACCESS, Instant.now().plusSeconds(600));

        assertEquals(Optional.of("user-1"), provider.authenticate(token));
    }

    @Test
    void shouldRejectRefreshToken() {
        String token = token(SECRET, "user-1", "refresh", Instant.now().plusSeconds(600));

        assertTrue(provider.authenticate(token).isEmpty());
    }

    @Test
    void shouldRejectExpiredToken() {
        String token = token(SECRET, "user-1", JwtTokenProvider.TYPE_ACCESS, Instant.now().minusSeconds(60));

        assertTrue(provider.authenticate(token).isEmpty());
    }

    @Test
    void shouldRejectTokenSignedWithAnotherSecret() {
        String token = token("another-secret-key-that-is-also-long-enough-for-hs256", "user-1",
                JwtTokenProvider.TYPE_ACCESS, Instant.now().plusSeconds(600));

        assertTrue(provider.authenticate(token).isEmpty());
    }

    @Test
    void shouldRejectTokenWithoutSubject() {
        String token = Jwts.builder()
                .claim(JwtTokenProvider.CLAIM_TYPE, JwtTokenProvider.TYPE_ACCESS)
                .expiration(Date.from(Instant.now().plusSeconds(600)))
                .signWith(JwtTokenProvider.signingKey(SECRET))
                .compact();

        assertTrue(provider.authenticate(token).isEmpty());
    }

    @Test
    void shouldRejectMalformedAndNullTokens() {
        assertTrue(provider.authenticate("invalid-token-string").isEmpty());
        assertTrue(provider.authenticate("").isEmpty());
        assertTrue(provider.authenticate(null).isEmpty());
    }

    @Test
    void shouldPadShortSecrets() {
        JwtTokenProvider shortSecretProvider = providerWithSecret("short");
        String token = token("short", "user-7", JwtTokenProvider.TYPE_ACCESS, Instant.now().plusSeconds(600));

        assertEquals(Optional.of("user-7"), shortSecretProvider.authenticate(token));
    }

    @Test
    void shouldUseEphemeralSecretWhenNoneConfigured() {
        JwtTokenProvider ephemeral = providerWithSecret(null);
        String token = token(SECRET, "user-1", JwtTokenProvider.TYPE_ACCESS, Instant.now().plusSeconds(600));

        assertTrue(ephemeral.authenticate(token).isEmpty());
    }

    private static JwtTokenProvider providerWithSecret(String secret) {
        ApolloProperties properties = new ApolloProperties();
        properties.getSecurity().setJwtSecret(secret);
        JwtTokenProvider tokenProvider = new JwtTokenProvider(properties);
        tokenProvider.init();
        return tokenProvider;
    }

    private static String token(String secret, String subject, String type, Instant expiresAt) {
        return Jwts.builder()
                .subject(subject)
                .claim(JwtTokenProvider.CLAIM_TYPE, type)
                .issuedAt(Date.from(Instant.now().minusSeconds(120)))
                .expiration(Date.from(expiresAt))
                .signWith(JwtTokenProvider.signingKey(secret))
                .compact();
    }
}
