package com.idp.sa.token.jwt;

import com.idp.sa.token.AssertionSigningException;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Objects;

/**
 * RS256 assertions using JJWT. Claims are exactly iss, sub, aud, exp and jti.
 */
@Slf4j
@AllArgsConstructor
public final class Rs256AssertionBuilder implements AssertionBuilder {
    static final int ASSERTION_ID_BYTES = 16;

    private final Clock clock;
    private final SecureRandom random;

    public Rs256AssertionBuilder() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    @Override
    public SignedAssertion build(String serviceAccountId, URI audience, long lifetimeSeconds, SigningKey key) {
        Objects.requireNonNull(serviceAccountId, "serviceAccountId");
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(key, "key");
        if (lifetimeSeconds <= 0) {
            throw new IllegalArgumentException("lifetimeSeconds must be positive: " + lifetimeSeconds);
        }

        String jti = newAssertionId();
        Instant exp = Instant.ofEpochSecond(clock.instant().getEpochSecond() + lifetimeSeconds);

        String jwt;
        try {
            jwt = Jwts.builder()
                .header().type("JWT").and()
                .issuer(serviceAccountId)
                .subject(serviceAccountId)
                .audience().single(audience.toString())
                .expiration(Date.from(exp))
                .id(jti)
                .signWith(key.privateKey(), Jwts.SIG.RS256)
                .compact();
        } catch (JwtException e) {
            throw new AssertionSigningException("Failed to sign assertion for " + serviceAccountId, e);
        }

        log.debug("JWT assertion created for audience {}, expires at {}", audience, exp);
        return new SignedAssertion(jwt, jti, exp);
    }

    private String newAssertionId() {
        byte[] bytes = new byte[ASSERTION_ID_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new AssertionSigningException("Failed to generate assertion id", e);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
