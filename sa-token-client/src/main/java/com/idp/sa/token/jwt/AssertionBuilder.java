package com.idp.sa.token.jwt;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the self-issued assertion a service account presents to the token endpoint.
 * Every call produces a new assertion id; assertions are single use.
 */
public interface AssertionBuilder {

    record SignedAssertion(String compact, String id, Instant expiresAt) {
        @Override
        public String toString() {
            return "SignedAssertion[jti=" + id + ", exp=" + expiresAt + ", length=" + compact.length() + "]";
        }
    }

    SignedAssertion build(String serviceAccountId, URI audience, long lifetimeSeconds, SigningKey key);
}
