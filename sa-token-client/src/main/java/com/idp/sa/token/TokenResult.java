package com.idp.sa.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An access token obtained from the token endpoint. {@code expiresAt} is derived locally
 * from the time the response was received plus {@code expiresInSeconds}.
 */
@JsonPropertyOrder({"access_token", "token_type", "expires_in", "expires_at", "scope", "metadata"})
public record TokenResult(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresInSeconds,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("scope") @JsonInclude(JsonInclude.Include.NON_EMPTY) String scope,
    @JsonProperty("metadata") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> metadata
) {

    public TokenResult {
        metadata = (metadata == null || metadata.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TokenResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new TokenResult(accessToken, tokenType, expiresInSeconds, expiresAt, scope, merged);
    }

    @Override
    public String toString() {
        return "TokenResult[tokenType=" + tokenType
            + ", accessToken=<" + (accessToken == null ? 0 : accessToken.length()) + " chars>"
            + ", expiresIn=" + expiresInSeconds
            + ", expiresAt=" + expiresAt
            + ", scope=" + scope
            + ", metadata=" + metadata + "]";
    }
}
