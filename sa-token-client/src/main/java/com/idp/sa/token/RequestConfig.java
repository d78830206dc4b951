package com.idp.sa.token;

import java.net.URI;

import com.idp.sa.token.jwt.KeySource;

/**
 * Normalized input of one token request.
 */
public record RequestConfig(
    String serviceAccountId,
    String tokenEndpointBase,
    String scope,
    KeySource keySource,
    long lifetimeSeconds
) {

    public RequestConfig {
        if (serviceAccountId == null || serviceAccountId.isBlank()) {
            throw new ConfigException("service_account_id", "required");
        }
        tokenEndpointBase = ConfigNormalizer.resolveBaseUrl(tokenEndpointBase, null);
        if (keySource == null) {
            throw new ConfigException("jwk_json", "a key source is required");
        }
        if (lifetimeSeconds <= 0) {
            throw new ConfigException("exp_seconds", "lifetime must be positive");
        }
        scope = (scope == null || scope.isBlank()) ? null : scope;
    }

    public URI tokenEndpoint() {
        return ConfigNormalizer.tokenEndpoint(tokenEndpointBase);
    }
}
