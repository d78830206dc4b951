package com.idp.sa.token;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;
import lombok.Setter;

/**
 * Caller supplied settings, as read from a token configuration file.
 * {@code baseUrl}/{@code platform}, {@code exp_seconds}/{@code expiresIn} and {@code scope}/{@code scopes}
 * are alternative spellings resolved by {@link ConfigNormalizer}.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceAccountTokenConfig {

    private String type = ConfigNormalizer.SERVICE_ACCOUNT_TYPE;
    private String baseUrl;
    private String platform;

    @JsonProperty("service_account_id")
    private String serviceAccountId;

    @JsonProperty("jwk_json")
    private String jwkJson;

    private String privateKey;

    private String scope;
    private List<String> scopes = Collections.emptyList();

    @JsonProperty("exp_seconds")
    private int expSeconds;

    private Duration expiresIn;

    private boolean verbose;

    public String joinedScope() {
        if (scope != null && !scope.isBlank()) {
            return scope.trim();
        }
        return (scopes == null || scopes.isEmpty()) ? null : String.join(" ", scopes);
    }
}
