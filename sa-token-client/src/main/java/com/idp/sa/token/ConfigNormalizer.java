package com.idp.sa.token;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

import com.idp.sa.token.jwt.KeySource;

/**
 * Turns a {@link ServiceAccountTokenConfig} into a {@link RequestConfig}.
 */
public final class ConfigNormalizer {
    public static final String SERVICE_ACCOUNT_TYPE = "service-account";
    public static final String TOKEN_PATH = "/am/oauth2/access_token";
    public static final long DEFAULT_LIFETIME_SECONDS = 899;

    private ConfigNormalizer() {}

    public static RequestConfig normalize(ServiceAccountTokenConfig config) {
        if (config == null) {
            throw new ConfigException("config", "required");
        }
        String type = config.getType();
        if (type != null && !type.isBlank() && !SERVICE_ACCOUNT_TYPE.equals(type)) {
            throw new ConfigException("type", "unsupported token type '" + type + "', only "
                + SERVICE_ACCOUNT_TYPE + " is supported");
        }
        return new RequestConfig(
            config.getServiceAccountId() == null ? null : config.getServiceAccountId().trim(),
            resolveBaseUrl(config.getBaseUrl(), config.getPlatform()),
            config.joinedScope(),
            resolveKeySource(config.getJwkJson(), config.getPrivateKey()),
            resolveLifetimeSeconds(config.getExpSeconds(), config.getExpiresIn()));
    }

    /**
     * {@code baseUrl} wins over {@code platform}; trailing slashes are removed.
     *
     * @throws ConfigException if neither is set or the result is not an absolute http(s) URL
     */
    public static String resolveBaseUrl(String baseUrl, String platform) {
        String base = isBlank(baseUrl) ? platform : baseUrl;
        if (isBlank(base)) {
            throw new ConfigException("baseUrl", "baseUrl or platform is required");
        }
        base = stripTrailingSlashes(base.trim());
        try {
            URI uri = new URI(base);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigException("baseUrl", "not an absolute http(s) URL: " + base);
            }
        } catch (URISyntaxException e) {
            throw new ConfigException("baseUrl", "not a valid URL: " + base, e);
        }
        return base;
    }

    public static URI tokenEndpoint(String base) {
        return URI.create(stripTrailingSlashes(base) + TOKEN_PATH);
    }

    /**
     * {@code exp_seconds} first, then {@code expiresIn} in whole seconds, then {@value #DEFAULT_LIFETIME_SECONDS}.
     */
    public static long resolveLifetimeSeconds(int expSeconds, Duration expiresIn) {
        if (expSeconds < 0) {
            throw new ConfigException("exp_seconds", "must not be negative");
        }
        if (expSeconds > 0) {
            return expSeconds;
        }
        if (expiresIn != null) {
            if (expiresIn.isNegative()) {
                throw new ConfigException("expiresIn", "must not be negative");
            }
            if (expiresIn.getSeconds() > 0) {
                return expiresIn.getSeconds();
            }
        }
        return DEFAULT_LIFETIME_SECONDS;
    }

    static KeySource resolveKeySource(String jwkJson, String privateKey) {
        boolean hasJwk = !isBlank(jwkJson);
        boolean hasPem = !isBlank(privateKey);
        if (hasJwk && hasPem) {
            throw new ConfigException("jwk_json", "set either jwk_json or privateKey, not both");
        }
        if (hasJwk) {
            return new KeySource.Jwk(jwkJson);
        }
        if (hasPem) {
            return new KeySource.Pem(privateKey);
        }
        throw new ConfigException("jwk_json", "jwk_json or privateKey is required");
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
