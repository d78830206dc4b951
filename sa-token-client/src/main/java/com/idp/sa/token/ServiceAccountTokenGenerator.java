package com.idp.sa.token;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import com.idp.sa.token.jwt.AssertionBuilder;
import com.idp.sa.token.jwt.AssertionBuilder.SignedAssertion;
import com.idp.sa.token.jwt.KeyMaterialDecoder;
import com.idp.sa.token.jwt.Rs256AssertionBuilder;
import com.idp.sa.token.jwt.SigningKey;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the service-account token pipeline on the caller's thread:
 * decode the key, sign an assertion, exchange it at the token endpoint.
 * Holds no per-request state, so one instance may serve concurrent callers.
 */
@Slf4j
@AllArgsConstructor
public class ServiceAccountTokenGenerator {

    private final KeyMaterialDecoder keyDecoder;
    private final AssertionBuilder assertionBuilder;
    private final JwtBearerTokenClient tokenClient;
    private final Clock clock;

    public static ServiceAccountTokenGenerator create() {
        return new ServiceAccountTokenGenerator(
            new KeyMaterialDecoder(),
            new Rs256AssertionBuilder(),
            new JwtBearerTokenClient(),
            Clock.systemUTC());
    }

    public TokenResult generate(ServiceAccountTokenConfig config) {
        return generate(ConfigNormalizer.normalize(config));
    }

    public TokenResult generate(RequestConfig request) {
        log.debug("Generating service account token for: {}", request.serviceAccountId());
        URI tokenUrl = request.tokenEndpoint();

        SigningKey key = keyDecoder.decode(request.keySource());
        log.debug("Key decoded: {}", key);

        SignedAssertion assertion = assertionBuilder.build(
            request.serviceAccountId(), tokenUrl, request.lifetimeSeconds(), key);
        log.debug("Assertion signed: {}", assertion);

        TokenResult result = tokenClient.exchange(tokenUrl, assertion, request.scope());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("service_account_id", request.serviceAccountId());
        metadata.put("generated_at", clock.instant().getEpochSecond());
        metadata.put("platform", request.tokenEndpointBase());

        log.info("Token generated for service account {}, expires at {}", request.serviceAccountId(), result.expiresAt());
        return result.withMetadata(metadata);
    }
}
