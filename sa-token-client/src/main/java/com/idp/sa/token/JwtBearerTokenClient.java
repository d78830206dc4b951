package com.idp.sa.token;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.idp.sa.token.jwt.AssertionBuilder.SignedAssertion;

import lombok.extern.slf4j.Slf4j;

/**
 * Exchanges a signed assertion for an access token with the JWT-Bearer grant (RFC 7523).
 * One request per call; nothing is retried, a failed exchange needs a freshly signed assertion.
 */
@Slf4j
public record JwtBearerTokenClient(HttpClient http, Duration timeout, ObjectMapper mapper, Clock clock) {

    public static final String CLIENT_ID = "service-account";
    public static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final String USER_AGENT = "sa-token/0.1.0";

    public JwtBearerTokenClient() {
        this(DEFAULT_TIMEOUT);
    }

    public JwtBearerTokenClient(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(),
            timeout,
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
            Clock.systemUTC());
    }

    public JwtBearerTokenClient(HttpClient http, Duration timeout, ObjectMapper mapper, Clock clock) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    static final class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("token_type")
        String tokenType;

        @JsonProperty("expires_in")
        Long expiresIn;

        @JsonProperty("scope")
        String scope;
    }

    public TokenResult exchange(URI tokenUrl, SignedAssertion assertion, String scope) {
        Objects.requireNonNull(tokenUrl, "tokenUrl");
        Objects.requireNonNull(assertion, "assertion");

        HttpRequest req = HttpRequest.newBuilder(tokenUrl)
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .POST(HttpRequest.BodyPublishers.ofString(formBody(assertion.compact(), scope)))
            .build();

        log.debug("Making token request to {} (grant type {}, scope {})", tokenUrl, GRANT_TYPE, scope);
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException(tokenUrl, ie);
        } catch (IOException e) {
            throw new TransportException(tokenUrl, e);
        }

        int sc = resp.statusCode();
        log.debug("Response status: {}", sc);
        if (sc != 200) {
            throw new ExchangeException(tokenUrl, sc, resp.body());
        }

        TokenResponse tr;
        try {
            tr = mapper.readValue(resp.body(), TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(tokenUrl, "body is not valid JSON", e);
        }
        if (tr == null || isBlank(tr.accessToken) || isBlank(tr.tokenType)) {
            throw new ResponseParseException(tokenUrl, "missing access_token or token_type");
        }

        long expiresIn = tr.expiresIn == null ? 0 : tr.expiresIn;
        if (expiresIn < 0) {
            throw new ResponseParseException(tokenUrl, "invalid expires_in: " + expiresIn);
        }
        Instant now = clock.instant();
        Instant expiresAt;
        try {
            expiresAt = now.plusSeconds(expiresIn);
        } catch (ArithmeticException | DateTimeException e) {
            throw new ResponseParseException(tokenUrl, "invalid expires_in: " + expiresIn, e);
        }
        log.debug("Access token received (length: {} chars), token type {}, expires in {} seconds",
            tr.accessToken.length(), tr.tokenType, expiresIn);
        return new TokenResult(tr.accessToken, tr.tokenType, expiresIn, expiresAt, tr.scope, null);
    }

    static String formBody(String assertion, String scope) {
        StringBuilder form = new StringBuilder()
            .append("client_id=").append(encode(CLIENT_ID))
            .append("&grant_type=").append(encode(GRANT_TYPE))
            .append("&assertion=").append(encode(assertion));
        if (!isBlank(scope)) {
            form.append("&scope=").append(encode(scope));
        }
        return form.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
