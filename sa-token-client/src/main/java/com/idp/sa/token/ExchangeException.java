package com.idp.sa.token;

import java.net.URI;

import lombok.Getter;

/**
 * The token endpoint rejected the exchange with a non-200 status.
 * The body is kept verbatim for diagnostics and is not assumed to be JSON.
 */
@Getter
public class ExchangeException extends TokenException {
    private final URI tokenUrl;
    private final int statusCode;
    private final String body;

    public ExchangeException(URI tokenUrl, int statusCode, String body) {
        super("Token request to " + tokenUrl + " failed: HTTP " + statusCode + " - " + body);
        this.tokenUrl = tokenUrl;
        this.statusCode = statusCode;
        this.body = body;
    }

    @Override
    public boolean isRetryable() {
        return statusCode >= 500;
    }
}
