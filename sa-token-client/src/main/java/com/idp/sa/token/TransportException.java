package com.idp.sa.token;

import java.net.URI;

import lombok.Getter;

/**
 * The token endpoint could not be reached: timeout, refused connection, TLS failure or interruption.
 */
@Getter
public class TransportException extends TokenException {
    private final URI tokenUrl;

    public TransportException(URI tokenUrl, Throwable cause) {
        super("Failed to reach token endpoint " + tokenUrl + ": " + cause.getClass().getSimpleName()
            + (cause.getMessage() == null ? "" : " - " + cause.getMessage()), cause);
        this.tokenUrl = tokenUrl;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
