package com.idp.sa.token;

import java.net.URI;

import lombok.Getter;

/**
 * The token endpoint answered 200 but the body is not a usable token response.
 */
@Getter
public class ResponseParseException extends TokenException {
    private final URI tokenUrl;

    public ResponseParseException(URI tokenUrl, String message) {
        super("Invalid token response from " + tokenUrl + ": " + message);
        this.tokenUrl = tokenUrl;
    }

    public ResponseParseException(URI tokenUrl, String message, Throwable cause) {
        super("Invalid token response from " + tokenUrl + ": " + message, cause);
        this.tokenUrl = tokenUrl;
    }
}
