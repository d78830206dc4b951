package com.idp.sa.token;

import lombok.Getter;

/**
 * Malformed or incomplete private key description.
 */
@Getter
public class KeyMaterialException extends TokenException {
    private final String field;

    public KeyMaterialException(String field, String message) {
        super("Invalid key material '" + field + "': " + message);
        this.field = field;
    }

    public KeyMaterialException(String field, String message, Throwable cause) {
        super("Invalid key material '" + field + "': " + message, cause);
        this.field = field;
    }
}
