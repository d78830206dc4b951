package com.idp.sa.token;

import lombok.Getter;

/**
 * Missing or invalid request configuration, detected before any crypto or network work.
 */
@Getter
public class ConfigException extends TokenException {
    private final String field;

    public ConfigException(String field, String message) {
        super("Invalid configuration '" + field + "': " + message);
        this.field = field;
    }

    public ConfigException(String field, String message, Throwable cause) {
        super("Invalid configuration '" + field + "': " + message, cause);
        this.field = field;
    }
}
