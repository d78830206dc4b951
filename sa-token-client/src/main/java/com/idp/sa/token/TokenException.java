package com.idp.sa.token;

/**
 * Base of every failure raised while acquiring a service-account token.
 * Messages name fields, URLs and status codes only, never key material or signed assertions.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether re-running the whole pipeline (fresh assertion included) may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
