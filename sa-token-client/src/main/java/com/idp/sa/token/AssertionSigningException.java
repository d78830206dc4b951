package com.idp.sa.token;

/**
 * The authentication assertion could not be produced (signing or assertion id generation failed).
 */
public class AssertionSigningException extends TokenException {

    public AssertionSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
