package com.portray.portal.common.exception;

/**
 * Verification or password-setup token is unknown, already consumed or expired.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
