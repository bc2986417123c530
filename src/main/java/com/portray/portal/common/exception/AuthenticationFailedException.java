package com.portray.portal.common.exception;

/**
 * Credentials or bearer token rejected. The message is deliberately generic.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
