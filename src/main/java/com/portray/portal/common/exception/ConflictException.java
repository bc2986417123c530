package com.portray.portal.common.exception;

/**
 * A uniqueness or structural rule would be broken by the request (duplicate email,
 * duplicate short code, deleting a menu group that still has pages).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
