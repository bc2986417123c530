package com.portray.portal.common.exception;

public class AlreadyVerifiedException extends RuntimeException {

    public AlreadyVerifiedException(String message) {
        super(message);
    }
}
