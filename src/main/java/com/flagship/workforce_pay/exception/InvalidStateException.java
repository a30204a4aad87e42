package com.flagship.workforce_pay.exception;

public class InvalidStateException extends WorkforcePayException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
