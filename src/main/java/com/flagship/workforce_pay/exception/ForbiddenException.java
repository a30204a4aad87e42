package com.flagship.workforce_pay.exception;

public class ForbiddenException extends WorkforcePayException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
