package com.flagship.workforce_pay.exception;

public class ValidationException extends WorkforcePayException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
