package com.flagship.workforce_pay.exception;

/**
 * The referenced entity does not exist, or exists outside the caller's ownership scope.
 */
public class NotFoundException extends WorkforcePayException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
