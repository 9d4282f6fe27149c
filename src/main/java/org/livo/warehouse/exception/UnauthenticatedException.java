package org.livo.warehouse.exception;

public class UnauthenticatedException extends FulfillmentException {

    public UnauthenticatedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }
}
