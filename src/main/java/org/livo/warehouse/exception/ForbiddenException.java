package org.livo.warehouse.exception;

public class ForbiddenException extends FulfillmentException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
