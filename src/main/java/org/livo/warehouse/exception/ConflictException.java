package org.livo.warehouse.exception;

public class ConflictException extends FulfillmentException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
