package org.livo.warehouse.exception;

public class ValidationFailedException extends FulfillmentException {

    public ValidationFailedException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
