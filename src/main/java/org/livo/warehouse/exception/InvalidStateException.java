package org.livo.warehouse.exception;

import lombok.Getter;

/**
 * State machine guard violation. Always carries the status that blocked the transition.
 */
@Getter
public class InvalidStateException extends FulfillmentException {

    private final String currentStatus;

    public InvalidStateException(String currentStatus, String message) {
        super(ErrorCode.INVALID_STATE, message);
        this.currentStatus = currentStatus;
    }
}
