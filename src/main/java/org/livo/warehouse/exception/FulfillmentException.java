package org.livo.warehouse.exception;

import lombok.Getter;

/**
 * Base class of all terminal, caller-visible failures.
 * Thrown from inside a transaction it rolls the whole unit back.
 */
@Getter
public abstract class FulfillmentException extends RuntimeException {

    private final ErrorCode code;

    protected FulfillmentException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
