package org.livo.warehouse.exception;

/**
 * Failure taxonomy shared by every fulfillment and user-management operation.
 * None of them is retried internally.
 */
public enum ErrorCode {
    NOT_FOUND,
    INVALID_STATE,
    FORBIDDEN,
    CONFLICT,
    VALIDATION_FAILED,
    UNAUTHENTICATED
}
