package org.livo.warehouse.exception;

public class NotFoundException extends FulfillmentException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException order(Long orderId) {
        return new NotFoundException("Order not found: " + orderId);
    }

    public static NotFoundException user(Long userId) {
        return new NotFoundException("User not found: " + userId);
    }

    public static NotFoundException role(String roleName) {
        return new NotFoundException("Role not found: " + roleName);
    }
}
