package org.livo.warehouse.domain;

/**
 * Audit annotation on an order, orthogonal to {@link ProcessingStatus}.
 */
public enum EventStatus {

    CHANGED("changed"),
    DUPLICATED("duplicated"),
    CANCELLED("cancelled");

    private final String value;

    EventStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(String status) {
        return value.equals(status);
    }
}
