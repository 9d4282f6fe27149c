package org.livo.warehouse.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Processing stages known to the fulfillment state machine.
 *
 * The column itself stays a free string: QC and outbound write their own values,
 * so an unknown value is never an error here.
 */
public enum ProcessingStatus {

    READY_TO_PICK("ready to pick"),
    PICKING_PROCESS("picking process"),
    PENDING_PICKING("pending picking"),
    PICKING_COMPLETE("picking complete"),
    QC_PROCESS("qc process"),
    QC_COMPLETE("qc complete"),
    COMPLETED("completed");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(String status) {
        return value.equals(status);
    }

    public static Optional<ProcessingStatus> fromValue(String status) {
        return Arrays.stream(values()).filter(s -> s.matches(status)).findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
