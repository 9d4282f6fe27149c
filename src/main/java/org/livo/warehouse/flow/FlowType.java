package org.livo.warehouse.flow;

/**
 * QC-stage record family that anchors a tracking flow.
 */
public enum FlowType {

    RIBBON("qc-ribbon"),
    ONLINE("qc-online");

    private final String stageName;

    FlowType(String stageName) {
        this.stageName = stageName;
    }

    /**
     * Name of the anchor stage, as used in messages
     */
    public String stageName() {
        return stageName;
    }
}
