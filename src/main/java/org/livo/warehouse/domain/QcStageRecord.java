package org.livo.warehouse.domain;

import java.time.LocalDateTime;

/**
 * Common view of the QC-stage record families (ribbon and online).
 */
public interface QcStageRecord {

    String getTracking();

    Long getQcBy();

    LocalDateTime getCreatedAt();
}
