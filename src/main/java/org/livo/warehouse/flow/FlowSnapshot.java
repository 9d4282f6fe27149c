package org.livo.warehouse.flow;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Reconstructed journey of one tracking number, in fixed stage order QC → outbound → order.
 * A stage is null when no record exists for it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowSnapshot {

    private FlowType flowType;
    private String tracking;
    private QcStage qc;
    private OutboundStage outbound;
    private OrderStage order;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Operator {
        private Long id;
        private String username;
        private String fullName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class QcStage {
        private Operator operator;
        private LocalDateTime createdAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OutboundStage {
        private Operator operator;
        private String expedition;
        private String expeditionColor;
        private LocalDateTime createdAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OrderStage {
        private String tracking;
        private String orderGineeId;
        private boolean complained;
        private LocalDateTime createdAt;
    }
}
