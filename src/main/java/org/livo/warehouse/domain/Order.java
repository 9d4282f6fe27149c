package org.livo.warehouse.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableLogic;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Order entity, the unit of fulfillment work.
 *
 * Two independent status axes:
 * - processingStatus: the picking / QC / completion stage (see {@link ProcessingStatus})
 * - eventStatus: audit annotation, one of changed / duplicated / cancelled (see {@link EventStatus})
 *
 * Every attribution pair (xxxBy / xxxAt) is null until the transition that owns it runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("orders")
public class Order {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * External marketplace reference, unique.
     */
    private String orderGineeId;

    /**
     * Current processing stage. External subsystems (QC, outbound) may write values
     * this service does not originate.
     */
    private String processingStatus;

    /**
     * Nullable audit annotation: changed / duplicated / cancelled
     */
    private String eventStatus;

    private String channel;
    private String store;
    private String buyer;
    private String address;
    private String courier;

    /**
     * Shipping tracking number, unique. Joins this order to QC and outbound records.
     */
    private String tracking;

    private LocalDateTime sentBefore;

    private Long assignedBy;
    private LocalDateTime assignedAt;
    private Long pickedBy;
    private LocalDateTime pickedAt;
    private Long pendingBy;
    private LocalDateTime pendingAt;
    private Long changedBy;
    private LocalDateTime changedAt;
    private Long cancelledBy;
    private LocalDateTime cancelledAt;

    private Boolean complained;

    /**
     * Optimistic lock version
     */
    private Integer version;

    @TableLogic
    private Integer deleted;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @TableField(exist = false)
    @Builder.Default
    private List<OrderDetail> orderDetails = new ArrayList<>();

    public boolean isCancelled() {
        return EventStatus.CANCELLED.matches(eventStatus);
    }
}
