package org.livo.warehouse.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Pick completion receipt
 * - created exactly once, when the assigned picker completes picking
 * - never updated afterwards
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("picked_orders")
public class PickedOrder {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * Internal id of the picked order
     */
    private Long orderId;

    /**
     * Picker user id
     */
    private Long pickedBy;

    private LocalDateTime createdAt;

    @TableField(exist = false)
    @Builder.Default
    private List<PickedOrderDetail> pickedOrderDetails = new ArrayList<>();
}
