package org.livo.warehouse.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Snapshot of one order line at pick completion time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("picked_order_details")
public class PickedOrderDetail {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long pickedOrderId;
    private String sku;
    private String productName;
    private String variant;
    private Integer quantity;
    private LocalDateTime createdAt;

    public static PickedOrderDetail snapshotOf(OrderDetail detail, Long pickedOrderId, LocalDateTime now) {
        return PickedOrderDetail.builder()
                .pickedOrderId(pickedOrderId)
                .sku(detail.getSku())
                .productName(detail.getProductName())
                .variant(detail.getVariant())
                .quantity(detail.getQuantity())
                .createdAt(now)
                .build();
    }
}
