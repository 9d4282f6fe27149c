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

/**
 * Order line item. The product is a weak, read-time reference by sku.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("order_details")
public class OrderDetail {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long orderId;
    private String sku;
    private String productName;
    private String variant;
    private Integer quantity;
    private Integer price;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @TableField(exist = false)
    private Product product;

    /**
     * Copy of the line content for another order, without id or product.
     */
    public OrderDetail copyFor(Long targetOrderId, LocalDateTime now) {
        return OrderDetail.builder()
                .orderId(targetOrderId)
                .sku(sku)
                .productName(productName)
                .variant(variant)
                .quantity(quantity)
                .price(price)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
