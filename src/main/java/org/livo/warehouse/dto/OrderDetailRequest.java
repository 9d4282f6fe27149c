package org.livo.warehouse.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an order update or intake. {@code id} null or 0 means a new line.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderDetailRequest {

    private Long id;

    @NotBlank
    private String sku;

    @NotBlank
    private String productName;

    private String variant;

    @NotNull
    @Min(1)
    private Integer quantity;

    private Integer price;

    public boolean isNew() {
        return id == null || id == 0L;
    }
}
