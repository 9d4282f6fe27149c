package org.livo.warehouse.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("products")
public class Product {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String sku;
    private String name;
    private String image;
    private String variant;

    /**
     * Shelf location, e.g. "Rak A1-3"
     */
    private String location;

    private String barcode;
}
