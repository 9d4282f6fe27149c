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
 * Named permission class. Its rank is not stored here; it comes from the configured role hierarchy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("roles")
public class Role {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;
    private String description;
    private LocalDateTime createdAt;
}
