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
 * Outbound (hand-over to carrier) record, keyed by tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("outbounds")
public class Outbound {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String tracking;
    private Long outboundBy;

    /**
     * Carrier label, e.g. "JNE"
     */
    private String expedition;

    private String expeditionColor;
    private String expeditionSlug;
    private Boolean complained;
    private LocalDateTime createdAt;
}
