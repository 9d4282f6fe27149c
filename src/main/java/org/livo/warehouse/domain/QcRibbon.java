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
 * Ribbon QC record, written by the QC station. Read here only to rebuild tracking flows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("qc_ribbons")
public class QcRibbon implements QcStageRecord {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String tracking;
    private Long qcBy;
    private Boolean complained;
    private LocalDateTime createdAt;
}
