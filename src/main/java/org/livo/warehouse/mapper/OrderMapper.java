package org.livo.warehouse.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.livo.warehouse.domain.Order;

@Mapper
public interface OrderMapper extends BaseMapper<Order> {

    /**
     * Load an order under a row lock (pessimistic)
     *
     * @param id internal order id
     * @return the order, or null when absent or soft-deleted
     */
    @Select("SELECT * FROM orders WHERE id = #{id} AND deleted = 0 FOR UPDATE")
    Order selectByIdForUpdate(@Param("id") Long id);

    /**
     * Write back every mutable column of a locked order (optimistic version check).
     * Nullable columns are written as given, so a cleared attribution becomes SQL NULL.
     *
     * @return rows updated, 0 when the version moved on
     */
    @Update("""
            UPDATE orders
            SET order_ginee_id = #{orderGineeId},
                processing_status = #{processingStatus},
                event_status = #{eventStatus, jdbcType=VARCHAR},
                channel = #{channel},
                store = #{store},
                buyer = #{buyer},
                address = #{address},
                courier = #{courier},
                tracking = #{tracking},
                sent_before = #{sentBefore, jdbcType=TIMESTAMP},
                assigned_by = #{assignedBy, jdbcType=BIGINT},
                assigned_at = #{assignedAt, jdbcType=TIMESTAMP},
                picked_by = #{pickedBy, jdbcType=BIGINT},
                picked_at = #{pickedAt, jdbcType=TIMESTAMP},
                pending_by = #{pendingBy, jdbcType=BIGINT},
                pending_at = #{pendingAt, jdbcType=TIMESTAMP},
                changed_by = #{changedBy, jdbcType=BIGINT},
                changed_at = #{changedAt, jdbcType=TIMESTAMP},
                cancelled_by = #{cancelledBy, jdbcType=BIGINT},
                cancelled_at = #{cancelledAt, jdbcType=TIMESTAMP},
                complained = #{complained},
                updated_at = #{updatedAt},
                version = version + 1
            WHERE id = #{id}
              AND version = #{version}
              AND deleted = 0
            """)
    int updateWithVersion(Order order);
}
