package org.livo.warehouse.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.livo.warehouse.domain.QcOnline;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface QcOnlineMapper extends BaseMapper<QcOnline> {

    /**
     * Same filters as {@link QcRibbonMapper#selectTrackingPage}.
     */
    @Select("""
            <script>
            SELECT DISTINCT tracking FROM qc_onlines
            WHERE tracking IS NOT NULL AND tracking != ''
            <if test="from != null"> AND created_at &gt;= #{from}</if>
            <if test="until != null"> AND created_at &lt; #{until}</if>
            <if test="search != null and search != ''"> AND tracking ILIKE CONCAT('%', #{search}, '%')</if>
            ORDER BY tracking
            LIMIT #{limit} OFFSET #{offset}
            </script>
            """)
    List<String> selectTrackingPage(@Param("from") LocalDateTime from,
                                    @Param("until") LocalDateTime until,
                                    @Param("search") String search,
                                    @Param("limit") int limit,
                                    @Param("offset") long offset);

    @Select("""
            <script>
            SELECT COUNT(DISTINCT tracking) FROM qc_onlines
            WHERE tracking IS NOT NULL AND tracking != ''
            <if test="from != null"> AND created_at &gt;= #{from}</if>
            <if test="until != null"> AND created_at &lt; #{until}</if>
            <if test="search != null and search != ''"> AND tracking ILIKE CONCAT('%', #{search}, '%')</if>
            </script>
            """)
    long countTrackings(@Param("from") LocalDateTime from,
                        @Param("until") LocalDateTime until,
                        @Param("search") String search);
}
