package org.livo.warehouse.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.livo.warehouse.domain.PickedOrder;

@Mapper
public interface PickedOrderMapper extends BaseMapper<PickedOrder> {
}
