package org.livo.warehouse.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.mapper.OrderDetailMapper;
import org.livo.warehouse.service.IOrderDetailService;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class OrderDetailServiceImpl extends ServiceImpl<OrderDetailMapper, OrderDetail> implements IOrderDetailService {

    @Override
    public List<OrderDetail> listByOrderId(Long orderId) {
        return baseMapper.selectList(new LambdaQueryWrapper<OrderDetail>()
                .eq(OrderDetail::getOrderId, orderId)
                .orderByAsc(OrderDetail::getId));
    }

    @Override
    public void replaceContent(OrderDetail detail) {
        update(new LambdaUpdateWrapper<OrderDetail>()
                .eq(OrderDetail::getId, detail.getId())
                .set(OrderDetail::getSku, detail.getSku())
                .set(OrderDetail::getProductName, detail.getProductName())
                .set(OrderDetail::getVariant, detail.getVariant(), "jdbcType=VARCHAR")
                .set(OrderDetail::getQuantity, detail.getQuantity())
                .set(OrderDetail::getPrice, detail.getPrice(), "jdbcType=INTEGER")
                .set(OrderDetail::getUpdatedAt, detail.getUpdatedAt()));
    }
}
