package org.livo.warehouse.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.exception.ConflictException;
import org.livo.warehouse.mapper.OrderMapper;
import org.livo.warehouse.service.IOrderService;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderServiceImpl extends ServiceImpl<OrderMapper, Order> implements IOrderService {

    private final OrderMapper orderMapper;

    @Override
    public Order getForUpdate(Long id) {
        return orderMapper.selectByIdForUpdate(id);
    }

    @Override
    public void updateLocked(Order order) {
        int rows = orderMapper.updateWithVersion(order);
        if (rows == 0) {
            log.warn("[Order version conflict] orderId={}, version={}", order.getId(), order.getVersion());
            throw new ConflictException("Order " + order.getId() + " was modified concurrently");
        }
        order.setVersion(order.getVersion() + 1);
    }

    @Override
    public Order getByGineeId(String orderGineeId) {
        return orderMapper.selectOne(new LambdaQueryWrapper<Order>()
                .eq(Order::getOrderGineeId, orderGineeId));
    }

    @Override
    public Order getByTracking(String tracking) {
        return orderMapper.selectOne(new LambdaQueryWrapper<Order>()
                .eq(Order::getTracking, tracking));
    }
}
