package org.livo.warehouse.business;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.RequiredArgsConstructor;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.domain.PickedOrder;
import org.livo.warehouse.domain.PickedOrderDetail;
import org.livo.warehouse.domain.Product;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.mapper.PickedOrderDetailMapper;
import org.livo.warehouse.mapper.PickedOrderMapper;
import org.livo.warehouse.mapper.ProductMapper;
import org.livo.warehouse.service.IOrderDetailService;
import org.livo.warehouse.service.IOrderService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of orders and pick receipts. No locking.
 */
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final IOrderService orderService;
    private final IOrderDetailService orderDetailService;
    private final ProductMapper productMapper;
    private final PickedOrderMapper pickedOrderMapper;
    private final PickedOrderDetailMapper pickedOrderDetailMapper;

    /**
     * Order with its detail lines, each carrying the product that matches its sku (if any).
     */
    public Order getOrder(Long orderId) {
        Order order = orderService.getById(orderId);
        if (order == null) {
            throw NotFoundException.order(orderId);
        }
        List<OrderDetail> details = orderDetailService.listByOrderId(orderId);
        attachProducts(details);
        order.setOrderDetails(details);
        return order;
    }

    public PickedOrder getPickedOrder(Long pickedOrderId) {
        PickedOrder receipt = pickedOrderMapper.selectById(pickedOrderId);
        if (receipt == null) {
            throw new NotFoundException("Picked order not found: " + pickedOrderId);
        }
        receipt.setPickedOrderDetails(pickedOrderDetailMapper.selectList(
                new LambdaQueryWrapper<PickedOrderDetail>()
                        .eq(PickedOrderDetail::getPickedOrderId, pickedOrderId)
                        .orderByAsc(PickedOrderDetail::getId)));
        return receipt;
    }

    private void attachProducts(List<OrderDetail> details) {
        List<String> skus = details.stream().map(OrderDetail::getSku).distinct().collect(Collectors.toList());
        if (skus.isEmpty()) {
            return;
        }
        Map<String, Product> bySku = productMapper.selectList(new LambdaQueryWrapper<Product>().in(Product::getSku, skus))
                .stream()
                .collect(Collectors.toMap(Product::getSku, Function.identity(), (a, b) -> a));
        details.forEach(detail -> detail.setProduct(bySku.get(detail.getSku())));
    }
}
