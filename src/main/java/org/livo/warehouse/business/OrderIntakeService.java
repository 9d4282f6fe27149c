package org.livo.warehouse.business;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.domain.ProcessingStatus;
import org.livo.warehouse.dto.BulkIntakeResult;
import org.livo.warehouse.dto.OrderDetailRequest;
import org.livo.warehouse.dto.OrderIntakeRequest;
import org.livo.warehouse.exception.FulfillmentException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.livo.warehouse.service.IOrderDetailService;
import org.livo.warehouse.service.IOrderService;
import org.livo.warehouse.util.TraceIdUtil;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk intake of marketplace orders
 * <p>
 * Entries are independent: each one is created in its own transaction, so a failed entry
 * neither rolls back nor blocks the others.
 * - order ginee id already present ⇒ skipped
 * - missing required field or no detail lines ⇒ failed, with the reason
 */
@Slf4j
@Service
public class OrderIntakeService {

    private final IOrderService orderService;
    private final IOrderDetailService orderDetailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public OrderIntakeService(IOrderService orderService,
                              IOrderDetailService orderDetailService,
                              TransactionTemplate transactionTemplate,
                              Clock clock) {
        this.orderService = orderService;
        this.orderDetailService = orderDetailService;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public BulkIntakeResult bulkCreate(List<OrderIntakeRequest> requests) {
        String traceId = TraceIdUtil.getTraceId();
        log.info("[Bulk intake started] total={}, traceId={}", requests.size(), traceId);

        BulkIntakeResult result = new BulkIntakeResult(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            OrderIntakeRequest request = requests.get(i);
            try {
                validate(request);
                if (orderService.getByGineeId(request.getOrderGineeId()) != null) {
                    result.getSkippedOrders().add(new BulkIntakeResult.Entry(i, request.getOrderGineeId(),
                            "order already exists"));
                    continue;
                }
                Order created = transactionTemplate.execute(status -> createOne(request));
                result.getCreatedOrders().add(created);
            } catch (FulfillmentException e) {
                log.warn("[Bulk intake entry rejected] index={}, orderGineeId={}, reason={}",
                        i, request.getOrderGineeId(), e.getMessage());
                result.getFailedOrders().add(new BulkIntakeResult.Entry(i, request.getOrderGineeId(), e.getMessage()));
            } catch (DataAccessException e) {
                log.error("[Bulk intake entry failed] index={}, orderGineeId={}, error={}",
                        i, request.getOrderGineeId(), e.getMessage(), e);
                result.getFailedOrders().add(new BulkIntakeResult.Entry(i, request.getOrderGineeId(),
                        "failed to create order: " + e.getMostSpecificCause().getMessage()));
            }
        }

        log.info("[Bulk intake finished] total={}, created={}, skipped={}, failed={}, traceId={}",
                result.getTotal(), result.getCreated(), result.getSkipped(), result.getFailed(), traceId);
        return result;
    }

    private Order createOne(OrderIntakeRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .orderGineeId(request.getOrderGineeId())
                .processingStatus(ProcessingStatus.READY_TO_PICK.value())
                .channel(request.getChannel())
                .store(request.getStore())
                .buyer(request.getBuyer())
                .address(request.getAddress())
                .courier(request.getCourier())
                .tracking(request.getTracking())
                .sentBefore(request.getSentBefore())
                .complained(false)
                .version(0)
                .deleted(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        orderService.save(order);

        List<OrderDetail> details = new ArrayList<>();
        for (OrderDetailRequest line : request.getOrderDetails()) {
            OrderDetail detail = OrderDetail.builder()
                    .orderId(order.getId())
                    .sku(line.getSku())
                    .productName(line.getProductName())
                    .variant(line.getVariant())
                    .quantity(line.getQuantity())
                    .price(line.getPrice())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            orderDetailService.save(detail);
            details.add(detail);
        }
        order.setOrderDetails(details);

        log.info("[Order created] orderId={}, orderGineeId={}, lines={}",
                order.getId(), order.getOrderGineeId(), details.size());
        return order;
    }

    private void validate(OrderIntakeRequest request) {
        if (!StringUtils.hasText(request.getOrderGineeId())) {
            throw new ValidationFailedException("order_ginee_id is required");
        }
        if (!StringUtils.hasText(request.getTracking())) {
            throw new ValidationFailedException("tracking is required");
        }
        if (request.getOrderDetails() == null || request.getOrderDetails().isEmpty()) {
            throw new ValidationFailedException("order must have at least one order detail");
        }
        for (OrderDetailRequest line : request.getOrderDetails()) {
            if (!StringUtils.hasText(line.getSku()) || line.getQuantity() == null || line.getQuantity() < 1) {
                throw new ValidationFailedException("every order detail needs a sku and a positive quantity");
            }
        }
    }
}
