package org.livo.warehouse.business;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.domain.PickedOrder;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.BulkIntakeResult;
import org.livo.warehouse.dto.DuplicateResult;
import org.livo.warehouse.dto.OrderDetailRequest;
import org.livo.warehouse.dto.OrderIntakeRequest;
import org.livo.warehouse.dto.OrderUpdateRequest;
import org.livo.warehouse.exception.ConflictException;
import org.livo.warehouse.exception.InvalidStateException;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.livo.warehouse.mapper.PickedOrderMapper;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.service.IOrderDetailService;
import org.livo.warehouse.service.IOrderService;
import org.livo.warehouse.service.IUserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Fulfillment transitions against H2
 * - every test creates its own orders, nothing is rolled back by the test itself
 * - covers receipts, duplication, rollback on failed updates and the assignment race
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class FulfillmentServiceIntegrationTest {

    @Autowired
    private FulfillmentService fulfillmentService;

    @Autowired
    private OrderIntakeService orderIntakeService;

    @Autowired
    private OrderQueryService orderQueryService;

    @Autowired
    private IOrderService orderService;

    @Autowired
    private IOrderDetailService orderDetailService;

    @Autowired
    private IUserService userService;

    @Autowired
    private PickedOrderMapper pickedOrderMapper;

    private ActingUser actor(String username) {
        User user = userService.getOne(new LambdaQueryWrapper<User>().eq(User::getUsername, username));
        return ActingUser.of(user.getId(), userService.listRoleNames(user.getId()));
    }

    private static OrderIntakeRequest intakeRequest(String suffix) {
        List<OrderDetailRequest> lines = new ArrayList<>();
        lines.add(OrderDetailRequest.builder().sku("SKU-RED-01").productName("Satin Ribbon Red").variant("red").quantity(2).price(15000).build());
        lines.add(OrderDetailRequest.builder().sku("SKU-BLU-02").productName("Satin Ribbon Blue").variant("blue").quantity(1).price(15000).build());
        return OrderIntakeRequest.builder()
                .orderGineeId("GINEE-" + suffix)
                .tracking("JNE-" + suffix)
                .channel("shopee")
                .store("Livo Official")
                .buyer("Budi")
                .address("Jl. Merdeka 1")
                .courier("JNE")
                .orderDetails(lines)
                .build();
    }

    private Order newOrder() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        BulkIntakeResult result = orderIntakeService.bulkCreate(List.of(intakeRequest(suffix)));
        assertEquals(1, result.getCreated());
        return result.getCreatedOrders().get(0);
    }

    @Test
    void pickingCycleWritesExactlyOneReceipt() {
        ActingUser coordinator = actor("coord");
        ActingUser picker = actor("picker1");
        Order order = newOrder();

        fulfillmentService.assignPicker(order.getId(), picker.getId(), coordinator);
        PickedOrder receipt = fulfillmentService.completePicking(order.getId(), picker);

        assertEquals(picker.getId(), receipt.getPickedBy());
        assertEquals(2, receipt.getPickedOrderDetails().size());
        assertEquals(2, orderQueryService.getPickedOrder(receipt.getId()).getPickedOrderDetails().size());

        Order stored = orderService.getById(order.getId());
        assertEquals("picking complete", stored.getProcessingStatus());
        assertNotNull(stored.getPickedAt());

        assertThrows(InvalidStateException.class, () -> fulfillmentService.completePicking(order.getId(), picker));
        assertEquals(1L, pickedOrderMapper.selectCount(
                new LambdaQueryWrapper<PickedOrder>().eq(PickedOrder::getOrderId, order.getId())));
    }

    @Test
    void setPendingWritesNullsForClearedAttribution() {
        ActingUser coordinator = actor("coord");
        Order order = newOrder();
        fulfillmentService.assignPicker(order.getId(), actor("picker1").getId(), coordinator);

        fulfillmentService.setPending(order.getId(), coordinator);

        Order stored = orderService.getById(order.getId());
        assertEquals("pending picking", stored.getProcessingStatus());
        assertNull(stored.getPickedBy());
        assertNull(stored.getAssignedBy());
        assertNull(stored.getAssignedAt());
        assertEquals(coordinator.getId(), stored.getPendingBy());

        fulfillmentService.pick(order.getId(), actor("picker2"));
        assertEquals(actor("picker2").getId(), orderService.getById(order.getId()).getPickedBy());
    }

    @Test
    void duplicateSwapsIdentifiersAndCopiesDetails() {
        Order order = newOrder();
        String gineeId = order.getOrderGineeId();
        String tracking = order.getTracking();

        DuplicateResult result = fulfillmentService.duplicateOrder(order.getId(), actor("admin1"));

        Order source = orderService.getById(order.getId());
        assertEquals(gineeId + "-X2", source.getOrderGineeId());
        assertEquals("X-" + tracking, source.getTracking());

        Order copy = orderService.getByGineeId(gineeId);
        assertEquals(result.getDuplicatedOrder().getId(), copy.getId());
        assertEquals(tracking, copy.getTracking());
        assertEquals("duplicated", copy.getEventStatus());
        assertEquals("ready to pick", copy.getProcessingStatus());
        assertEquals(2, orderDetailService.listByOrderId(copy.getId()).size());
        assertEquals(2, orderDetailService.listByOrderId(source.getId()).size());
    }

    @Test
    void failedUpdateLeavesOrderUntouched() {
        Order order = newOrder();
        Integer version = orderService.getById(order.getId()).getVersion();
        OrderUpdateRequest emptied = OrderUpdateRequest.builder()
                .channel("tokopedia").store("Livo 2").buyer("Sari").address("Jl. Sudirman 5")
                .courier("SiCepat").tracking(order.getTracking()).orderDetails(List.of()).build();

        assertThrows(ValidationFailedException.class,
                () -> fulfillmentService.updateOrder(order.getId(), emptied, actor("admin1")));

        Order stored = orderService.getById(order.getId());
        assertEquals("shopee", stored.getChannel());
        assertNull(stored.getEventStatus());
        assertEquals(version, stored.getVersion());
        assertEquals(2, orderDetailService.listByOrderId(order.getId()).size());
    }

    @Test
    void updateReconcilesDetailLines() {
        Order order = newOrder();
        List<OrderDetail> lines = orderDetailService.listByOrderId(order.getId());
        OrderUpdateRequest request = OrderUpdateRequest.builder()
                .channel("tokopedia").store("Livo 2").buyer("Sari").address("Jl. Sudirman 5")
                .courier("SiCepat").tracking(order.getTracking())
                .orderDetails(List.of(
                        OrderDetailRequest.builder().id(lines.get(0).getId()).sku("SKU-RED-01")
                                .productName("Satin Ribbon Red").quantity(7).build(),
                        OrderDetailRequest.builder().id(0L).sku("SKU-GRN-03")
                                .productName("Satin Ribbon Green").quantity(1).build()))
                .build();

        Order updated = fulfillmentService.updateOrder(order.getId(), request, actor("admin1"));

        assertEquals("changed", updated.getEventStatus());
        List<OrderDetail> stored = orderDetailService.listByOrderId(order.getId());
        assertEquals(2, stored.size());
        assertEquals(7, stored.get(0).getQuantity());
        assertEquals("SKU-GRN-03", stored.get(1).getSku());
    }

    @Test
    void updateClearsOptionalLineFields() {
        Order order = newOrder();
        List<OrderDetail> lines = orderDetailService.listByOrderId(order.getId());
        assertEquals("red", lines.get(0).getVariant());
        OrderUpdateRequest request = OrderUpdateRequest.builder()
                .channel("shopee").store("Livo Official").buyer("Budi").address("Jl. Merdeka 1")
                .courier("JNE").tracking(order.getTracking())
                .orderDetails(List.of(
                        OrderDetailRequest.builder().id(lines.get(0).getId()).sku("SKU-RED-01")
                                .productName("Satin Ribbon Red").variant(null).price(null).quantity(2).build()))
                .build();

        fulfillmentService.updateOrder(order.getId(), request, actor("admin1"));

        OrderDetail stored = orderDetailService.getById(lines.get(0).getId());
        assertNull(stored.getVariant());
        assertNull(stored.getPrice());
        assertEquals(1, orderDetailService.listByOrderId(order.getId()).size());
    }

    @Test
    void cancelledOrderRejectsAssignment() {
        Order order = newOrder();
        fulfillmentService.cancelOrder(order.getId(), actor("admin1"));

        assertThrows(InvalidStateException.class,
                () -> fulfillmentService.assignPicker(order.getId(), actor("picker1").getId(), actor("coord")));

        Order complained = fulfillmentService.markComplained(order.getId(), true, actor("admin1"));
        assertTrue(complained.getComplained());
    }

    @Test
    void missingOrderIsNotFound() {
        assertThrows(NotFoundException.class, () -> fulfillmentService.pick(Long.MAX_VALUE, actor("picker1")));
        assertThrows(NotFoundException.class,
                () -> fulfillmentService.assignPicker(newOrder().getId(), Long.MAX_VALUE, actor("coord")));
    }

    @Test
    void bulkIntakeSkipsKnownOrdersAndFailsEmptyOnes() {
        OrderIntakeRequest fresh = intakeRequest(UUID.randomUUID().toString().substring(0, 8));
        OrderIntakeRequest empty = intakeRequest(UUID.randomUUID().toString().substring(0, 8));
        empty.setOrderDetails(List.of());
        orderIntakeService.bulkCreate(List.of(fresh));

        BulkIntakeResult result = orderIntakeService.bulkCreate(List.of(fresh, empty));

        assertEquals(2, result.getTotal());
        assertEquals(0, result.getCreated());
        assertEquals(1, result.getSkipped());
        assertEquals(0, result.getSkippedOrders().get(0).getIndex());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getFailedOrders().get(0).getIndex());
        assertNull(orderService.getByGineeId(empty.getOrderGineeId()));
    }

    @Test
    void orderReadAttachesProductsBySku() {
        Order order = orderQueryService.getOrder(newOrder().getId());

        assertEquals("Rak A1-3", order.getOrderDetails().get(0).getProduct().getLocation());
        assertNull(order.getOrderDetails().get(1).getProduct());
    }

    /**
     * Concurrent assignment of one order: the row lock serialises the attempts,
     * so exactly one wins and every loser fails cleanly.
     */
    @Test
    void concurrentAssignmentHasExactlyOneWinner() throws Exception {
        Order order = newOrder();
        ActingUser coordinator = actor("coord");
        List<Long> pickers = List.of(actor("picker1").getId(), actor("picker2").getId());
        int threadCount = 8;

        log.info("====== Concurrent assignment, orderId={}, threads={} ======", order.getId(), threadCount);

        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        ConcurrentLinkedQueue<Long> winners = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < threadCount; i++) {
            Long pickerId = pickers.get(i % pickers.size());
            executorService.execute(() -> {
                try {
                    start.await();
                    fulfillmentService.assignPicker(order.getId(), pickerId, coordinator);
                    successCount.incrementAndGet();
                    winners.add(pickerId);
                } catch (InvalidStateException | ConflictException e) {
                    log.debug("Assignment lost: {}", e.getMessage());
                } catch (Throwable e) {
                    unexpected.add(e);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executorService.shutdown();

        log.info("Successes: {}, unexpected failures: {}", successCount.get(), unexpected.size());
        assertTrue(unexpected.isEmpty(), () -> "unexpected failures: " + unexpected);
        assertEquals(1, successCount.get());

        Order stored = orderService.getById(order.getId());
        assertEquals("picking process", stored.getProcessingStatus());
        assertEquals(winners.peek(), stored.getPickedBy());
        assertEquals(1, stored.getVersion());
    }
}
