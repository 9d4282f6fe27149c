package org.livo.warehouse.business;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.domain.PickedOrder;
import org.livo.warehouse.domain.PickedOrderDetail;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.DuplicateResult;
import org.livo.warehouse.dto.OrderUpdateRequest;
import org.livo.warehouse.dto.PendingPickRequest;
import org.livo.warehouse.exception.ConflictException;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.mapper.PickedOrderDetailMapper;
import org.livo.warehouse.mapper.PickedOrderMapper;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.CredentialVerifier;
import org.livo.warehouse.service.IOrderDetailService;
import org.livo.warehouse.service.IOrderService;
import org.livo.warehouse.service.IUserService;
import org.livo.warehouse.statemachine.OrderDetailReconciler;
import org.livo.warehouse.statemachine.OrderStateMachine;
import org.livo.warehouse.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Order fulfillment transitions
 * <p>
 * Every method is one transaction with the same shape:
 * 1. lock the order row (SELECT ... FOR UPDATE), missing order ⇒ NotFound
 * 2. load any other referenced entity, missing ⇒ NotFound
 * 3. run the transition on {@link OrderStateMachine} (permission, then state guards)
 * 4. write back with the version check, then any dependent rows
 * <p>
 * Any failure rolls the whole unit back, so a transition is never half applied.
 */
@Slf4j
@Service
public class FulfillmentService {

    private final IOrderService orderService;
    private final IOrderDetailService orderDetailService;
    private final IUserService userService;
    private final PickedOrderMapper pickedOrderMapper;
    private final PickedOrderDetailMapper pickedOrderDetailMapper;
    private final OrderStateMachine stateMachine;
    private final OrderDetailReconciler detailReconciler;
    private final CredentialVerifier credentialVerifier;
    private final Clock clock;

    public FulfillmentService(IOrderService orderService,
                              IOrderDetailService orderDetailService,
                              IUserService userService,
                              PickedOrderMapper pickedOrderMapper,
                              PickedOrderDetailMapper pickedOrderDetailMapper,
                              OrderStateMachine stateMachine,
                              OrderDetailReconciler detailReconciler,
                              CredentialVerifier credentialVerifier,
                              Clock clock) {
        this.orderService = orderService;
        this.orderDetailService = orderDetailService;
        this.userService = userService;
        this.pickedOrderMapper = pickedOrderMapper;
        this.pickedOrderDetailMapper = pickedOrderDetailMapper;
        this.stateMachine = stateMachine;
        this.detailReconciler = detailReconciler;
        this.credentialVerifier = credentialVerifier;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public Order assignPicker(Long orderId, Long pickerId, ActingUser actor) {
        Order order = lockOrder(orderId);
        User picker = userService.getById(pickerId);
        if (picker == null) {
            throw NotFoundException.user(pickerId);
        }

        stateMachine.assignPicker(order, picker, actor, now());
        orderService.updateLocked(order);

        log.info("[Picker assigned] orderId={}, pickerId={}, assignedBy={}, traceId={}",
                orderId, pickerId, actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    @Transactional(rollbackFor = Exception.class)
    public Order pick(Long orderId, ActingUser actor) {
        Order order = lockOrder(orderId);

        stateMachine.pick(order, actor, now());
        orderService.updateLocked(order);

        log.info("[Order picked] orderId={}, pickerId={}, traceId={}",
                orderId, actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    /**
     * Finish picking and write the receipt with a snapshot of the current detail lines.
     */
    @Transactional(rollbackFor = Exception.class)
    public PickedOrder completePicking(Long orderId, ActingUser actor) {
        Order order = lockOrder(orderId);
        LocalDateTime now = now();

        stateMachine.completePicking(order, actor, now);
        orderService.updateLocked(order);

        PickedOrder receipt = PickedOrder.builder()
                .orderId(order.getId())
                .pickedBy(actor.getId())
                .createdAt(now)
                .build();
        pickedOrderMapper.insert(receipt);

        for (OrderDetail detail : orderDetailService.listByOrderId(order.getId())) {
            PickedOrderDetail snapshot = PickedOrderDetail.snapshotOf(detail, receipt.getId(), now);
            pickedOrderDetailMapper.insert(snapshot);
            receipt.getPickedOrderDetails().add(snapshot);
        }

        log.info("[Picking completed] orderId={}, pickedOrderId={}, lines={}, pickerId={}, traceId={}",
                orderId, receipt.getId(), receipt.getPickedOrderDetails().size(), actor.getId(),
                TraceIdUtil.getTraceId());
        return receipt;
    }

    @Transactional(rollbackFor = Exception.class)
    public Order setPending(Long orderId, ActingUser actor) {
        Order order = lockOrder(orderId);
        Long previousPicker = order.getPickedBy();

        stateMachine.setPending(order, actor, now());
        orderService.updateLocked(order);

        log.info("[Order set to pending picking] orderId={}, previousPicker={}, actorId={}, traceId={}",
                orderId, previousPicker, actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    /**
     * Pending request from the picker's handheld, approved with a coordinator's username and password.
     * Credentials are checked first, then the order, then the approver's rank.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order setPendingApproved(Long orderId, PendingPickRequest approval, ActingUser picker) {
        ActingUser approver = credentialVerifier.verify(approval.getUsername(), approval.getPassword());
        Order order = lockOrder(orderId);

        stateMachine.setPendingApproved(order, picker, approver, now());
        orderService.updateLocked(order);

        log.info("[Order set to pending picking] orderId={}, pickerId={}, approvedBy={}, traceId={}",
                orderId, picker.getId(), approver.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    /**
     * Replace the header and reconcile the detail lines by id.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order updateOrder(Long orderId, OrderUpdateRequest request, ActingUser actor) {
        Order order = lockOrder(orderId);
        LocalDateTime now = now();

        stateMachine.update(order, request, actor, now);
        requireTrackingFree(order.getTracking(), order.getId());

        List<OrderDetail> existing = orderDetailService.listByOrderId(order.getId());
        OrderDetailReconciler.Plan plan = detailReconciler.reconcile(order.getId(), existing,
                request.getOrderDetails(), now);

        orderService.updateLocked(order);
        if (!plan.getDeleteIds().isEmpty()) {
            orderDetailService.removeByIds(plan.getDeleteIds());
        }
        for (OrderDetail detail : plan.getUpdates()) {
            orderDetailService.replaceContent(detail);
        }
        for (OrderDetail detail : plan.getInserts()) {
            orderDetailService.save(detail);
        }
        order.setOrderDetails(orderDetailService.listByOrderId(order.getId()));

        log.info("[Order updated] orderId={}, inserted={}, updated={}, deleted={}, actorId={}, traceId={}",
                orderId, plan.getInserts().size(), plan.getUpdates().size(), plan.getDeleteIds().size(),
                actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    @Transactional(rollbackFor = Exception.class)
    public Order cancelOrder(Long orderId, ActingUser actor) {
        Order order = lockOrder(orderId);

        stateMachine.cancel(order, actor, now());
        orderService.updateLocked(order);

        log.info("[Order cancelled] orderId={}, orderGineeId={}, actorId={}, traceId={}",
                orderId, order.getOrderGineeId(), actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    /**
     * Rename the source order and create a copy under its original identifiers, details included.
     * The source is written first so the unique identifiers are free when the copy is inserted.
     */
    @Transactional(rollbackFor = Exception.class)
    public DuplicateResult duplicateOrder(Long orderId, ActingUser actor) {
        Order source = lockOrder(orderId);
        LocalDateTime now = now();

        Order copy = stateMachine.duplicate(source, actor, now);
        if (orderService.getByGineeId(source.getOrderGineeId()) != null) {
            throw new ConflictException("Order ginee id " + source.getOrderGineeId() + " is already taken");
        }
        requireTrackingFree(source.getTracking(), source.getId());

        orderService.updateLocked(source);
        orderService.save(copy);

        List<OrderDetail> sourceDetails = orderDetailService.listByOrderId(source.getId());
        for (OrderDetail detail : sourceDetails) {
            OrderDetail copied = detail.copyFor(copy.getId(), now);
            orderDetailService.save(copied);
            copy.getOrderDetails().add(copied);
        }
        source.setOrderDetails(sourceDetails);

        log.info("[Order duplicated] sourceId={}, duplicateId={}, orderGineeId={}, lines={}, actorId={}, traceId={}",
                source.getId(), copy.getId(), copy.getOrderGineeId(), sourceDetails.size(), actor.getId(),
                TraceIdUtil.getTraceId());
        return new DuplicateResult(source, copy);
    }

    @Transactional(rollbackFor = Exception.class)
    public Order markComplained(Long orderId, boolean complained, ActingUser actor) {
        Order order = lockOrder(orderId);

        stateMachine.markComplained(order, complained, now());
        orderService.updateLocked(order);

        log.info("[Order complained flag set] orderId={}, complained={}, actorId={}, traceId={}",
                orderId, complained, actor.getId(), TraceIdUtil.getTraceId());
        return order;
    }

    private Order lockOrder(Long orderId) {
        Order order = orderService.getForUpdate(orderId);
        if (order == null) {
            throw NotFoundException.order(orderId);
        }
        return order;
    }

    private void requireTrackingFree(String tracking, Long ownerId) {
        Order holder = orderService.getByTracking(tracking);
        if (holder != null && !Objects.equals(holder.getId(), ownerId)) {
            throw new ConflictException("Tracking " + tracking + " is already used by order " + holder.getId());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
