package org.livo.warehouse.statemachine;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.config.WarehouseProperties;
import org.livo.warehouse.domain.EventStatus;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.ProcessingStatus;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.OrderUpdateRequest;
import org.livo.warehouse.exception.ForbiddenException;
import org.livo.warehouse.exception.InvalidStateException;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.AuthorizationGuard;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Set;

/**
 * Order fulfillment state machine
 * <p>
 * Owns the guards and in-memory effects of every transition. It never touches the database:
 * the caller loads the order under a row lock, runs the transition here, then persists the
 * result with a version check inside the same transaction.
 * <p>
 * Guards on processing status are exclusion lists. Statuses written by the QC and outbound
 * stations are opaque here and pass unless they are one of the protected in-flight states.
 * The event status axis is checked separately: a cancelled order accepts no mutating
 * transition except the complained flag.
 * <p>
 * Permission is checked before any state guard.
 */
@Slf4j
@Component
public class OrderStateMachine {

    private static final Set<String> ASSIGN_BLOCKED = Set.of(
            ProcessingStatus.PICKING_PROCESS.value(),
            ProcessingStatus.QC_PROCESS.value(),
            ProcessingStatus.COMPLETED.value());

    private static final Set<String> MODIFY_BLOCKED = Set.of(
            ProcessingStatus.PICKING_PROCESS.value(),
            ProcessingStatus.QC_PROCESS.value());

    private static final Set<String> PICKABLE = Set.of(
            ProcessingStatus.READY_TO_PICK.value(),
            ProcessingStatus.PENDING_PICKING.value());

    private final AuthorizationGuard authorizationGuard;
    private final WarehouseProperties.Fulfillment settings;

    public OrderStateMachine(AuthorizationGuard authorizationGuard, WarehouseProperties properties) {
        this.authorizationGuard = authorizationGuard;
        this.settings = properties.getFulfillment();
    }

    /**
     * Coordinator hands the order to a picker.
     */
    public void assignPicker(Order order, User picker, ActingUser actor, LocalDateTime now) {
        authorizationGuard.requireRank(actor, settings.getAssignPickerRole(), "assign pickers");
        requireNotCancelled(order, "assign a picker to");
        String status = order.getProcessingStatus();
        if (ProcessingStatus.PICKING_PROCESS.matches(status)) {
            throw new InvalidStateException(status, "Order " + order.getId() + " is already in picking process");
        }
        if (ASSIGN_BLOCKED.contains(status)) {
            throw new InvalidStateException(status,
                    "Cannot assign picker when processing status is '" + status + "'");
        }

        order.setAssignedBy(actor.getId());
        order.setAssignedAt(now);
        order.setPickedBy(picker.getId());
        order.setProcessingStatus(ProcessingStatus.PICKING_PROCESS.value());
        order.setUpdatedAt(now);
    }

    /**
     * Picker takes an available order for themself.
     */
    public void pick(Order order, ActingUser actor, LocalDateTime now) {
        requireNotCancelled(order, "pick");
        String status = order.getProcessingStatus();
        if (!PICKABLE.contains(status)) {
            throw new InvalidStateException(status,
                    "Order is not available for picking, processing status is '" + status + "'");
        }

        order.setPickedBy(actor.getId());
        order.setPickedAt(now);
        order.setProcessingStatus(ProcessingStatus.PICKING_PROCESS.value());
        order.setUpdatedAt(now);
    }

    /**
     * Assigned picker finishes. The caller writes the {@code PickedOrder} receipt in the same transaction.
     */
    public void completePicking(Order order, ActingUser actor, LocalDateTime now) {
        requireNotCancelled(order, "complete picking of");
        String status = order.getProcessingStatus();
        if (!ProcessingStatus.PICKING_PROCESS.matches(status)) {
            throw new InvalidStateException(status,
                    "Only orders in 'picking process' can be completed, processing status is '" + status + "'");
        }
        if (!Objects.equals(order.getPickedBy(), actor.getId())) {
            log.warn("[Complete picking denied] orderId={}, pickedBy={}, actorId={}",
                    order.getId(), order.getPickedBy(), actor.getId());
            throw new ForbiddenException("Order " + order.getId() + " is not assigned to the current picker");
        }

        order.setProcessingStatus(ProcessingStatus.PICKING_COMPLETE.value());
        if (order.getPickedAt() == null) {
            order.setPickedAt(now);
        }
        order.setUpdatedAt(now);
    }

    /**
     * Puts an in-flight pick back into the unassigned pool.
     */
    public void setPending(Order order, ActingUser actor, LocalDateTime now) {
        authorizationGuard.requireRank(actor, settings.getPendingRole(), "set orders to pending picking");
        markPending(order, actor.getId(), now);
    }

    /**
     * Handheld variant: the picker asks, a coordinator approves on the spot.
     * The approver needs the pending rank, the picker is recorded as pending-by.
     */
    public void setPendingApproved(Order order, ActingUser picker, ActingUser approver, LocalDateTime now) {
        authorizationGuard.requireRank(approver, settings.getPendingRole(), "approve pending picking");
        markPending(order, picker.getId(), now);
    }

    private void markPending(Order order, Long pendingBy, LocalDateTime now) {
        requireNotCancelled(order, "set pending");
        String status = order.getProcessingStatus();
        if (!ProcessingStatus.PICKING_PROCESS.matches(status)) {
            throw new InvalidStateException(status,
                    "Only orders in 'picking process' can be set to pending picking, processing status is '"
                            + status + "'");
        }

        order.setProcessingStatus(ProcessingStatus.PENDING_PICKING.value());
        order.setPendingBy(pendingBy);
        order.setPendingAt(now);
        order.setPickedBy(null);
        order.setAssignedBy(null);
        order.setAssignedAt(null);
        order.setUpdatedAt(now);
    }

    /**
     * Header part of an order edit. Detail lines are reconciled by {@link OrderDetailReconciler}.
     */
    public void update(Order order, OrderUpdateRequest request, ActingUser actor, LocalDateTime now) {
        requireModifiable(order);

        order.setChannel(request.getChannel());
        order.setStore(request.getStore());
        order.setBuyer(request.getBuyer());
        order.setAddress(request.getAddress());
        order.setCourier(request.getCourier());
        order.setTracking(request.getTracking());
        if (request.getSentBefore() != null) {
            order.setSentBefore(request.getSentBefore());
        }
        order.setEventStatus(EventStatus.CHANGED.value());
        order.setChangedBy(actor.getId());
        order.setChangedAt(now);
        order.setUpdatedAt(now);
    }

    public void cancel(Order order, ActingUser actor, LocalDateTime now) {
        authorizationGuard.requireRank(actor, settings.getCancelRole(), "cancel orders");
        requireModifiable(order);

        order.setEventStatus(EventStatus.CANCELLED.value());
        order.setCancelledBy(actor.getId());
        order.setCancelledAt(now);
        order.setUpdatedAt(now);
    }

    /**
     * Frees the source order's identifiers and returns the unsaved copy that takes them over.
     * The caller copies the detail lines once the copy has an id.
     */
    public Order duplicate(Order source, ActingUser actor, LocalDateTime now) {
        authorizationGuard.requireRank(actor, settings.getDuplicateRole(), "duplicate orders");
        requireModifiable(source);

        String originalGineeId = source.getOrderGineeId();
        String originalTracking = source.getTracking();

        source.setOrderGineeId(originalGineeId + settings.getDuplicateIdSuffix());
        source.setTracking(settings.getDuplicateTrackingPrefix() + originalTracking);
        source.setUpdatedAt(now);

        return Order.builder()
                .orderGineeId(originalGineeId)
                .tracking(originalTracking)
                .processingStatus(source.getProcessingStatus())
                .eventStatus(EventStatus.DUPLICATED.value())
                .channel(source.getChannel())
                .store(source.getStore())
                .buyer(source.getBuyer())
                .address(source.getAddress())
                .courier(source.getCourier())
                .sentBefore(source.getSentBefore())
                .complained(false)
                .changedBy(actor.getId())
                .changedAt(now)
                .version(0)
                .deleted(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Independent of both status axes.
     */
    public void markComplained(Order order, boolean complained, LocalDateTime now) {
        order.setComplained(complained);
        order.setUpdatedAt(now);
    }

    /**
     * Shared guard of update, cancel and duplicate.
     */
    void requireModifiable(Order order) {
        String status = order.getProcessingStatus();
        if (MODIFY_BLOCKED.contains(status)) {
            throw new InvalidStateException(status,
                    "Cannot modify order when processing status is '" + status + "'");
        }
        requireNotCancelled(order, "modify");
    }

    private void requireNotCancelled(Order order, String action) {
        if (order.isCancelled()) {
            throw new InvalidStateException(order.getEventStatus(),
                    "Order " + order.getId() + " is cancelled, cannot " + action + " it");
        }
    }
}
