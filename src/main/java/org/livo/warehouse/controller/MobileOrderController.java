package org.livo.warehouse.controller;

import jakarta.validation.Valid;
import org.livo.warehouse.business.FulfillmentService;
import org.livo.warehouse.business.OrderQueryService;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.PickedOrder;
import org.livo.warehouse.dto.PendingPickRequest;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.ActingUserResolver;
import org.livo.warehouse.util.ResponseUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Picker handheld endpoints
 */
@RestController
@RequestMapping("/api/mobile/orders")
public class MobileOrderController {

    private final FulfillmentService fulfillmentService;
    private final OrderQueryService orderQueryService;
    private final ActingUserResolver actingUserResolver;

    public MobileOrderController(FulfillmentService fulfillmentService,
                                 OrderQueryService orderQueryService,
                                 ActingUserResolver actingUserResolver) {
        this.fulfillmentService = fulfillmentService;
        this.orderQueryService = orderQueryService;
        this.actingUserResolver = actingUserResolver;
    }

    @PutMapping("/{id}/pick")
    public ResponseEntity<Map<String, Object>> pick(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.pick(id, actor);
        return ResponseEntity.ok(ResponseUtil.success("Order picked successfully", order));
    }

    @PutMapping("/{id}/complete")
    public ResponseEntity<Map<String, Object>> completePicking(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        PickedOrder receipt = fulfillmentService.completePicking(id, actor);
        return ResponseEntity.ok(ResponseUtil.success("Picking completed successfully", receipt));
    }

    /**
     * Open to the picker holding the device; a coordinator approves with username and password in the body.
     */
    @PutMapping("/{id}/pending-pick")
    public ResponseEntity<Map<String, Object>> setPending(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody PendingPickRequest request) {
        ActingUser picker = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.setPendingApproved(id, request, picker);
        return ResponseEntity.ok(ResponseUtil.success("Order set to pending picking", order));
    }

    @GetMapping("/picked-orders/{pickedOrderId}")
    public ResponseEntity<Map<String, Object>> getPickedOrder(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long pickedOrderId) {
        actingUserResolver.resolve(userId);
        PickedOrder receipt = orderQueryService.getPickedOrder(pickedOrderId);
        return ResponseEntity.ok(ResponseUtil.success("Picked order retrieved successfully", receipt));
    }
}
