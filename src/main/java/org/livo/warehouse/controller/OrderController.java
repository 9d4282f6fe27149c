package org.livo.warehouse.controller;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.business.FulfillmentService;
import org.livo.warehouse.business.OrderIntakeService;
import org.livo.warehouse.business.OrderQueryService;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.dto.AssignPickerRequest;
import org.livo.warehouse.dto.BulkIntakeRequest;
import org.livo.warehouse.dto.BulkIntakeResult;
import org.livo.warehouse.dto.ComplainedRequest;
import org.livo.warehouse.dto.DuplicateResult;
import org.livo.warehouse.dto.OrderUpdateRequest;
import org.livo.warehouse.security.ActingUser;
import org.livo.warehouse.security.ActingUserResolver;
import org.livo.warehouse.util.ResponseUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Order endpoints (back office)
 * <p>
 * - GET  /api/orders/{id}                 order with details and products
 * - POST /api/orders/bulk                 bulk intake
 * - PUT  /api/orders/{id}                 edit header and details
 * - PUT  /api/orders/{id}/complained      set complained flag
 * - POST /api/orders/{id}/duplicate       admin
 * - PUT  /api/orders/{id}/cancel          admin
 * - PUT  /api/orders/{id}/pending-pick    coordinator
 * - PUT  /api/orders/{id}/assign-picker   coordinator
 * <p>
 * Role requirements are enforced by the service layer, not here.
 */
@Slf4j
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final FulfillmentService fulfillmentService;
    private final OrderIntakeService orderIntakeService;
    private final OrderQueryService orderQueryService;
    private final ActingUserResolver actingUserResolver;

    public OrderController(FulfillmentService fulfillmentService,
                           OrderIntakeService orderIntakeService,
                           OrderQueryService orderQueryService,
                           ActingUserResolver actingUserResolver) {
        this.fulfillmentService = fulfillmentService;
        this.orderIntakeService = orderIntakeService;
        this.orderQueryService = orderQueryService;
        this.actingUserResolver = actingUserResolver;
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getOrder(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        actingUserResolver.resolve(userId);
        Order order = orderQueryService.getOrder(id);
        return ResponseEntity.ok(ResponseUtil.success("Order retrieved successfully", order));
    }

    @PostMapping("/bulk")
    public ResponseEntity<Map<String, Object>> bulkCreate(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @Valid @RequestBody BulkIntakeRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        log.info("[Bulk intake request] orders={}, actorId={}", request.getOrders().size(), actor.getId());

        BulkIntakeResult result = orderIntakeService.bulkCreate(request.getOrders());
        String message = String.format("Bulk create completed: %d created, %d skipped, %d failed",
                result.getCreated(), result.getSkipped(), result.getFailed());
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseUtil.success(message, result));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updateOrder(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody OrderUpdateRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.updateOrder(id, request, actor);
        return ResponseEntity.ok(ResponseUtil.success("Order updated successfully", order));
    }

    @PutMapping("/{id}/complained")
    public ResponseEntity<Map<String, Object>> markComplained(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody ComplainedRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.markComplained(id, request.getComplained(), actor);
        return ResponseEntity.ok(ResponseUtil.success("Order complained status updated successfully", order));
    }

    @PostMapping("/{id}/duplicate")
    public ResponseEntity<Map<String, Object>> duplicateOrder(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        DuplicateResult result = fulfillmentService.duplicateOrder(id, actor);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResponseUtil.success("Order duplicated successfully", result));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelOrder(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.cancelOrder(id, actor);
        return ResponseEntity.ok(ResponseUtil.success("Order cancelled successfully", order));
    }

    @PutMapping("/{id}/pending-pick")
    public ResponseEntity<Map<String, Object>> setPending(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.setPending(id, actor);
        return ResponseEntity.ok(ResponseUtil.success("Order set to pending picking", order));
    }

    @PutMapping("/{id}/assign-picker")
    public ResponseEntity<Map<String, Object>> assignPicker(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody AssignPickerRequest request) {
        ActingUser actor = actingUserResolver.resolve(userId);
        Order order = fulfillmentService.assignPicker(id, request.getPickerId(), actor);
        return ResponseEntity.ok(ResponseUtil.success("Picker assigned successfully", order));
    }
}
