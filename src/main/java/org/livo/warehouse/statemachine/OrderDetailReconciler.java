package org.livo.warehouse.statemachine;

import lombok.Getter;
import org.livo.warehouse.domain.OrderDetail;
import org.livo.warehouse.dto.OrderDetailRequest;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diffs the stored detail lines of an order against the requested list.
 * <p>
 * - id null or 0: insert
 * - known id: update in place
 * - stored id absent from the request: delete
 * - unknown id: not found
 * - same id twice: validation failure
 * <p>
 * A plan that leaves the order without lines is rejected before anything is written.
 */
@Component
public class OrderDetailReconciler {

    public Plan reconcile(Long orderId, List<OrderDetail> existing, List<OrderDetailRequest> requested,
                          LocalDateTime now) {
        Map<Long, OrderDetail> existingById = new LinkedHashMap<>();
        for (OrderDetail detail : existing) {
            existingById.put(detail.getId(), detail);
        }

        Plan plan = new Plan();
        Set<Long> seen = new HashSet<>();
        for (OrderDetailRequest request : requested) {
            if (request.isNew()) {
                plan.inserts.add(OrderDetail.builder()
                        .orderId(orderId)
                        .sku(request.getSku())
                        .productName(request.getProductName())
                        .variant(request.getVariant())
                        .quantity(request.getQuantity())
                        .price(request.getPrice())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                continue;
            }
            if (!seen.add(request.getId())) {
                throw new ValidationFailedException("Order detail " + request.getId() + " is listed more than once");
            }
            OrderDetail current = existingById.remove(request.getId());
            if (current == null) {
                throw new NotFoundException("Order detail " + request.getId() + " not found for order " + orderId);
            }
            current.setSku(request.getSku());
            current.setProductName(request.getProductName());
            current.setVariant(request.getVariant());
            current.setQuantity(request.getQuantity());
            current.setPrice(request.getPrice());
            current.setUpdatedAt(now);
            plan.updates.add(current);
        }
        // whatever is left was omitted from the request
        plan.deleteIds.addAll(existingById.keySet());

        if (plan.remainingCount() == 0) {
            throw new ValidationFailedException("Order must have at least one order detail");
        }
        return plan;
    }

    @Getter
    public static class Plan {
        private final List<OrderDetail> inserts = new ArrayList<>();
        private final List<OrderDetail> updates = new ArrayList<>();
        private final List<Long> deleteIds = new ArrayList<>();

        public int remainingCount() {
            return inserts.size() + updates.size();
        }
    }
}
