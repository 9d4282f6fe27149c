package org.livo.warehouse.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.livo.warehouse.domain.Order;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a bulk intake: created orders, skipped duplicates, and failed entries by batch index.
 */
@Data
@NoArgsConstructor
public class BulkIntakeResult {

    private int total;
    private List<Order> createdOrders = new ArrayList<>();
    private List<Entry> skippedOrders = new ArrayList<>();
    private List<Entry> failedOrders = new ArrayList<>();

    public BulkIntakeResult(int total) {
        this.total = total;
    }

    public int getCreated() {
        return createdOrders.size();
    }

    public int getSkipped() {
        return skippedOrders.size();
    }

    public int getFailed() {
        return failedOrders.size();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private int index;
        private String orderGineeId;
        private String reason;
    }
}
