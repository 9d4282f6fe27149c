package org.livo.warehouse.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.livo.warehouse.domain.Order;

/**
 * Order persistence
 * <p>
 * Writers go through {@link #getForUpdate} and {@link #updateLocked} inside one transaction:
 * the row lock serialises competing transitions and the version check catches any writer
 * that bypassed the lock.
 */
public interface IOrderService extends IService<Order> {

    /**
     * SELECT ... FOR UPDATE
     *
     * @return the order, or null if it does not exist
     */
    Order getForUpdate(Long id);

    /**
     * Persist every column of a locked order and bump its version.
     *
     * @throws org.livo.warehouse.exception.ConflictException if the stored version no longer matches
     */
    void updateLocked(Order order);

    Order getByGineeId(String orderGineeId);

    Order getByTracking(String tracking);
}
