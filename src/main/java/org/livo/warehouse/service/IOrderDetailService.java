package org.livo.warehouse.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.livo.warehouse.domain.OrderDetail;

import java.util.List;

public interface IOrderDetailService extends IService<OrderDetail> {

    /**
     * Detail lines of an order in insertion order
     */
    List<OrderDetail> listByOrderId(Long orderId);

    /**
     * Overwrite every editable column of the line, nulls included.
     */
    void replaceContent(OrderDetail detail);
}
