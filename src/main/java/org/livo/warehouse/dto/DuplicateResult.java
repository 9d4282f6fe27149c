package org.livo.warehouse.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.livo.warehouse.domain.Order;

/**
 * Both sides of a duplication: the source order under its renamed identifiers,
 * and the new order holding the original ones.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateResult {

    private Order originalOrder;
    private Order duplicatedOrder;
}
