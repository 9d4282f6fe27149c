package org.livo.warehouse.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkIntakeRequest {

    @NotEmpty
    private List<OrderIntakeRequest> orders;
}
