package org.livo.warehouse.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One marketplace order in a bulk intake batch. Checked per entry by the intake service,
 * so a bad entry fails alone instead of rejecting the batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderIntakeRequest {

    private String orderGineeId;
    private String channel;
    private String store;
    private String buyer;
    private String address;
    private String courier;
    private String tracking;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm[:ss]")
    private LocalDateTime sentBefore;

    @Builder.Default
    private List<OrderDetailRequest> orderDetails = new ArrayList<>();
}
