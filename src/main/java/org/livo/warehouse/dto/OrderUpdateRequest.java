package org.livo.warehouse.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Replacement header fields plus the full desired detail list.
 * Existing detail ids missing from {@link #orderDetails} are deleted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderUpdateRequest {

    @NotBlank
    private String channel;

    @NotBlank
    private String store;

    @NotBlank
    private String buyer;

    @NotBlank
    private String address;

    @NotBlank
    private String courier;

    @NotBlank
    private String tracking;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm[:ss]")
    private LocalDateTime sentBefore;

    @Valid
    @Builder.Default
    private List<OrderDetailRequest> orderDetails = new ArrayList<>();
}
