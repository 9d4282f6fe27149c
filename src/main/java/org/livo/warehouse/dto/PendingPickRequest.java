package org.livo.warehouse.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Credentials of the coordinator approving a picker's pending request on the handheld.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingPickRequest {

    @NotBlank
    private String username;

    @NotBlank
    private String password;
}
