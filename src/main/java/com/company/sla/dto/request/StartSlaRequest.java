package com.company.sla.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSlaRequest {
    @NotBlank(message = "SLA config ID is required")
    private String slaConfigId;

    @NotBlank(message = "Entity ID is required")
    private String entityId;
}
