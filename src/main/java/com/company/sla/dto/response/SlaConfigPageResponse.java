package com.company.sla.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfigPageResponse {
    private List<SlaConfigResponse> configs;
    private long total;
    private String nextCursor;
}
