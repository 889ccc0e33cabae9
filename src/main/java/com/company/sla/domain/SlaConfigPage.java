package com.company.sla.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a config listing. {@code nextCursor} is null on the last page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfigPage {
    private List<SlaConfig> configs;
    private long total;
    private String nextCursor;
}
