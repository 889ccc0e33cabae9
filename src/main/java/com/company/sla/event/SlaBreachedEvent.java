package com.company.sla.event;

import com.company.sla.domain.SlaInstance;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published when an instance completes after its deadline. Handled by
 * {@code SlaBreachHandlerService}; other in-process listeners may subscribe too.
 */
@Getter
@AllArgsConstructor
public class SlaBreachedEvent {
    private final SlaInstance instance;
    // Wall-clock time past the deadline at completion
    private final long overdueMs;
}
