package com.company.sla.event;

import com.company.sla.domain.SlaInstance;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SlaPausedEvent {
    private final SlaInstance instance;
}
