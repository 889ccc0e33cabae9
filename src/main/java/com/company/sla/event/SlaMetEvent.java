package com.company.sla.event;

import com.company.sla.domain.SlaInstance;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SlaMetEvent {
    private final SlaInstance instance;
}
