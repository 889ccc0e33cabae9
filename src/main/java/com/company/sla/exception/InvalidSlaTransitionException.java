package com.company.sla.exception;

import com.company.sla.domain.enums.SlaStatus;
import lombok.Getter;

/**
 * A lifecycle precondition failed: the instance is not in a state that allows
 * the requested transition, or another writer changed it first.
 */
@Getter
public class InvalidSlaTransitionException extends RuntimeException {

    public static final String SLA_NOT_ACTIVE = "SLA_NOT_ACTIVE";
    public static final String SLA_NOT_PAUSED = "SLA_NOT_PAUSED";
    public static final String SLA_CANNOT_COMPLETE = "SLA_CANNOT_COMPLETE";
    public static final String SLA_CONFIG_INACTIVE = "SLA_CONFIG_INACTIVE";
    public static final String SLA_CONCURRENT_UPDATE = "SLA_CONCURRENT_UPDATE";

    private final String code;
    private final SlaStatus currentStatus;

    public InvalidSlaTransitionException(String message, String code, SlaStatus currentStatus) {
        super(message);
        this.code = code;
        this.currentStatus = currentStatus;
    }
}
