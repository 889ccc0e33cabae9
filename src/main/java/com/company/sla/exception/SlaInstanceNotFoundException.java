package com.company.sla.exception;

public class SlaInstanceNotFoundException extends RuntimeException {
    public SlaInstanceNotFoundException(String instanceId) {
        super("SLA instance not found: " + instanceId);
    }
}
