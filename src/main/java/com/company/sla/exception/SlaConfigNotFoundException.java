package com.company.sla.exception;

public class SlaConfigNotFoundException extends RuntimeException {
    public SlaConfigNotFoundException(String slaConfigId) {
        super("SLA config not found: " + slaConfigId);
    }
}
