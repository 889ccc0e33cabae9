package com.company.sla.domain.enums;

public enum SlaStatus {
    ACTIVE("SLA clock is running"),
    PAUSED("SLA clock is stopped"),
    MET("Completed on or before the deadline"),
    BREACHED("Completed after the deadline");

    private final String description;

    SlaStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == MET || this == BREACHED;
    }

    public boolean canPause() {
        return this == ACTIVE;
    }

    public boolean canResume() {
        return this == PAUSED;
    }

    public boolean canComplete() {
        return !isTerminal();
    }

    public static SlaStatus fromString(String status) {
        if (status == null) {
            return null;
        }
        return SlaStatus.valueOf(status.trim().toUpperCase());
    }
}
