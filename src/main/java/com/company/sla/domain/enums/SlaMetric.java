package com.company.sla.domain.enums;

public enum SlaMetric {
    TIME_TO_FIRST_RESPONSE("Time to First Response"),
    TIME_TO_RESOLUTION("Time to Resolution"),
    TIME_TO_CLOSE("Time to Close");

    private final String label;

    SlaMetric(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
