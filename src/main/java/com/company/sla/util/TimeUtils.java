package com.company.sla.util;

public class TimeUtils {

    private static final long MS_PER_MINUTE = 60_000L;

    public static long minutesToMs(int minutes) {
        return minutes * MS_PER_MINUTE;
    }

    /**
     * Human readable duration, e.g. "2h 15m", "4m 30s", "-10m 0s" for overdue values
     */
    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        String sign = durationMs < 0 ? "-" : "";
        long abs = Math.abs(durationMs);

        long hours = abs / 3_600_000;
        long minutes = (abs % 3_600_000) / MS_PER_MINUTE;
        long seconds = (abs % MS_PER_MINUTE) / 1000;

        if (hours > 0) {
            return String.format("%s%dh %dm", sign, hours, minutes);
        } else if (minutes > 0) {
            return String.format("%s%dm %ds", sign, minutes, seconds);
        } else {
            return String.format("%s%ds", sign, seconds);
        }
    }
}
