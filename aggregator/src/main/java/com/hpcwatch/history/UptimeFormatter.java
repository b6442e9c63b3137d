package com.hpcwatch.history;

public final class UptimeFormatter {

    public static final String NOT_AVAILABLE = "N/A";

    private UptimeFormatter() {
    }

    public static String format(long seconds) {
        if (seconds <= 0) {
            return NOT_AVAILABLE;
        }
        long days = seconds / 86_400;
        long hours = (seconds % 86_400) / 3_600;
        long minutes = (seconds % 3_600) / 60;

        if (days > 0) {
            return days + "d " + hours + "h";
        } else if (hours > 0) {
            return hours + "h " + minutes + "m";
        } else {
            return minutes + "m";
        }
    }
}
