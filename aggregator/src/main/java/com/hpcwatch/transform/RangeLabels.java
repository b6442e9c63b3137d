package com.hpcwatch.transform;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.LongFunction;

public final class RangeLabels {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm", Locale.US);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter WEEKDAY_HOUR = DateTimeFormatter.ofPattern("EEE HH", Locale.US);

    private RangeLabels() {
    }

    public static LongFunction<String> general(String symbol, ZoneId zone) {
        DateTimeFormatter formatter = "1h".equals(symbol) || "24h".equals(symbol) ? CLOCK : DAY;
        return epochSecond -> formatter.format(Instant.ofEpochSecond(epochSecond).atZone(zone));
    }

    public static LongFunction<String> power(String symbol, ZoneId zone) {
        DateTimeFormatter formatter = switch (symbol) {
            case "1d" -> CLOCK;
            case "7d" -> WEEKDAY_HOUR;
            default -> DAY;
        };
        return epochSecond -> formatter.format(Instant.ofEpochSecond(epochSecond).atZone(zone));
    }
}
