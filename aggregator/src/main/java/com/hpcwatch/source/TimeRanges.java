package com.hpcwatch.source;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TimeRanges {

    public static final String DEFAULT_GENERAL = "24h";
    public static final String DEFAULT_POWER = "7d";

    private static final Map<String, RangeSpec> GENERAL = new LinkedHashMap<>();
    private static final Map<String, RangeSpec> POWER = new LinkedHashMap<>();

    static {
        register(GENERAL, new RangeSpec("1h", 3_600, 0, "1m"));
        register(GENERAL, new RangeSpec("24h", 86_400, 0, "5m"));
        register(GENERAL, new RangeSpec("7d", 604_800, 0, "30m"));
        register(GENERAL, new RangeSpec("30d", 2_592_000, 0, "4h"));

        register(POWER, new RangeSpec("yesterday", 86_400, 86_400, "1h"));
        register(POWER, new RangeSpec("1d", 86_400, 0, "1h"));
        register(POWER, new RangeSpec("7d", 604_800, 0, "6h"));
        register(POWER, new RangeSpec("30d", 2_592_000, 0, "1d"));
    }

    private TimeRanges() {
    }

    private static void register(Map<String, RangeSpec> table, RangeSpec spec) {
        table.put(spec.symbol(), spec);
    }

    public static RangeSpec general(String symbol) {
        return GENERAL.getOrDefault(symbol, GENERAL.get(DEFAULT_GENERAL));
    }

    public static RangeSpec power(String symbol) {
        return POWER.getOrDefault(symbol, POWER.get(DEFAULT_POWER));
    }

    public static boolean isGeneral(String symbol) {
        return GENERAL.containsKey(symbol);
    }

    public static boolean isPower(String symbol) {
        return POWER.containsKey(symbol);
    }

    public record RangeSpec(String symbol, long lookbackSeconds, long endOffsetSeconds, String step) {

        public QueryWindow resolve(Instant now) {
            long end = now.getEpochSecond() - endOffsetSeconds;
            return new QueryWindow(end - lookbackSeconds, end, step);
        }
    }

    public record QueryWindow(long start, long end, String step) {
    }
}
