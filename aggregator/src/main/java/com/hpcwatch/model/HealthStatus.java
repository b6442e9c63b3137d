package com.hpcwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hardware health states reported by the metrics backend as {@code globalSystemStatus}.
 * <p>
 * {@link #severity()} defines the tie-break order used when several recent readings disagree:
 * {@code critical > non-recoverable > warning > other > ok}. {@link #UNKNOWN} has no severity and
 * is never selected over a real reading.
 */
public enum HealthStatus {

    OTHER(1, "other", "Other", 2),
    UNKNOWN(2, "unknown", "Unknown", 0),
    OK(3, "ok", "OK", 1),
    WARNING(4, "warning", "Warning", 3),
    CRITICAL(5, "critical", "Critical", 5),
    NON_RECOVERABLE(6, "non-recoverable", "Non-Recoverable", 4);

    public static final String NO_DATA_LABEL = "No Data";
    public static final int NO_DATA_CODE = -1;

    private final int code;
    private final String wireName;
    private final String label;
    private final int severity;

    HealthStatus(int code, String wireName, String label, int severity) {
        this.code = code;
        this.wireName = wireName;
        this.label = label;
        this.severity = severity;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public int severity() {
        return severity;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public static HealthStatus fromCode(int code) {
        for (HealthStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
