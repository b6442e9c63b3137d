package com.hpcwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeState {

    FREE(0, "free"),
    BUSY(1, "busy"),
    OFFLINE(2, "offline"),
    DOWN(3, "down"),
    UNKNOWN(-1, "unknown");

    private final int code;
    private final String wireName;

    NodeState(int code, String wireName) {
        this.code = code;
        this.wireName = wireName;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static NodeState fromCode(long code) {
        for (NodeState state : values()) {
            if (state != UNKNOWN && state.code == code) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
