package com.hpcwatch.source;

public enum FetchErrorType {
    SOURCE_UNREACHABLE,
    SOURCE_REJECTED,
    MALFORMED_PAYLOAD,
    SCHEMA_MISMATCH
}
