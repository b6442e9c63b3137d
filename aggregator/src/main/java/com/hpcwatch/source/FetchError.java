package com.hpcwatch.source;

public record FetchError(FetchErrorType type, String source, String message, Throwable cause) {

    public static FetchError unreachable(String source, Throwable cause) {
        return new FetchError(FetchErrorType.SOURCE_UNREACHABLE, source, describe(cause), cause);
    }

    public static FetchError rejected(String source, String message) {
        return new FetchError(FetchErrorType.SOURCE_REJECTED, source, message, null);
    }

    public static FetchError rejected(String source, Throwable cause) {
        return new FetchError(FetchErrorType.SOURCE_REJECTED, source, describe(cause), cause);
    }

    public static FetchError malformed(String source, String message) {
        return new FetchError(FetchErrorType.MALFORMED_PAYLOAD, source, message, null);
    }

    public static FetchError schemaMismatch(String source, String message) {
        return new FetchError(FetchErrorType.SCHEMA_MISMATCH, source, message, null);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null ? cause.getClass().getSimpleName() + ": " + message : cause.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return type + " [" + source + "]: " + message;
    }
}
