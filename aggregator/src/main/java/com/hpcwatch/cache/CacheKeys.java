package com.hpcwatch.cache;

import java.util.regex.Pattern;

public final class CacheKeys {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]+");

    private CacheKeys() {
    }

    public static boolean isValid(String key) {
        return key != null && VALID.matcher(key).matches() && !key.startsWith(".");
    }

    public static String requireValid(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Invalid cache key: '" + key + "'");
        }
        return key;
    }
}
