package io.backup4j.core;

import java.util.Locale;

public enum ThreadPriority {
    LOWEST,
    BELOW_NORMAL,
    NORMAL,
    ABOVE_NORMAL,
    HIGHEST;

    /**
     * Lenient parse accepting {@code belownormal}, {@code below-normal} and {@code BELOW_NORMAL}.
     *
     * @return null for a blank or unknown value
     */
    public static ThreadPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String key = value.trim().replace("-", "").replace("_", "").toUpperCase(Locale.ROOT);
        for (ThreadPriority p : values()) {
            if (p.name().replace("_", "").equals(key)) {
                return p;
            }
        }
        return null;
    }
}
