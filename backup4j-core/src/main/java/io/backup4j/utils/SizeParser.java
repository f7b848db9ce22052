package io.backup4j.utils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats byte sizes such as "100kb" or "1.5 GB". Units are binary (1kb = 1024 bytes).
 */
public final class SizeParser {

    private static final Pattern SIZE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([kmgtp]?b?)$");
    private static final String[] UNITS = {"bytes", "KB", "MB", "GB", "TB", "PB"};

    private SizeParser() {
    }

    /**
     * @param defaultUnit applied when the value has no unit, e.g. "kb"
     */
    public static long parseSize(String value, String defaultUnit) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("size must not be empty");
        }
        Matcher m = SIZE.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid size: " + value);
        }
        String unit = m.group(2).isEmpty() ? defaultUnit : m.group(2);
        double amount = Double.parseDouble(m.group(1));
        return Math.round(amount * multiplier(unit == null ? "b" : unit.toLowerCase(Locale.ROOT)));
    }

    public static long parseSize(String value) {
        return parseSize(value, "b");
    }

    private static long multiplier(String unit) {
        return switch (unit) {
            case "", "b" -> 1L;
            case "k", "kb" -> 1L << 10;
            case "m", "mb" -> 1L << 20;
            case "g", "gb" -> 1L << 30;
            case "t", "tb" -> 1L << 40;
            case "p", "pb" -> 1L << 50;
            default -> throw new IllegalArgumentException("Unsupported size unit: " + unit);
        };
    }

    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " bytes";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
    }
}
