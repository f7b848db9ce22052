package io.backup4j.core;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Global settings shared by every backup.
 *
 * @param timezone            zone used for schedule arithmetic, blank means UTC
 * @param startupDelay        interval expression; a positive delay starts the server paused
 * @param uploadSpeedLimit    size expression per second, blank means unlimited
 * @param additionalReportUrl appended to {@code send-http-json-urls} of every run
 */
public record ApplicationSettings(
        List<SettingEntry> options,
        List<FilterRule> filters,
        String timezone,
        String startupDelay,
        ThreadPriority threadPriority,
        String uploadSpeedLimit,
        String downloadSpeedLimit,
        String additionalReportUrl
) {

    public ApplicationSettings {
        options = options == null ? List.of() : List.copyOf(options);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static ApplicationSettings defaults() {
        return new ApplicationSettings(List.of(), List.of(), null, null, null, null, null, null);
    }

    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
