package io.backup4j.internal.runner;

import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.SettingEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the effective option map of a run.
 * <p>
 * Lowest to highest precedence: application options, fixed backup identity keys, backup options,
 * job extra options. Within the application and backup layers an entry named {@code --name}
 * overrides a plain {@code name}. The interactive password module is always disabled last.
 */
public final class OptionLayers {

    public static final String DISABLED_MODULE = "console-password-input";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private OptionLayers() {
    }

    public static Map<String, String> merge(ApplicationSettings settings, BackupDefinition backup, Map<String, String> extraOptions) {
        Map<String, String> options = new LinkedHashMap<>();
        applyLayer(options, settings.options());

        options.put("backup-name", backup.name());
        options.put("dbpath", backup.dbPath());
        options.put("backup-id", "DB-" + backup.id());

        applyLayer(options, backup.settings());

        String reportUrl = settings.additionalReportUrl();
        if (reportUrl != null && !reportUrl.isBlank()) {
            String existing = options.get("send-http-json-urls");
            options.put("send-http-json-urls", existing == null || existing.isBlank() ? reportUrl : existing + ";" + reportUrl);
        }

        if (extraOptions != null) {
            options.putAll(extraOptions);
        }

        disableModule(options, DISABLED_MODULE);
        return options;
    }

    private static void applyLayer(Map<String, String> options, List<SettingEntry> entries) {
        for (SettingEntry e : entries) {
            if (!e.isOverride()) {
                options.put(e.name(), e.value());
            }
        }
        for (SettingEntry e : entries) {
            if (e.isOverride()) {
                options.put(e.optionName(), e.value());
            }
        }
    }

    static void disableModule(Map<String, String> options, String module) {
        List<String> enabled = split(options.get("enable-module"));
        if (enabled.removeIf(module::equals)) {
            if (enabled.isEmpty()) {
                options.remove("enable-module");
            } else {
                options.put("enable-module", String.join(",", enabled));
            }
        }

        List<String> disabled = split(options.get("disable-module"));
        if (!disabled.contains(module)) {
            disabled.add(module);
        }
        options.put("disable-module", String.join(",", disabled));
    }

    private static List<String> split(String value) {
        List<String> out = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return out;
        }
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }

    /**
     * A boolean option is on when present with a blank or truthy value.
     */
    public static boolean isEnabled(Map<String, String> options, String key) {
        if (!options.containsKey(key)) {
            return false;
        }
        String value = options.get(key);
        return value == null || value.isBlank() || TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
