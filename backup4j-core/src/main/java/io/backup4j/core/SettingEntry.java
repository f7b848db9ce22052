package io.backup4j.core;

import java.util.Objects;

/**
 * A named option. A leading {@code --} marks an override that wins over plain entries of the same layer.
 */
public record SettingEntry(String name, String value) {

    public static final String OVERRIDE_PREFIX = "--";

    public SettingEntry {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean isOverride() {
        return name.startsWith(OVERRIDE_PREFIX);
    }

    public String optionName() {
        return isOverride() ? name.substring(OVERRIDE_PREFIX.length()) : name;
    }
}
