package io.backup4j.utils;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code %NAME%} placeholders in source paths, restore targets and filters.
 * Well-known folders are tried first, then environment variables. Unknown names are left as they are.
 */
public final class SpecialFolders {

    private static final Pattern PLACEHOLDER = Pattern.compile("%([A-Za-z0-9_]+)%");

    private final Map<String, String> folders;
    private final Map<String, String> environment;

    public SpecialFolders(Path home, Map<String, String> environment) {
        Objects.requireNonNull(home, "home must not be null");
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);

        Map<String, String> f = new LinkedHashMap<>();
        f.put("HOME", home.toString());
        f.put("MY_DOCUMENTS", home.resolve("Documents").toString());
        f.put("MY_MUSIC", home.resolve("Music").toString());
        f.put("MY_PICTURES", home.resolve("Pictures").toString());
        f.put("MY_VIDEOS", home.resolve("Videos").toString());
        f.put("DESKTOP", home.resolve("Desktop").toString());
        f.put("APPDATA", this.environment.getOrDefault("APPDATA", home.resolve(".config").toString()));
        f.put("TEMP", System.getProperty("java.io.tmpdir"));
        this.folders = Map.copyOf(f);
    }

    public static SpecialFolders system() {
        return new SpecialFolders(Path.of(System.getProperty("user.home")), System.getenv());
    }

    public String expand(String value) {
        return expand(value, false);
    }

    /**
     * Expand inside a regular expression filter; substituted paths are quoted.
     */
    public String expandRegex(String value) {
        return expand(value, true);
    }

    private String expand(String value, boolean quote) {
        if (value == null || value.indexOf('%') < 0) {
            return value;
        }
        Matcher m = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String replacement = folders.get(name);
            if (replacement == null) {
                replacement = environment.get(name);
            }
            if (replacement == null) {
                replacement = m.group();
            } else if (quote) {
                replacement = Pattern.quote(replacement);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
