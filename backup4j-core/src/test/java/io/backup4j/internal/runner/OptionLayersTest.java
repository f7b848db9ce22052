package io.backup4j.internal.runner;

import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.SettingEntry;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptionLayersTest {

    private static ApplicationSettings settings(List<SettingEntry> options, String reportUrl) {
        return new ApplicationSettings(options, null, null, null, null, null, null, reportUrl);
    }

    @Test
    void laterLayersShouldWin() {
        ApplicationSettings app = settings(List.of(
                new SettingEntry("zip-level", "1"),
                new SettingEntry("retry", "3")), null);
        BackupDefinition backup = BackupDefinition.of("7", "Docs", "file:///x")
                .withSettings(List.of(new SettingEntry("zip-level", "5")));

        Map<String, String> options = OptionLayers.merge(app, backup, Map.of("retry", "9"));

        assertEquals("5", options.get("zip-level"));
        assertEquals("9", options.get("retry"));
        assertEquals("DB-7", options.get("backup-id"));
        assertEquals("Docs", options.get("backup-name"));
    }

    @Test
    void overrideShouldBeatPlainEntryOfSameLayer() {
        ApplicationSettings app = settings(List.of(
                new SettingEntry("--zip-level", "9"),
                new SettingEntry("zip-level", "1")), null);
        BackupDefinition backup = BackupDefinition.of("7", "Docs", "file:///x");

        assertEquals("9", OptionLayers.merge(app, backup, Map.of()).get("zip-level"));
    }

    @Test
    void backupOverrideShouldBeatApplicationOverride() {
        ApplicationSettings app = settings(List.of(new SettingEntry("--retry", "1")), null);
        BackupDefinition backup = BackupDefinition.of("7", "Docs", "file:///x")
                .withSettings(List.of(new SettingEntry("--retry", "4"), new SettingEntry("retry", "2")));

        assertEquals("4", OptionLayers.merge(app, backup, Map.of()).get("retry"));
    }

    @Test
    void passwordModuleShouldAlwaysBeDisabled() {
        BackupDefinition backup = BackupDefinition.of("7", "Docs", "file:///x")
                .withSettings(List.of(new SettingEntry("enable-module", "console-password-input,http-report")));

        Map<String, String> extra = new HashMap<>();
        extra.put("disable-module", "sendmail");
        Map<String, String> options = OptionLayers.merge(settings(null, null), backup, extra);

        assertEquals("http-report", options.get("enable-module"));
        assertEquals("sendmail,console-password-input", options.get("disable-module"));
    }

    @Test
    void reportUrlShouldBeAppended() {
        BackupDefinition backup = BackupDefinition.of("7", "Docs", "file:///x")
                .withSettings(List.of(new SettingEntry("send-http-json-urls", "https://a.example/report")));

        Map<String, String> options = OptionLayers.merge(settings(null, "https://b.example/r"), backup, Map.of());

        assertEquals("https://a.example/report;https://b.example/r", options.get("send-http-json-urls"));
    }

    @Test
    void booleanOptionsShouldAcceptBlankAndTruthyValues() {
        Map<String, String> options = new HashMap<>();
        options.put("a", "");
        options.put("b", "TRUE");
        options.put("c", "false");
        options.put("d", null);

        assertTrue(OptionLayers.isEnabled(options, "a"));
        assertTrue(OptionLayers.isEnabled(options, "b"));
        assertFalse(OptionLayers.isEnabled(options, "c"));
        assertTrue(OptionLayers.isEnabled(options, "d"));
        assertFalse(OptionLayers.isEnabled(options, "missing"));
    }
}
