package io.backup4j.internal.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.SettingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Writes backup definitions to {@value #FILE_NAME} so they are uploaded with the backup as a control file.
 */
public class TaskConfigExporter {

    private static final Logger log = LoggerFactory.getLogger(TaskConfigExporter.class);

    static final String FILE_NAME = "task-setup.json";

    private final ObjectMapper objectMapper;

    public TaskConfigExporter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @return the temporary folder holding the export
     */
    public Path export(List<BackupDefinition> definitions) throws IOException {
        Path folder = Files.createTempDirectory("backup4j-task-config");
        Path file = folder.resolve(FILE_NAME);
        List<Map<String, Object>> payload = definitions.stream().map(TaskConfigExporter::toExport).toList();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), payload);
        return folder;
    }

    static void appendControlFile(Map<String, String> options, Path file) {
        String existing = options.get("control-files");
        options.put("control-files", existing == null || existing.isBlank()
                ? file.toString()
                : existing + File.pathSeparator + file);
    }

    public void deleteQuietly(Path folder) {
        if (folder == null) {
            return;
        }
        try (Stream<Path> walk = Files.walk(folder)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("backup4j failed to delete task config folder path={} msg={}", folder, e.getMessage());
        }
    }

    private static Map<String, Object> toExport(BackupDefinition definition) {
        Map<String, String> settings = new LinkedHashMap<>();
        for (SettingEntry e : definition.settings()) {
            if (!e.optionName().toLowerCase(Locale.ROOT).contains("passphrase")) {
                settings.put(e.name(), e.value());
            }
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", definition.id());
        out.put("name", definition.name());
        out.put("targetUrl", definition.targetUrl());
        out.put("sources", definition.sources());
        out.put("settings", settings);
        out.put("filters", definition.filters());
        out.put("keepFull", definition.keepFull());
        out.put("keepTime", definition.keepTime());
        return out;
    }
}
