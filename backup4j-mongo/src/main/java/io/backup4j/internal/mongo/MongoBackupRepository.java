package io.backup4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.BackupRepository;
import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.BackupMetadata;
import io.backup4j.core.FilterRule;
import io.backup4j.core.ScheduleRecord;
import io.backup4j.core.SettingEntry;
import io.backup4j.core.ThreadPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for backup definitions, run metadata and application settings.
 *
 * <p>Settings and filters are stored as plain maps and converted with Jackson, the same way job data is.
 */
public class MongoBackupRepository implements BackupRepository {

    private static final Logger log = LoggerFactory.getLogger(MongoBackupRepository.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoBackupRepository(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public BackupDefinition findBackup(String backupId) {
        if (backupId == null) {
            return null;
        }
        BackupDocument doc = mongoTemplate.findById(backupId, BackupDocument.class);
        return doc == null ? null : toDefinition(doc);
    }

    @Override
    public List<BackupDefinition> listBackups() {
        return mongoTemplate.findAll(BackupDocument.class).stream()
                .map(this::toDefinition)
                .toList();
    }

    @Override
    public ApplicationSettings applicationSettings() {
        ApplicationSettingsDocument doc = mongoTemplate.findById(ApplicationSettingsDocument.SINGLETON_ID,
                ApplicationSettingsDocument.class);
        if (doc == null) {
            return ApplicationSettings.defaults();
        }
        return new ApplicationSettings(
                convertList(doc.getOptions(), SettingEntry.class),
                convertList(doc.getFilters(), FilterRule.class),
                doc.getTimezone(),
                doc.getStartupDelay(),
                ThreadPriority.parse(doc.getThreadPriority()),
                doc.getUploadSpeedLimit(),
                doc.getDownloadSpeedLimit(),
                doc.getAdditionalReportUrl()
        );
    }

    @Override
    public void saveMetadata(String backupId, Map<String, String> metadata) {
        Objects.requireNonNull(backupId, "backupId must not be null");
        Update u = new Update().set("metadata", metadata == null ? Map.of() : metadata);
        mongoTemplate.updateFirst(byId(backupId), u, BackupDocument.class);
    }

    @Override
    public void markInProgress(String backupId, String message) {
        Objects.requireNonNull(backupId, "backupId must not be null");
        Update u = new Update().set("metadata." + BackupMetadata.BACKUP_IN_PROGRESS, message == null ? "" : message);
        mongoTemplate.updateFirst(byId(backupId), u, BackupDocument.class);
    }

    @Override
    public void clearInProgress(String backupId) {
        Objects.requireNonNull(backupId, "backupId must not be null");
        Update u = new Update().unset("metadata." + BackupMetadata.BACKUP_IN_PROGRESS);
        mongoTemplate.updateFirst(byId(backupId), u, BackupDocument.class);
    }

    /**
     * Removes the backup and any schedule that names it directly.
     */
    @Override
    public void deleteBackup(String backupId) {
        Objects.requireNonNull(backupId, "backupId must not be null");
        long deleted = mongoTemplate.remove(byId(backupId), BackupDocument.class).getDeletedCount();
        long schedules = mongoTemplate.remove(
                new Query(Criteria.where("tags").is(ScheduleRecord.ID_TAG_PREFIX + backupId)),
                ScheduleDocument.class).getDeletedCount();
        log.debug("backup4j deleted backup backupId={} deleted={} schedules={}", backupId, deleted, schedules);
    }

    /**
     * Insert or replace a backup definition.
     *
     * @param tags schedule selectors this backup answers to, may be empty
     */
    public void save(BackupDefinition backup, List<String> tags) {
        Objects.requireNonNull(backup, "backup must not be null");
        BackupDocument doc = new BackupDocument();
        doc.setId(backup.id());
        doc.setName(backup.name());
        doc.setTargetUrl(backup.targetUrl());
        doc.setTags(tags == null ? List.of() : List.copyOf(tags));
        doc.setSources(backup.sources());
        doc.setSettings(toMaps(backup.settings()));
        doc.setFilters(toMaps(backup.filters()));
        doc.setMetadata(backup.metadata());
        doc.setDbPath(backup.dbPath());
        doc.setKeepFull(backup.keepFull());
        doc.setKeepTime(backup.keepTime());
        doc.setTemporary(backup.temporary());
        mongoTemplate.save(doc);
    }

    public void saveApplicationSettings(ApplicationSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        ApplicationSettingsDocument doc = new ApplicationSettingsDocument();
        doc.setOptions(toMaps(settings.options()));
        doc.setFilters(toMaps(settings.filters()));
        doc.setTimezone(settings.timezone());
        doc.setStartupDelay(settings.startupDelay());
        doc.setThreadPriority(settings.threadPriority() == null ? null : settings.threadPriority().name());
        doc.setUploadSpeedLimit(settings.uploadSpeedLimit());
        doc.setDownloadSpeedLimit(settings.downloadSpeedLimit());
        doc.setAdditionalReportUrl(settings.additionalReportUrl());
        mongoTemplate.save(doc);
    }

    private BackupDefinition toDefinition(BackupDocument doc) {
        return new BackupDefinition(
                doc.getId(),
                doc.getName(),
                doc.getTargetUrl(),
                doc.getSources(),
                convertList(doc.getSettings(), SettingEntry.class),
                convertList(doc.getFilters(), FilterRule.class),
                doc.getMetadata(),
                doc.getDbPath(),
                doc.getKeepFull(),
                doc.getKeepTime(),
                doc.isTemporary()
        );
    }

    private List<Map<String, Object>> toMaps(List<?> values) {
        return values.stream()
                .map(v -> objectMapper.convertValue(v, new TypeReference<Map<String, Object>>() {
                }))
                .toList();
    }

    private <T> List<T> convertList(List<Map<String, Object>> raw, Class<T> type) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream().map(m -> objectMapper.convertValue(m, type)).toList();
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
