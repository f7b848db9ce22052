package io.backup4j.config;

import io.backup4j.internal.mongo.BackupDocument;
import io.backup4j.internal.mongo.NotificationDocument;
import io.backup4j.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the backup collections.
 *
 * <p>Indexes are not created at startup unless {@code backup4j.ensure-indexes-on-startup=true};
 * production deployments usually manage them with migration scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_schedule_time</b> on {@code backup_schedules}: { time: 1 }</li>
 *   <li><b>idx_backup_tags</b> on {@code backups}: { tags: 1 }
 *       <br/>Used when schedule tags are resolved to backups.</li>
 *   <li><b>idx_notification_backup</b> on {@code backup_notifications}: { backupId: 1, severity: 1 }
 *       <br/>Used by notification dedupe.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.backup_schedules.createIndex({ time: 1 }, { name: "idx_schedule_time" });
 * db.backups.createIndex({ tags: 1 }, { name: "idx_backup_tags" });
 * db.backup_notifications.createIndex({ backupId: 1, severity: 1 }, { name: "idx_notification_backup" });
 * </pre>
 */
public class BackupMongoIndexConfig {

    public static final String IDX_SCHEDULE_TIME = "idx_schedule_time";
    public static final String IDX_BACKUP_TAGS = "idx_backup_tags";
    public static final String IDX_NOTIFICATION_BACKUP = "idx_notification_backup";

    private final MongoTemplate mongoTemplate;

    public BackupMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(scheduleTimeIndex());
        mongoTemplate.indexOps(BackupDocument.class).ensureIndex(backupTagsIndex());
        mongoTemplate.indexOps(NotificationDocument.class).ensureIndex(notificationBackupIndex());
    }

    public static Index scheduleTimeIndex() {
        return new Index()
                .on("time", Sort.Direction.ASC)
                .named(IDX_SCHEDULE_TIME);
    }

    public static Index backupTagsIndex() {
        return new Index()
                .on("tags", Sort.Direction.ASC)
                .named(IDX_BACKUP_TAGS);
    }

    public static Index notificationBackupIndex() {
        return new Index()
                .on("backupId", Sort.Direction.ASC)
                .on("severity", Sort.Direction.ASC)
                .named(IDX_NOTIFICATION_BACKUP);
    }
}
