package io.backup4j.internal.mongo;

import io.backup4j.NotificationSink;
import io.backup4j.core.Notification;
import io.backup4j.core.NotificationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;

/**
 * Stores notifications and applies their dedupe rule against the ones already stored for the same backup.
 *
 * <ul>
 *   <li>{@code REPLACE_SAME_BACKUP}: earlier notifications of the backup are removed.</li>
 *   <li>{@code KEEP_EXISTING_ERROR}: dropped when the backup already has an error, otherwise replaces.</li>
 *   <li>{@code NONE}: always appended.</li>
 * </ul>
 */
public class MongoNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(MongoNotificationSink.class);

    private final MongoTemplate mongoTemplate;

    public MongoNotificationSink(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public synchronized void register(Notification notification) {
        Objects.requireNonNull(notification, "notification must not be null");
        String backupId = notification.backupId();

        if (backupId != null) {
            switch (notification.dedupeRule()) {
                case REPLACE_SAME_BACKUP -> removeForBackup(backupId);
                case KEEP_EXISTING_ERROR -> {
                    Query errors = new Query(Criteria.where("backupId").is(backupId)
                            .and("severity").is(NotificationSeverity.ERROR));
                    if (mongoTemplate.exists(errors, NotificationDocument.class)) {
                        log.debug("backup4j notification dropped, error already pending backupId={} title={}",
                                backupId, notification.title());
                        return;
                    }
                    removeForBackup(backupId);
                }
                case NONE -> {
                }
            }
        }

        mongoTemplate.insert(toDocument(notification));
    }

    public List<NotificationDocument> list() {
        return mongoTemplate.find(new Query().with(Sort.by(Sort.Order.asc("createdAt"))), NotificationDocument.class);
    }

    /**
     * @return deleted count (0 or 1 normally)
     */
    public long dismiss(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), NotificationDocument.class)
                .getDeletedCount();
    }

    private void removeForBackup(String backupId) {
        mongoTemplate.remove(new Query(Criteria.where("backupId").is(backupId)), NotificationDocument.class);
    }

    private static NotificationDocument toDocument(Notification n) {
        NotificationDocument doc = new NotificationDocument();
        doc.setSeverity(n.severity());
        doc.setTitle(n.title());
        doc.setMessage(n.message());
        doc.setException(n.exception());
        doc.setBackupId(n.backupId());
        doc.setAction(n.action());
        doc.setMessageId(n.messageId());
        doc.setCreatedAt(n.createdAt());
        return doc;
    }
}
