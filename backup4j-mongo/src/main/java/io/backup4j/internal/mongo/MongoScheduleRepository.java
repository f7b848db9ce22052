package io.backup4j.internal.mongo;

import io.backup4j.ScheduleRepository;
import io.backup4j.core.ScheduleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>Tags other than {@code ID=<backupId>} are resolved against the {@code tags} field of the backups collection.
 */
public class MongoScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(MongoScheduleRepository.class);

    private final MongoTemplate mongoTemplate;

    public MongoScheduleRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduleRecord> listSchedules() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("time")));
        List<ScheduleRecord> out = new ArrayList<>();
        for (ScheduleDocument doc : mongoTemplate.find(q, ScheduleDocument.class)) {
            // one malformed document must not hide the other schedules
            try {
                out.add(toRecord(doc));
            } catch (RuntimeException e) {
                log.warn("backup4j skipping unreadable schedule scheduleId={} msg={}", doc.getId(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public List<String> findBackupIdsByTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }

        Set<String> ids = new LinkedHashSet<>();
        List<String> plain = new ArrayList<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            if (tag.startsWith(ScheduleRecord.ID_TAG_PREFIX)) {
                ids.add(tag.substring(ScheduleRecord.ID_TAG_PREFIX.length()));
            } else {
                plain.add(tag);
            }
        }

        if (!plain.isEmpty()) {
            Query q = new Query(Criteria.where("tags").in(plain)).with(Sort.by(Sort.Order.asc("_id")));
            q.fields().include("_id");
            for (BackupDocument d : mongoTemplate.find(q, BackupDocument.class)) {
                if (d != null && d.getId() != null) {
                    ids.add(d.getId());
                }
            }
        }
        return new ArrayList<>(ids);
    }

    @Override
    public void saveNextRun(String scheduleId, Instant nextRun, Instant lastRun) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(nextRun, "nextRun must not be null");

        Update u = new Update().set("time", nextRun);
        if (lastRun != null) {
            u.set("lastRun", lastRun);
        } else {
            u.unset("lastRun");
        }
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(scheduleId)), u, ScheduleDocument.class);
    }

    /**
     * Insert or replace a schedule.
     */
    public void save(ScheduleRecord schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        mongoTemplate.save(toDocument(schedule));
    }

    public ScheduleRecord findById(String scheduleId) {
        ScheduleDocument doc = mongoTemplate.findById(scheduleId, ScheduleDocument.class);
        return doc == null ? null : toRecord(doc);
    }

    /**
     * Hard delete schedule by id.
     *
     * @return deleted count (0 or 1 normally)
     */
    public long deleteById(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(scheduleId)), ScheduleDocument.class)
                .getDeletedCount();
    }

    static ScheduleRecord toRecord(ScheduleDocument doc) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (doc.getAllowedDays() != null) {
            for (String day : doc.getAllowedDays()) {
                days.add(DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)));
            }
        }
        return new ScheduleRecord(doc.getId(), doc.getTags(), doc.getRepeat(), days, doc.getTime(), doc.getLastRun());
    }

    static ScheduleDocument toDocument(ScheduleRecord schedule) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(schedule.id());
        doc.setTags(schedule.tags());
        doc.setRepeat(schedule.repeat());
        doc.setAllowedDays(schedule.allowedDays().stream().sorted().map(DayOfWeek::name).toList());
        doc.setTime(schedule.time());
        doc.setLastRun(schedule.lastRun());
        return doc;
    }
}
