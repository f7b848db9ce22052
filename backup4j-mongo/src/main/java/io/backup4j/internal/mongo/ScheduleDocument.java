package io.backup4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * Mongo document model for persisted schedules.
 */
@Document(collection = "backup_schedules")
public class ScheduleDocument {

    @Id
    private String id;

    private List<String> tags;
    private String repeat;
    private List<String> allowedDays;

    @Field(write = Field.Write.ALWAYS)
    private Instant time;

    private Instant lastRun;

    public ScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public String getRepeat() {
        return repeat;
    }

    public void setRepeat(String repeat) {
        this.repeat = repeat;
    }

    public List<String> getAllowedDays() {
        return allowedDays;
    }

    public void setAllowedDays(List<String> allowedDays) {
        this.allowedDays = allowedDays;
    }

    public Instant getTime() {
        return time;
    }

    public void setTime(Instant time) {
        this.time = time;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }
}
