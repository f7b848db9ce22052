package io.backup4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

/**
 * Mongo document model for backup definitions and their run metadata.
 */
@Document(collection = "backups")
public class BackupDocument {

    @Id
    private String id;

    private String name;
    private String targetUrl;
    private List<String> tags;
    private List<String> sources;
    private List<Map<String, Object>> settings;
    private List<Map<String, Object>> filters;
    private Map<String, String> metadata;
    private String dbPath;
    private int keepFull;
    private String keepTime;
    private boolean temporary;

    public BackupDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public void setTargetUrl(String targetUrl) {
        this.targetUrl = targetUrl;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public List<Map<String, Object>> getSettings() {
        return settings;
    }

    public void setSettings(List<Map<String, Object>> settings) {
        this.settings = settings;
    }

    public List<Map<String, Object>> getFilters() {
        return filters;
    }

    public void setFilters(List<Map<String, Object>> filters) {
        this.filters = filters;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata;
    }

    public String getDbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public int getKeepFull() {
        return keepFull;
    }

    public void setKeepFull(int keepFull) {
        this.keepFull = keepFull;
    }

    public String getKeepTime() {
        return keepTime;
    }

    public void setKeepTime(String keepTime) {
        this.keepTime = keepTime;
    }

    public boolean isTemporary() {
        return temporary;
    }

    public void setTemporary(boolean temporary) {
        this.temporary = temporary;
    }
}
