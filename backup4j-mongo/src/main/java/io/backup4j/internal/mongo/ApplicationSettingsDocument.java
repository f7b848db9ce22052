package io.backup4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

/**
 * Singleton document holding the global application settings.
 */
@Document(collection = "backup_settings")
public class ApplicationSettingsDocument {

    public static final String SINGLETON_ID = "application";

    @Id
    private String id = SINGLETON_ID;

    private List<Map<String, Object>> options;
    private List<Map<String, Object>> filters;
    private String timezone;
    private String startupDelay;
    private String threadPriority;
    private String uploadSpeedLimit;
    private String downloadSpeedLimit;
    private String additionalReportUrl;

    public ApplicationSettingsDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<Map<String, Object>> getOptions() {
        return options;
    }

    public void setOptions(List<Map<String, Object>> options) {
        this.options = options;
    }

    public List<Map<String, Object>> getFilters() {
        return filters;
    }

    public void setFilters(List<Map<String, Object>> filters) {
        this.filters = filters;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getStartupDelay() {
        return startupDelay;
    }

    public void setStartupDelay(String startupDelay) {
        this.startupDelay = startupDelay;
    }

    public String getThreadPriority() {
        return threadPriority;
    }

    public void setThreadPriority(String threadPriority) {
        this.threadPriority = threadPriority;
    }

    public String getUploadSpeedLimit() {
        return uploadSpeedLimit;
    }

    public void setUploadSpeedLimit(String uploadSpeedLimit) {
        this.uploadSpeedLimit = uploadSpeedLimit;
    }

    public String getDownloadSpeedLimit() {
        return downloadSpeedLimit;
    }

    public void setDownloadSpeedLimit(String downloadSpeedLimit) {
        this.downloadSpeedLimit = downloadSpeedLimit;
    }

    public String getAdditionalReportUrl() {
        return additionalReportUrl;
    }

    public void setAdditionalReportUrl(String additionalReportUrl) {
        this.additionalReportUrl = additionalReportUrl;
    }
}
