package io.backup4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.BackupEngine;
import io.backup4j.BackupService;
import io.backup4j.PowerSource;
import io.backup4j.UsageReporter;
import io.backup4j.internal.BackupServer;
import io.backup4j.internal.mongo.MongoBackupRepository;
import io.backup4j.internal.mongo.MongoNotificationSink;
import io.backup4j.internal.mongo.MongoScheduleRepository;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the backup server.
 * <p>
 * The server itself is only created when the application provides a {@link BackupEngine}.
 */
@AutoConfiguration
@ConditionalOnClass({BackupService.class, MongoTemplate.class})
@EnableConfigurationProperties(BackupProperties.class)
@ConditionalOnProperty(prefix = "backup4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackupAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MongoScheduleRepository mongoScheduleRepository(MongoTemplate mongoTemplate) {
        return new MongoScheduleRepository(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoBackupRepository mongoBackupRepository(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoBackupRepository(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoNotificationSink mongoNotificationSink(MongoTemplate mongoTemplate) {
        return new MongoNotificationSink(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public UsageReporter usageReporter() {
        return UsageReporter.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public PowerSource powerSource() {
        return PowerSource.mains();
    }

    @Bean
    @ConditionalOnMissingBean
    protected BackupMongoIndexConfig backupMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new BackupMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BackupEngine.class)
    public BackupService backupService(BackupProperties props,
                                       MongoScheduleRepository schedules,
                                       MongoBackupRepository backups,
                                       MongoNotificationSink notifications,
                                       BackupEngine engine,
                                       UsageReporter usageReporter,
                                       PowerSource powerSource,
                                       ObjectMapper om) {
        return new BackupServer(props.toServerSettings(), schedules, backups, engine, notifications,
                usageReporter, powerSource, om, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BackupEngine.class)
    public BackupServiceLifecycle backupServiceLifecycle(BackupService backupService) {
        return new BackupServiceLifecycle(backupService);
    }

    @Bean
    @ConditionalOnProperty(prefix = "backup4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton backupIndexesInitializer(BackupMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
