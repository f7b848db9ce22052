package io.backup4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.BackupEngine;
import io.backup4j.BackupService;
import io.backup4j.internal.mongo.MongoBackupRepository;
import io.backup4j.internal.mongo.MongoNotificationSink;
import io.backup4j.internal.mongo.MongoScheduleRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BackupAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BackupAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void shouldAutoConfigureBackupBeans() {
        contextRunner
                .withBean(BackupEngine.class, () -> mock(BackupEngine.class))
                .withPropertyValues(
                        "backup4j.enabled=true",
                        "backup4j.max-search-iterations=500",
                        "backup4j.idle-schedule-wait=10s"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(BackupService.class);
                    assertThat(context).hasSingleBean(BackupServiceLifecycle.class);
                    assertThat(context).hasSingleBean(BackupProperties.class);
                    assertThat(context.getBean(BackupServiceLifecycle.class).isRunning()).isTrue();

                    BackupProperties props = context.getBean(BackupProperties.class);
                    assertThat(props.getMaxSearchIterations()).isEqualTo(500);
                    assertThat(props.getIdleScheduleWait()).isEqualTo(Duration.ofSeconds(10));
                });
    }

    @Test
    void withoutEngineShouldOnlyProvideStores() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(MongoScheduleRepository.class);
            assertThat(context).hasSingleBean(MongoBackupRepository.class);
            assertThat(context).hasSingleBean(MongoNotificationSink.class);
            assertThat(context).doesNotHaveBean(BackupService.class);
            assertThat(context).doesNotHaveBean(BackupServiceLifecycle.class);
        });
    }

    @Test
    void disabledPropertyShouldSkipAutoConfiguration() {
        contextRunner
                .withBean(BackupEngine.class, () -> mock(BackupEngine.class))
                .withPropertyValues("backup4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(BackupService.class);
                    assertThat(context).doesNotHaveBean(BackupProperties.class);
                });
    }
}
