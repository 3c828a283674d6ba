package net.cronengine.bootstrap.autoconfigure;

import net.cronengine.core.engine.EngineHost;
import net.cronengine.core.service.JobCatalogService;
import net.cronengine.core.service.Scheduler;
import net.cronengine.core.service.SchedulerSettings;
import net.cronengine.core.spi.CronEvaluator;
import net.cronengine.core.spi.JobRepository;
import net.cronengine.core.spi.ProcessRunner;
import net.cronengine.core.spi.RunRepository;
import net.cronengine.integration.spring.cron.CronUtilsEvaluator;
import net.cronengine.integration.spring.sched.EngineLifecycle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class CronEngineAutoConfigurationTest {

    @TempDir
    Path dir;

    ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(CronEngineAutoConfiguration.class))
                .withPropertyValues("cronengine.database-path=" + dir.resolve("engine.db"));
    }

    @Test
    void defaults_wireTheWholeEngine_andMigrateTheStore() {
        runner().run(ctx -> {
            assertThat(ctx).hasSingleBean(JobRepository.class)
                    .hasSingleBean(RunRepository.class)
                    .hasSingleBean(ProcessRunner.class)
                    .hasSingleBean(Scheduler.class)
                    .hasSingleBean(JobCatalogService.class)
                    .hasSingleBean(EngineHost.class)
                    .hasSingleBean(EngineLifecycle.class);
            assertThat(ctx.getBean(CronEvaluator.class)).isInstanceOf(CronUtilsEvaluator.class);

            SchedulerSettings s = ctx.getBean(SchedulerSettings.class);
            assertThat(s.checkInterval()).isEqualTo(Duration.ofSeconds(60));
            assertThat(s.shutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(s.concurrencyLimit()).isEqualTo(10);
            assertThat(s.errorBackoff()).isEqualTo(Duration.ofSeconds(5));

            // schema present: an empty list means the tables exist
            assertThat(ctx.getBean(JobRepository.class).list(true, null)).isEmpty();
            assertThat(Files.exists(dir.resolve("engine.db"))).isTrue();
        });
    }

    @Test
    void properties_bindIntoSettingsAndEvaluator() {
        runner().withPropertyValues(
                "cronengine.zone=Asia/Seoul",
                "cronengine.scheduler.check-interval=5s",
                "cronengine.scheduler.shutdown-timeout=2s",
                "cronengine.scheduler.concurrency-limit=3",
                "cronengine.scheduler.error-backoff=500ms"
        ).run(ctx -> {
            SchedulerSettings s = ctx.getBean(SchedulerSettings.class);
            assertThat(s.checkInterval()).isEqualTo(Duration.ofSeconds(5));
            assertThat(s.shutdownTimeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(s.concurrencyLimit()).isEqualTo(3);
            assertThat(s.errorBackoff()).isEqualTo(Duration.ofMillis(500));
            assertThat(((CronUtilsEvaluator) ctx.getBean(CronEvaluator.class)).zone()).isEqualTo(ZoneId.of("Asia/Seoul"));
        });
    }

    @Test
    void schedulerDisabled_skipsLifecycle() {
        runner().withPropertyValues("cronengine.scheduler.enabled=false").run(ctx -> {
            assertThat(ctx).doesNotHaveBean(EngineLifecycle.class);
            assertThat(ctx).hasSingleBean(EngineHost.class);
            assertThat(ctx.getBean(EngineHost.class).isRunning()).isFalse();
        });
    }

    @Test
    void userProcessRunner_backsOffDefault() {
        ProcessRunner custom = (req, token) -> ProcessRunner.Result.ok("custom");
        runner().withBean(ProcessRunner.class, () -> custom).run(ctx ->
                assertThat(ctx.getBean(ProcessRunner.class)).isSameAs(custom));
    }
}
