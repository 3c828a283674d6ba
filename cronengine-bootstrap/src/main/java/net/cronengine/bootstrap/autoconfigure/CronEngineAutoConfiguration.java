package net.cronengine.bootstrap.autoconfigure;

import com.zaxxer.hikari.HikariDataSource;
import net.cronengine.adapter.jdbc.SchemaMigrator;
import net.cronengine.adapter.jdbc.SqliteDataSources;
import net.cronengine.bootstrap.catalog.CatalogRegistrar;
import net.cronengine.bootstrap.props.CronEngineProperties;
import net.cronengine.core.engine.EngineComponent;
import net.cronengine.core.engine.EngineHost;
import net.cronengine.core.maintenance.RunMaintenanceService;
import net.cronengine.core.process.ShellProcessRunner;
import net.cronengine.core.service.JobCatalogService;
import net.cronengine.core.service.JobExecutor;
import net.cronengine.core.service.Scheduler;
import net.cronengine.core.service.SchedulerSettings;
import net.cronengine.core.spi.*;
import net.cronengine.integration.spring.CronEngineSpringConfig;
import net.cronengine.integration.spring.cron.CronUtilsEvaluator;
import net.cronengine.integration.spring.sched.EngineLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(CronEngineProperties.class)
@Import(CronEngineSpringConfig.class) // integration-spring: repos/clock wiring
public class CronEngineAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronEngineAutoConfiguration.class);

    // --- store ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(DataSource.class)
    public HikariDataSource cronEngineDataSource(CronEngineProperties props) {
        var ds = SqliteDataSources.open(Path.of(props.getDatabasePath()));
        SchemaMigrator.migrate(ds);
        return ds;
    }

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean(CronEvaluator.class)
    public CronEvaluator cronEvaluator(CronEngineProperties props) {
        return new CronUtilsEvaluator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean(ProcessRunner.class)
    public ProcessRunner processRunner() {
        return new ShellProcessRunner();
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(CronEngineProperties props) {
        var s = props.getScheduler();
        return new SchedulerSettings(s.getCheckInterval(), s.getShutdownTimeout(), s.getConcurrencyLimit(),
                s.getErrorBackoff(), s.isAwaitInFlightOnStop());
    }

    @Bean
    @ConditionalOnMissingBean
    public RunMaintenanceService runMaintenance(RunRepository runs, Clock clock, CronEngineProperties props) {
        return new RunMaintenanceService(runs, clock, props.getScheduler().getRunRetentionDays());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(JobRepository jobs,
                                   RunRepository runs,
                                   ProcessRunner runner,
                                   CronEvaluator cron,
                                   Clock clock) {
        return new JobExecutor(jobs, runs, runner, cron, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(JobRepository jobs,
                               JobExecutor executor,
                               CronEvaluator cron,
                               RunMaintenanceService maintenance,
                               Clock clock,
                               SchedulerSettings settings) {
        return new Scheduler(jobs, executor, cron, maintenance, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCatalogService jobCatalog(JobRepository jobs, RunRepository runs, CronEvaluator cron, Clock clock) {
        return new JobCatalogService(jobs, runs, cron, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineHost engineHost(Scheduler scheduler,
                                 JobRepository jobs,
                                 RunRepository runs,
                                 ObjectProvider<EngineComponent> siblings,
                                 SchedulerSettings settings,
                                 Clock clock) {
        return new EngineHost(scheduler, jobs, runs, siblings.orderedStream().toList(), settings.shutdownTimeout(), clock);
    }

    // --- lifecycle (cronengine.scheduler.enabled) ---

    @Bean
    @ConditionalOnProperty(prefix = "cronengine.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EngineLifecycle engineLifecycle(EngineHost host) {
        return new EngineLifecycle(host);
    }

    // --- declarative catalog ---

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(JobCatalogService catalog) {
        return new CatalogRegistrar(catalog);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronengine.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, CronEngineProperties props) {
        log.info("Catalog runner: {} job(s) declared", props.getCatalog().getJobs().size());
        log.debug("Catalog:\n{}", props.getCatalog().getJobs().stream()
                .map(CronEngineProperties.JobDef::toString).collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
