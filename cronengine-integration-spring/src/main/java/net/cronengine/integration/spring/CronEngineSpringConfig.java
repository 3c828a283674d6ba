package net.cronengine.integration.spring;

import net.cronengine.adapter.jdbc.repo.JdbcJobRepository;
import net.cronengine.adapter.jdbc.repo.JdbcRunRepository;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.JobRepository;
import net.cronengine.core.spi.RunRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class CronEngineSpringConfig {

    // Repository implementations (adapter-jdbc)
    @Bean public JobRepository jobRepository(DataSource ds, Clock clock) { return new JdbcJobRepository(ds, clock); }
    @Bean public RunRepository runRepository(DataSource ds) { return new JdbcRunRepository(ds); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
