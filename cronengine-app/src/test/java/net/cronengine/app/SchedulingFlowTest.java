package net.cronengine.app;

import net.cronengine.core.engine.EngineHost;
import net.cronengine.core.event.EngineEvent;
import net.cronengine.core.event.EngineEventListener;
import net.cronengine.core.event.EngineEventType;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.service.JobCatalogService;
import net.cronengine.core.spi.JobRepository;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@EnabledOnOs({OS.LINUX, OS.MAC})
class SchedulingFlowTest {

    static Path dbDir;

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) throws IOException {
        dbDir = Files.createTempDirectory("cronengine-app");
        r.add("cronengine.database-path", () -> dbDir.resolve("app.db").toString());
    }

    @Autowired JobCatalogService catalog;
    @Autowired JobRepository jobs;
    @Autowired EngineHost host;

    final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    final EngineEventListener listener = events::add;

    @BeforeEach
    void listen() {
        host.addListener(listener);
    }

    @AfterEach
    void unlisten() {
        host.removeListener(listener);
    }

    @Test
    void catalogJobs_areRegistered_andEngineIsRunning() throws Exception {
        assertThat(host.isRunning()).isTrue();
        assertThat(catalog.list(false, "smoke")).extracting(Job::name).containsExactly("broken", "hello");
        assertThat(catalog.find("hello").orElseThrow().nextRun()).isAfter(Instant.now().minusSeconds(1));
    }

    @Test
    void dueJob_runsShellCommand_andRecordsOutput() throws Exception {
        makeDueNow("hello");

        // 1) wait for the closed run
        Awaitility.await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            List<Run> runs = catalog.runs("hello", 10, false);
            assertThat(runs).isNotEmpty();
            assertThat(runs.get(0).inFlight()).isFalse();
        });

        // 2) outcome
        Run run = catalog.runs("hello", 1, false).get(0);
        assertThat(run.exitCode()).isZero();
        assertThat(run.stdout()).isEqualTo("hello\n");
        assertThat(run.timedOut()).isFalse();

        // 3) rescheduled into the future from completion time
        assertThat(catalog.find("hello").orElseThrow().nextRun()).isAfter(run.endedAt());
    }

    @Test
    void failingCommand_isRecorded_andReportedAsFailure() throws Exception {
        makeDueNow("broken");

        Awaitility.await().atMost(Duration.ofSeconds(20)).untilAsserted(() ->
                assertThat(catalog.runs("broken", 10, true)).isNotEmpty());

        Run run = catalog.runs("broken", 1, true).get(0);
        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.stderr()).isEqualTo("Exit code 3. failing\n");

        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(events).anySatisfy(e -> {
                    assertThat(e.type()).isEqualTo(EngineEventType.JOB_FAILED);
                    assertThat(e.jobName()).isEqualTo("broken");
                    assertThat(e.runId()).isEqualTo(run.id());
                }));
    }

    @Test
    void status_reflectsRegisteredJobs() throws Exception {
        var status = host.status();

        assertThat(status.running()).isTrue();
        assertThat(status.totalJobs()).isEqualTo(2);
        assertThat(status.enabledJobs()).isEqualTo(2);
        assertThat(status.nextScheduledRun()).isNotNull();
    }

    // --- helpers ---

    private void makeDueNow(String name) throws Exception {
        Job job = catalog.find(name).orElseThrow();
        jobs.updateNextRun(job.id(), Instant.now().minusSeconds(1));
    }
}
