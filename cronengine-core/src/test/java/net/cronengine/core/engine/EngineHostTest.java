package net.cronengine.core.engine;

import net.cronengine.core.event.EngineEvent;
import net.cronengine.core.event.EngineEventListener;
import net.cronengine.core.event.EngineEventType;
import net.cronengine.core.maintenance.RunMaintenanceService;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.service.JobExecutor;
import net.cronengine.core.service.Scheduler;
import net.cronengine.core.service.SchedulerSettings;
import net.cronengine.core.service.SchedulerState;
import net.cronengine.core.support.EveryMinuteCron;
import net.cronengine.core.support.InMemoryJobRepository;
import net.cronengine.core.support.InMemoryRunRepository;
import net.cronengine.core.support.MutableClock;
import net.cronengine.core.support.ScriptedProcessRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class EngineHostTest {

    static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    MutableClock clock;
    InMemoryJobRepository jobs;
    InMemoryRunRepository runs;
    Scheduler scheduler;
    List<EngineEvent> events;
    List<String> calls;
    EngineHost host;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        jobs = new InMemoryJobRepository(clock);
        runs = new InMemoryRunRepository();
        var cron = new EveryMinuteCron();
        scheduler = new Scheduler(jobs,
                new JobExecutor(jobs, runs, new ScriptedProcessRunner(), cron, clock),
                cron,
                new RunMaintenanceService(runs, clock, 30),
                clock,
                SchedulerSettings.defaults().withCheckInterval(Duration.ofMillis(50)));
        events = new CopyOnWriteArrayList<>();
        calls = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (host != null) host.stop();
    }

    EngineHost newHost(EngineComponent... siblings) {
        EngineHost h = new EngineHost(scheduler, jobs, runs, List.of(siblings), Duration.ofSeconds(5), clock);
        h.addListener(events::add);
        return h;
    }

    @Test
    void startStop_emitsLifecycleEvents_andStopsSiblingsBeforeScheduler() throws Exception {
        var queue = new RecordingComponent("queue");
        host = newHost(queue);

        host.start();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(calls).containsExactly("queue.start");

        host.stop();

        assertThat(calls).containsExactly("queue.start", "queue.stop");
        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(events).extracting(EngineEvent::type).containsExactly(
                EngineEventType.ENGINE_STARTED, EngineEventType.ENGINE_STOPPING, EngineEventType.ENGINE_STOPPED);
    }

    @Test
    void republishesSchedulerAndSiblingEvents() throws Exception {
        var queue = new RecordingComponent("queue");
        host = newHost(queue);
        jobs.add(Job.ofNew("tick", "* * * * *", "echo").withNextRun(T0));

        host.start();
        queue.emit(EngineEvent.engine(EngineEventType.ERROR, "queue unreachable", T0));

        await().atMost(Duration.ofSeconds(5)).until(() -> events.stream()
                .anyMatch(e -> e.type() == EngineEventType.JOB_COMPLETED && "tick".equals(e.jobName())));
        assertThat(events).extracting(EngineEvent::message).contains("queue unreachable");
    }

    @Test
    void failingSibling_rollsBackStart() {
        var ok = new RecordingComponent("ok");
        var broken = new RecordingComponent("broken") {
            @Override
            public void start() {
                throw new IllegalStateException("port in use");
            }
        };
        host = newHost(ok, broken);

        assertThatThrownBy(host::start).hasMessage("port in use");

        assertThat(calls).containsExactly("ok.start", "ok.stop");
        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(host.isRunning()).isFalse();
    }

    @Test
    void status_reportsCountsForTheUtcDay() throws Exception {
        clock.set(Instant.parse("2024-03-01T15:00:00Z"));
        jobs.add(Job.ofNew("a", "* * * * *", "x").withNextRun(Instant.parse("2024-03-01T16:00:00Z")));
        jobs.add(Job.ofNew("b", "* * * * *", "x").withNextRun(Instant.parse("2024-03-01T15:30:00Z")));
        long off = jobs.add(Job.ofNew("c", "* * * * *", "x").withEnabled(false)
                .withNextRun(Instant.parse("2024-03-01T15:01:00Z")));
        Job a = jobs.findByName("a").orElseThrow();
        closedRun(a, Instant.parse("2024-02-29T23:59:00Z"), true);
        closedRun(a, Instant.parse("2024-03-01T01:00:00Z"), true);
        closedRun(a, Instant.parse("2024-03-01T02:00:00Z"), false);
        host = newHost();

        EngineStatus before = host.status();
        assertThat(before.running()).isFalse();
        assertThat(before.uptime()).isEqualTo(Duration.ZERO);

        host.start();
        clock.advance(Duration.ofMinutes(5));
        EngineStatus status = host.status();

        assertThat(status.running()).isTrue();
        assertThat(status.startedAt()).isEqualTo(Instant.parse("2024-03-01T15:00:00Z"));
        assertThat(status.uptime()).isEqualTo(Duration.ofMinutes(5));
        assertThat(status.totalJobs()).isEqualTo(3);
        assertThat(status.enabledJobs()).isEqualTo(2);
        assertThat(status.nextScheduledRun()).isEqualTo(Instant.parse("2024-03-01T15:30:00Z"));
        assertThat(status.runsToday()).isEqualTo(2);
        assertThat(status.failedRunsToday()).isEqualTo(1);
        assertThat(jobs.findById(off)).isPresent();
    }

    void closedRun(Job job, Instant startedAt, boolean success) throws Exception {
        long id = runs.create(Run.start(job, startedAt));
        runs.update(runs.findById(id).orElseThrow().complete(startedAt.plusSeconds(1), success, "", null, false, 1));
    }

    class RecordingComponent implements EngineComponent {
        private final String name;
        private final List<EngineEventListener> listeners = new ArrayList<>();

        RecordingComponent(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void start() {
            calls.add(name + ".start");
        }

        @Override
        public void stop() {
            calls.add(name + ".stop");
        }

        @Override
        public void addListener(EngineEventListener listener) {
            listeners.add(listener);
        }

        void emit(EngineEvent e) {
            listeners.forEach(l -> l.onEvent(e));
        }
    }
}
