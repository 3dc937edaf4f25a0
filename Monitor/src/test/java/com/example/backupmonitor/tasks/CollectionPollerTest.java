package com.example.backupmonitor.tasks;

import static com.example.backupmonitor.testutil.BackupFixtures.MB;
import static com.example.backupmonitor.testutil.BackupFixtures.createBackup;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupmonitor.config.MonitorSettings;
import com.example.backupmonitor.events.Events.EventSink;
import com.example.backupmonitor.events.Events.MetricEvent;
import com.example.backupmonitor.monitor.BackupMonitor;
import com.example.backupmonitor.state.RunState;
import com.example.backupmonitor.testutil.MutableClock;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CollectionPollerTest {

    private static final Instant NOW = Instant.parse("2025-09-03T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);

    @Test
    void runOnce_publishesCollectedEventsFollowedByMonitorHealth(@TempDir Path root) {
        createBackup(root.resolve("daily"), "alfresco_20250902_235538.tar.gz", 120 * MB, NOW.minus(Duration.ofHours(10)));
        RecordingSink sink = new RecordingSink();

        try (CollectionPoller poller = new CollectionPoller(monitor(root), sink, Duration.ofMinutes(5))) {
            assertTrue(poller.runOnce());
        }

        assertEquals(1, sink.batches.size());
        List<MetricEvent> batch = sink.batches.get(0);
        assertEquals(15, batch.size());
        assertEquals("backup.health.score", batch.get(0).service());
        MetricEvent health = batch.get(batch.size() - 1);
        assertEquals("backup.monitor.health", health.service());
        assertEquals("ok", health.state());
    }

    @Test
    void runOnce_sinkFailure_returnsFalseAndNextCycleStillRuns(@TempDir Path root) {
        FlakySink sink = new FlakySink();

        try (CollectionPoller poller = new CollectionPoller(monitor(root), sink, Duration.ofMinutes(5))) {
            assertFalse(poller.runOnce());
            assertTrue(poller.runOnce());
        }

        assertEquals(2, sink.attempts);
    }

    @Test
    void start_runsFirstCycleImmediately(@TempDir Path root) throws InterruptedException {
        CountDownLatch published = new CountDownLatch(1);
        EventSink sink = events -> published.countDown();

        try (CollectionPoller poller = new CollectionPoller(monitor(root), sink, Duration.ofHours(1))) {
            poller.start();
            assertTrue(published.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void start_subSecondInterval_keepsPolling(@TempDir Path root) throws InterruptedException {
        CountDownLatch published = new CountDownLatch(3);
        EventSink sink = events -> published.countDown();

        try (CollectionPoller poller = new CollectionPoller(monitor(root), sink, Duration.ofMillis(50))) {
            poller.start();
            assertTrue(published.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void nonPositiveInterval_isRejected(@TempDir Path root) {
        assertThrows(IllegalArgumentException.class,
                () -> new CollectionPoller(monitor(root), new RecordingSink(), Duration.ZERO));
    }

    private BackupMonitor monitor(Path root) {
        MonitorSettings settings = MonitorSettings.builder()
                .backupRoot(root.toString())
                .host("test-host")
                .build();
        return new BackupMonitor(settings, clock, new RunState(clock, settings.livenessThreshold()));
    }

    private static final class RecordingSink implements EventSink {
        private final List<List<MetricEvent>> batches = new CopyOnWriteArrayList<>();

        @Override
        public void publish(List<MetricEvent> events) {
            batches.add(List.copyOf(events));
        }
    }

    private static final class FlakySink implements EventSink {
        private int attempts;

        @Override
        public void publish(List<MetricEvent> events) throws IOException {
            attempts++;
            if (attempts == 1) {
                throw new IOException("connection refused");
            }
        }
    }
}
