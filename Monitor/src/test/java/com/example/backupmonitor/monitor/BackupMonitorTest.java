package com.example.backupmonitor.monitor;

import static com.example.backupmonitor.testutil.BackupFixtures.MB;
import static com.example.backupmonitor.testutil.BackupFixtures.createBackup;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupmonitor.analysis.Analysis.FreshnessStatus;
import com.example.backupmonitor.analysis.Analysis.IntegrityStatus;
import com.example.backupmonitor.analysis.Analysis.RetentionStatus;
import com.example.backupmonitor.config.MonitorSettings;
import com.example.backupmonitor.events.Events.MetricEvent;
import com.example.backupmonitor.scan.Scanner.BackupType;
import com.example.backupmonitor.scoring.HealthScoring.HealthReport;
import com.example.backupmonitor.scoring.HealthScoring.HealthScorer;
import com.example.backupmonitor.scoring.HealthScoring.OverallStatus;
import com.example.backupmonitor.state.RunState;
import com.example.backupmonitor.testutil.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupMonitorTest {

    private static final Instant NOW = Instant.parse("2025-09-03T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);

    @Test
    void evaluate_singleRecentDailyBackup_isWarning(@TempDir Path root) {
        createBackup(root.resolve("daily"), "alfresco_20250902_235538.tar.gz", 120 * MB, NOW.minus(Duration.ofHours(10)));
        BackupMonitor monitor = monitor(root, new RunState(clock, Duration.ofMinutes(10)));

        HealthReport report = monitor.evaluate(NOW);

        assertFalse(report.isFailed());
        assertEquals(FreshnessStatus.HEALTHY, report.freshness().orElseThrow().status());
        assertEquals(10.0, report.freshness().orElseThrow().ageHours().getAsDouble(), 1e-9);
        assertEquals(RetentionStatus.CRITICAL, report.retention(BackupType.DAILY).orElseThrow().status());
        assertEquals(1, report.retention(BackupType.DAILY).orElseThrow().actualCount());
        assertEquals(1, report.retention(BackupType.DAILY).orElseThrow().healthyCount());
        assertEquals(IntegrityStatus.HEALTHY, report.integrity().orElseThrow().status());
        assertEquals(1.0, report.integrity().orElseThrow().score());
        assertEquals(120.0, report.storage().orElseThrow().totalSizeMb(), 1e-6);
        assertEquals(0.75, report.healthScore(), 1e-9);
        assertEquals(OverallStatus.WARNING, report.overallStatus());
    }

    @Test
    void evaluate_emptyRoot_reportsMissingEverywhere(@TempDir Path root) {
        BackupMonitor monitor = monitor(root, new RunState(clock, Duration.ofMinutes(10)));

        HealthReport report = monitor.evaluate(NOW);

        assertEquals(FreshnessStatus.MISSING, report.freshness().orElseThrow().status());
        assertEquals(IntegrityStatus.MISSING, report.integrity().orElseThrow().status());
        for (BackupType type : BackupType.values()) {
            assertEquals(RetentionStatus.CRITICAL, report.retention(type).orElseThrow().status());
            assertEquals(0, report.storage().orElseThrow().count(type));
        }
        assertEquals(0.0, report.healthScore());
        assertEquals(OverallStatus.CRITICAL, report.overallStatus());
    }

    @Test
    void evaluate_sameInstantSameTree_isRepeatable(@TempDir Path root) {
        createBackup(root.resolve("daily"), "alfresco_20250902_235538.tar.gz", 3 * MB, NOW.minus(Duration.ofHours(30)));
        createBackup(root.resolve("weekly"), "alfresco_20250831_000000.tar.gz", 30 * MB, NOW.minus(Duration.ofDays(3)));
        createBackup(root.resolve("monthly"), "alfresco_20250801_000000.tar.gz", 300 * MB, NOW.minus(Duration.ofDays(33)));
        BackupMonitor monitor = monitor(root, new RunState(clock, Duration.ofMinutes(10)));

        HealthReport first = monitor.evaluate(NOW);
        HealthReport second = monitor.evaluate(NOW);

        assertEquals(first.healthScore(), second.healthScore());
        assertEquals(first.overallStatus(), second.overallStatus());
        assertEquals(first.freshness(), second.freshness());
        assertEquals(first.retention(), second.retention());
        assertEquals(first.integrity(), second.integrity());
        assertEquals(first.storage(), second.storage());
        assertEquals(FreshnessStatus.STALE, first.freshness().orElseThrow().status());
        assertEquals(IntegrityStatus.HEALTHY, first.integrity().orElseThrow().status());
    }

    @Test
    void evaluate_scansOnProvidedExecutor(@TempDir Path root) {
        createBackup(root.resolve("daily"), "alfresco_20250902_235538.tar.gz", 120 * MB, NOW.minus(Duration.ofHours(10)));
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            BackupMonitor monitor = new BackupMonitor(settings(root), clock,
                    new RunState(clock, Duration.ofMinutes(10)), pool, new HealthScorer());

            assertEquals(0.75, monitor.evaluate(NOW).healthScore(), 1e-9);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void collect_success_updatesRunStateAndReturnsProjectedEvents(@TempDir Path root) {
        createBackup(root.resolve("daily"), "alfresco_20250902_235538.tar.gz", 120 * MB, NOW.minus(Duration.ofHours(10)));
        RunState runState = new RunState(clock, Duration.ofMinutes(10));
        BackupMonitor monitor = monitor(root, runState);

        List<MetricEvent> events = monitor.collect();

        assertEquals(14, events.size());
        assertEquals("backup.health.score", events.get(0).service());
        assertEquals("warning", events.get(0).state());
        assertEquals("test-host", events.get(0).host());
        assertEquals(NOW, runState.lastSuccessAt().orElseThrow());
        assertEquals(0.75, monitor.currentStatus().orElseThrow().healthScore(), 1e-9);

        MetricEvent health = monitor.monitorHealth();
        assertEquals("ok", health.state());
        assertEquals("Backup monitor last ran 0 minutes ago", health.description());
    }

    @Test
    void collect_failure_emitsErrorEventsAndKeepsRunState(@TempDir Path root) {
        RunState runState = new RunState(clock, Duration.ofMinutes(10));
        BackupMonitor monitor = new BackupMonitor(settings(root), clock, runState,
                task -> { throw new RejectedExecutionException("scan pool closed"); }, new HealthScorer());

        List<MetricEvent> events = monitor.collect();

        assertEquals(List.of("backup.health.score", "backup.process.last_success", "backup.monitor.error"),
                events.stream().map(MetricEvent::service).collect(Collectors.toList()));
        assertEquals("error", events.get(0).state());
        assertEquals("Backup monitoring error: scan pool closed", events.get(2).description());
        assertTrue(runState.lastSuccessAt().isEmpty());
        assertTrue(monitor.currentStatus().isEmpty());

        MetricEvent health = monitor.monitorHealth();
        assertEquals("critical", health.state());
        assertEquals("Backup monitor has not completed a run yet", health.description());
    }

    @Test
    void monitorHealth_turnsCriticalWhenNoRecentRun(@TempDir Path root) {
        BackupMonitor monitor = monitor(root, new RunState(clock, Duration.ofMinutes(10)));
        monitor.collect();

        clock.advance(Duration.ofMinutes(15));
        MetricEvent health = monitor.monitorHealth();

        assertEquals(0.0, health.metric());
        assertEquals("critical", health.state());
        assertEquals("Backup monitor last ran 15 minutes ago", health.description());
    }

    private BackupMonitor monitor(Path root, RunState runState) {
        return new BackupMonitor(settings(root), clock, runState);
    }

    private static MonitorSettings settings(Path root) {
        return MonitorSettings.builder()
                .backupRoot(root.toString())
                .host("test-host")
                .build();
    }
}
