package com.example.backupmonitor.analysis;

import static com.example.backupmonitor.testutil.BackupFixtures.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupmonitor.analysis.Analysis.FreshnessAnalyzer;
import com.example.backupmonitor.analysis.Analysis.FreshnessResult;
import com.example.backupmonitor.analysis.Analysis.FreshnessStatus;
import com.example.backupmonitor.analysis.Analysis.IntegrityAnalyzer;
import com.example.backupmonitor.analysis.Analysis.IntegrityResult;
import com.example.backupmonitor.analysis.Analysis.IntegrityStatus;
import com.example.backupmonitor.analysis.Analysis.RetentionAnalyzer;
import com.example.backupmonitor.analysis.Analysis.RetentionResult;
import com.example.backupmonitor.analysis.Analysis.RetentionStatus;
import com.example.backupmonitor.analysis.Analysis.StorageAggregator;
import com.example.backupmonitor.analysis.Analysis.StorageSummary;
import com.example.backupmonitor.scan.Scanner.BackupRecord;
import com.example.backupmonitor.scan.Scanner.BackupType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnalysisTest {

    @Test
    void freshness_noRecords_isMissing() {
        FreshnessResult result = new FreshnessAnalyzer().analyze(List.of(), 25);

        assertEquals(FreshnessStatus.MISSING, result.status());
        assertEquals("No backups found", result.message());
        assertTrue(result.ageHours().isEmpty());
    }

    @Test
    void freshness_recentBackup_isHealthy() {
        FreshnessResult result = new FreshnessAnalyzer().analyze(
                List.of(record(BackupType.DAILY, "a.tar.gz", 10, 10.0, true)), 25);

        assertEquals(FreshnessStatus.HEALTHY, result.status());
        assertEquals(10.0, result.ageHours().getAsDouble(), 1e-9);
    }

    @Test
    void freshness_usesOnlyTheFirstRecord() {
        FreshnessResult result = new FreshnessAnalyzer().analyze(List.of(
                record(BackupType.DAILY, "newest.tar.gz", 10, 30.7, true),
                record(BackupType.DAILY, "older.tar.gz", 10, 2.0, true)), 25);

        assertEquals(FreshnessStatus.STALE, result.status());
        assertEquals("Latest backup is 30 hours old", result.message());
    }

    @Test
    void freshness_ageEqualToThreshold_isStale() {
        FreshnessResult result = new FreshnessAnalyzer().analyze(
                List.of(record(BackupType.DAILY, "a.tar.gz", 10, 25.0, true)), 25);

        assertEquals(FreshnessStatus.STALE, result.status());
        assertEquals("Latest backup is 25 hours old", result.message());
    }

    @Test
    void retention_classifiesAgainstHalfAndFullExpectedCount() {
        RetentionAnalyzer analyzer = new RetentionAnalyzer();

        assertEquals(RetentionStatus.CRITICAL, analyzer.analyze(BackupType.DAILY, records(3), 7).status());
        assertEquals(RetentionStatus.WARNING, analyzer.analyze(BackupType.DAILY, records(4), 7).status());
        assertEquals(RetentionStatus.WARNING, analyzer.analyze(BackupType.DAILY, records(5), 7).status());
        assertEquals(RetentionStatus.HEALTHY, analyzer.analyze(BackupType.DAILY, records(7), 7).status());
        assertEquals(RetentionStatus.HEALTHY, analyzer.analyze(BackupType.DAILY, records(8), 7).status());
    }

    @Test
    void retention_halfThresholdUsesRealDivision() {
        RetentionAnalyzer analyzer = new RetentionAnalyzer();

        // 2 >= 4/2: não é crítico; com divisão inteira 7/2 viraria 3 e 3 deixaria de ser crítico
        assertEquals(RetentionStatus.WARNING, analyzer.analyze(BackupType.WEEKLY, records(2), 4).status());
        assertEquals(RetentionStatus.CRITICAL, analyzer.analyze(BackupType.DAILY, records(3), 7).status());
    }

    @Test
    void retention_countsHealthyRecords() {
        List<BackupRecord> records = List.of(
                record(BackupType.MONTHLY, "a.tar.gz", 10, 10, true),
                record(BackupType.MONTHLY, "b.tar.gz", 0.5, 10, false),
                record(BackupType.MONTHLY, "c.tar.gz", 10, 500, false));

        RetentionResult result = new RetentionAnalyzer().analyze(BackupType.MONTHLY, records, 6);

        assertEquals(BackupType.MONTHLY, result.type());
        assertEquals(3, result.actualCount());
        assertEquals(6, result.expectedCount());
        assertEquals(1, result.healthyCount());
        assertEquals(RetentionStatus.WARNING, result.status());
    }

    @Test
    void retention_emptyWithZeroExpected_isHealthy() {
        RetentionResult result = new RetentionAnalyzer().analyze(BackupType.WEEKLY, List.of(), 0);

        assertEquals(RetentionStatus.HEALTHY, result.status());
    }

    @Test
    void integrity_noRecord_isMissingWithZeroScore() {
        IntegrityResult result = new IntegrityAnalyzer().analyze(Optional.empty());

        assertEquals(IntegrityStatus.MISSING, result.status());
        assertEquals(0.0, result.score());
        assertTrue(result.filename().isEmpty());
    }

    @Test
    void integrity_scoreFollowsSizeBreakpoints() {
        IntegrityAnalyzer analyzer = new IntegrityAnalyzer();
        double[] sizes = {0.05, 0.5, 3, 20, 120};
        double[] expected = {0.0, 0.3, 0.7, 0.9, 1.0};

        double previous = -1;
        for (int i = 0; i < sizes.length; i++) {
            IntegrityResult result = analyzer.analyze(Optional.of(record(BackupType.DAILY, "a.tar.gz", sizes[i], 1, true)));
            assertEquals(expected[i], result.score(), 1e-9, "size " + sizes[i]);
            assertTrue(result.score() >= previous);
            previous = result.score();
        }
    }

    @Test
    void integrity_breakpointsAreUpperExclusive() {
        assertEquals(0.3, IntegrityAnalyzer.scoreForSize(0.1));
        assertEquals(0.7, IntegrityAnalyzer.scoreForSize(1.0));
        assertEquals(0.9, IntegrityAnalyzer.scoreForSize(5.0));
        assertEquals(1.0, IntegrityAnalyzer.scoreForSize(50.0));
    }

    @Test
    void integrity_statusIsHealthyOnlyAboveHalf() {
        IntegrityAnalyzer analyzer = new IntegrityAnalyzer();

        IntegrityResult small = analyzer.analyze(Optional.of(record(BackupType.DAILY, "s.tar.gz", 0.5, 1, false)));
        IntegrityResult medium = analyzer.analyze(Optional.of(record(BackupType.DAILY, "m.tar.gz", 3, 1, true)));

        assertEquals(IntegrityStatus.DEGRADED, small.status());
        assertEquals(IntegrityStatus.HEALTHY, medium.status());
        assertEquals("m.tar.gz", medium.filename().orElseThrow());
        assertEquals(3.0, medium.sizeMb(), 1e-9);
    }

    @Test
    void integrity_failureDuringEvaluation_becomesErrorResult() {
        BackupRecord corrupted = new BackupRecord("x_20250903_000000.tar.gz", "/x_20250903_000000.tar.gz",
                BackupType.DAILY, -1, Instant.EPOCH, null, 1, false);

        IntegrityResult result = new IntegrityAnalyzer().analyze(Optional.of(corrupted));

        assertEquals(IntegrityStatus.ERROR, result.status());
        assertEquals(0.0, result.score());
        assertTrue(result.message().isPresent());
    }

    @Test
    void storage_sumsSizesAndCountsPerTier() {
        StorageSummary summary = new StorageAggregator().aggregate(
                List.of(record(BackupType.DAILY, "d1.tar.gz", 100, 1, true), record(BackupType.DAILY, "d2.tar.gz", 20, 25, true)),
                List.of(record(BackupType.WEEKLY, "w1.tar.gz", 5.5, 100, true)),
                List.of());

        assertEquals(125.5, summary.totalSizeMb(), 1e-6);
        assertEquals(2, summary.dailyCount());
        assertEquals(1, summary.weeklyCount());
        assertEquals(0, summary.monthlyCount());
        assertEquals(2, summary.count(BackupType.DAILY));
    }

    private static List<BackupRecord> records(int count) {
        List<BackupRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record(BackupType.DAILY, "b" + i + ".tar.gz", 10, i * 24.0, true));
        }
        return records;
    }
}
