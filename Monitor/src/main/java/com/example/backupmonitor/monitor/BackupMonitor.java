package com.example.backupmonitor.monitor;

import com.example.backupmonitor.analysis.Analysis.FreshnessAnalyzer;
import com.example.backupmonitor.analysis.Analysis.FreshnessResult;
import com.example.backupmonitor.analysis.Analysis.IntegrityAnalyzer;
import com.example.backupmonitor.analysis.Analysis.IntegrityResult;
import com.example.backupmonitor.analysis.Analysis.RetentionAnalyzer;
import com.example.backupmonitor.analysis.Analysis.RetentionResult;
import com.example.backupmonitor.analysis.Analysis.StorageAggregator;
import com.example.backupmonitor.analysis.Analysis.StorageSummary;
import com.example.backupmonitor.config.MonitorSettings;
import com.example.backupmonitor.events.Events.EventProjector;
import com.example.backupmonitor.events.Events.MetricEvent;
import com.example.backupmonitor.scan.Scanner.BackupType;
import com.example.backupmonitor.scan.Scanner.ScanResult;
import com.example.backupmonitor.scan.Scanner.ScanService;
import com.example.backupmonitor.scoring.HealthScoring.HealthReport;
import com.example.backupmonitor.scoring.HealthScoring.HealthScorer;
import com.example.backupmonitor.state.RunState;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fronteira do motor de saúde de backups: uma chamada de {@link #collect()} executa scan, análise,
 * pontuação e projeção em eventos.
 *
 * Nenhuma exceção atravessa esta classe. Falhas inesperadas viram um relatório de erro com
 * pontuação 0.0 e o evento {@code backup.monitor.error}; o {@link RunState} só é atualizado
 * quando o ciclo termina sem falha.
 *
 * Não cria threads. Os scans das três camadas rodam no {@link Executor} recebido
 * (por padrão, na própria thread de quem chama).
 */
public final class BackupMonitor {

    private static final Logger log = LoggerFactory.getLogger(BackupMonitor.class);

    private final MonitorSettings settings;
    private final Clock clock;
    private final RunState runState;
    private final Executor executor;
    private final ScanService scanService;
    private final FreshnessAnalyzer freshnessAnalyzer = new FreshnessAnalyzer();
    private final RetentionAnalyzer retentionAnalyzer = new RetentionAnalyzer();
    private final IntegrityAnalyzer integrityAnalyzer = new IntegrityAnalyzer();
    private final StorageAggregator storageAggregator = new StorageAggregator();
    private final HealthScorer scorer;
    private final EventProjector projector;

    public BackupMonitor(MonitorSettings settings, Clock clock, RunState runState) {
        this(settings, clock, runState, Runnable::run, new HealthScorer());
    }

    public BackupMonitor(MonitorSettings settings,
                         Clock clock,
                         RunState runState,
                         Executor executor,
                         HealthScorer scorer) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.runState = Objects.requireNonNull(runState, "runState");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.scanService = new ScanService(clock.getZone(), settings.minBackupSizeMb(), settings.maxBackupAgeHours());
        this.projector = new EventProjector(settings.host(), settings.eventTtlSeconds());
    }

    /**
     * Executa um ciclo completo e devolve os eventos a publicar.
     */
    public List<MetricEvent> collect() {
        Instant evaluatedAt = clock.instant();
        try {
            log.info("Iniciando coleta de métricas de backup em {}", settings.backupRoot());
            HealthReport report = evaluate(evaluatedAt);
            List<MetricEvent> events = projector.project(report);
            if (report.isFailed()) {
                log.warn("Coleta concluída com falha; {} eventos de erro emitidos.", events.size());
            } else {
                runState.recordSuccess(clock.instant(), report);
                log.info("Coletados {} eventos de backup, health score: {} ({})",
                        events.size(), String.format(Locale.ROOT, "%.2f", report.healthScore()),
                        report.overallStatus());
            }
            return events;
        } catch (RuntimeException e) {
            log.error("Coleta de métricas de backup falhou: {}", e.getMessage(), e);
            return List.of(projector.monitorError(evaluatedAt, String.valueOf(e.getMessage())));
        }
    }

    /**
     * Avalia os backups contra um instante fixo. Repetir com o mesmo instante sobre a mesma árvore
     * produz o mesmo relatório.
     */
    public HealthReport evaluate(Instant evaluatedAt) {
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
        try {
            Map<BackupType, ScanResult> scans = scanAll(evaluatedAt);
            ScanResult daily = scans.get(BackupType.DAILY);

            FreshnessResult freshness = freshnessAnalyzer.analyze(daily.records(), settings.expectedIntervalHours());

            Map<BackupType, RetentionResult> retention = new EnumMap<>(BackupType.class);
            for (BackupType type : BackupType.values()) {
                retention.put(type, retentionAnalyzer.analyze(type, scans.get(type).records(), settings.expectedCount(type)));
            }

            IntegrityResult integrity = integrityAnalyzer.analyze(daily.latest());
            StorageSummary storage = storageAggregator.aggregate(
                    daily.records(),
                    scans.get(BackupType.WEEKLY).records(),
                    scans.get(BackupType.MONTHLY).records());

            return scorer.evaluate(evaluatedAt, freshness, retention, integrity, storage);
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Falha ao calcular métricas de backup: {}", cause.getMessage(), cause);
            return HealthReport.failed(evaluatedAt, String.valueOf(cause.getMessage()));
        }
    }

    /** Evento de vida do próprio monitor, independente da saúde dos backups. */
    public MetricEvent monitorHealth() {
        return projector.monitorHealth(runState.liveness());
    }

    /** Último relatório bem-sucedido, se houver. */
    public Optional<HealthReport> currentStatus() {
        return runState.lastReport();
    }

    private Map<BackupType, ScanResult> scanAll(Instant evaluatedAt) {
        Map<BackupType, CompletableFuture<ScanResult>> pending = new EnumMap<>(BackupType.class);
        for (BackupType type : BackupType.values()) {
            pending.put(type, CompletableFuture.supplyAsync(
                    () -> scanService.scan(settings.directoryFor(type), type, evaluatedAt), executor));
        }
        Map<BackupType, ScanResult> results = new EnumMap<>(BackupType.class);
        int issues = 0;
        for (Map.Entry<BackupType, CompletableFuture<ScanResult>> entry : pending.entrySet()) {
            ScanResult result = entry.getValue().join();
            issues += result.issues().size();
            results.put(entry.getKey(), result);
        }
        if (issues > 0) {
            log.info("Scan concluído com {} problema(s) não-fatais.", issues);
        }
        return results;
    }
}
