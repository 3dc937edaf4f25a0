package com.example.backupmonitor.scoring;

import com.example.backupmonitor.analysis.Analysis.FreshnessResult;
import com.example.backupmonitor.analysis.Analysis.FreshnessStatus;
import com.example.backupmonitor.analysis.Analysis.IntegrityResult;
import com.example.backupmonitor.analysis.Analysis.IntegrityStatus;
import com.example.backupmonitor.analysis.Analysis.RetentionResult;
import com.example.backupmonitor.analysis.Analysis.RetentionStatus;
import com.example.backupmonitor.analysis.Analysis.StorageSummary;
import com.example.backupmonitor.scan.Scanner.BackupType;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pontuação agregada de saúde dos backups e o relatório final de um ciclo.
 */
public final class HealthScoring {

    private HealthScoring() {}

    public enum OverallStatus { HEALTHY, WARNING, CRITICAL, ERROR }

    /**
     * Pesos e limiares da pontuação.
     *
     * {@link #standard()} reproduz a escala de 8 pontos: frescor 3/1/0, retenção diária 2/1/0,
     * integridade 3/1/0/0; saudável acima de 0.8, alerta acima de 0.5.
     * É uma heurística ajustável, não uma regra derivada.
     */
    public static final class ScoringPolicy {
        private final Map<FreshnessStatus, Integer> freshnessPoints;
        private final Map<RetentionStatus, Integer> retentionPoints;
        private final Map<IntegrityStatus, Integer> integrityPoints;
        private final double healthyAbove;
        private final double warningAbove;
        private final int maxPoints;

        public ScoringPolicy(Map<FreshnessStatus, Integer> freshnessPoints,
                             Map<RetentionStatus, Integer> retentionPoints,
                             Map<IntegrityStatus, Integer> integrityPoints,
                             double healthyAbove,
                             double warningAbove) {
            this.freshnessPoints = complete(FreshnessStatus.class, freshnessPoints, "freshnessPoints");
            this.retentionPoints = complete(RetentionStatus.class, retentionPoints, "retentionPoints");
            this.integrityPoints = complete(IntegrityStatus.class, integrityPoints, "integrityPoints");
            if (!(warningAbove >= 0.0) || !(healthyAbove > warningAbove) || healthyAbove > 1.0) {
                throw new IllegalArgumentException("Limiares devem satisfazer 0 <= warningAbove < healthyAbove <= 1");
            }
            this.healthyAbove = healthyAbove;
            this.warningAbove = warningAbove;
            this.maxPoints = max(this.freshnessPoints) + max(this.retentionPoints) + max(this.integrityPoints);
            if (maxPoints <= 0) {
                throw new IllegalArgumentException("Política sem pontuação máxima positiva");
            }
        }

        public static ScoringPolicy standard() {
            Map<FreshnessStatus, Integer> freshness = new EnumMap<>(FreshnessStatus.class);
            freshness.put(FreshnessStatus.HEALTHY, 3);
            freshness.put(FreshnessStatus.STALE, 1);
            freshness.put(FreshnessStatus.MISSING, 0);

            Map<RetentionStatus, Integer> retention = new EnumMap<>(RetentionStatus.class);
            retention.put(RetentionStatus.HEALTHY, 2);
            retention.put(RetentionStatus.WARNING, 1);
            retention.put(RetentionStatus.CRITICAL, 0);

            Map<IntegrityStatus, Integer> integrity = new EnumMap<>(IntegrityStatus.class);
            integrity.put(IntegrityStatus.HEALTHY, 3);
            integrity.put(IntegrityStatus.DEGRADED, 1);
            integrity.put(IntegrityStatus.MISSING, 0);
            integrity.put(IntegrityStatus.ERROR, 0);

            return new ScoringPolicy(freshness, retention, integrity, 0.8, 0.5);
        }

        public int points(FreshnessStatus status) { return freshnessPoints.get(status); }
        public int points(RetentionStatus status) { return retentionPoints.get(status); }
        public int points(IntegrityStatus status) { return integrityPoints.get(status); }
        public int maxPoints() { return maxPoints; }

        public OverallStatus classify(double score) {
            if (score > healthyAbove) return OverallStatus.HEALTHY;
            if (score > warningAbove) return OverallStatus.WARNING;
            return OverallStatus.CRITICAL;
        }

        private static <E extends Enum<E>> Map<E, Integer> complete(Class<E> type, Map<E, Integer> points, String name) {
            Objects.requireNonNull(points, name);
            EnumMap<E, Integer> copy = new EnumMap<>(type);
            for (E constant : type.getEnumConstants()) {
                Integer value = points.get(constant);
                if (value == null || value < 0) {
                    throw new IllegalArgumentException(name + " sem pontuação válida para " + constant);
                }
                copy.put(constant, value);
            }
            return Collections.unmodifiableMap(copy);
        }

        private static int max(Map<?, Integer> points) {
            return points.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        }
    }

    /**
     * Artefato único de um ciclo. A variante de falha ({@link #failed}) não carrega sub-resultados.
     */
    public static final class HealthReport {
        private final Instant timestamp;
        private final FreshnessResult freshness;
        private final Map<BackupType, RetentionResult> retention;
        private final IntegrityResult integrity;
        private final StorageSummary storage;
        private final double healthScore;
        private final OverallStatus overallStatus;
        private final String failure;

        private HealthReport(Instant timestamp,
                             FreshnessResult freshness,
                             Map<BackupType, RetentionResult> retention,
                             IntegrityResult integrity,
                             StorageSummary storage,
                             double healthScore,
                             OverallStatus overallStatus,
                             String failure) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.freshness = freshness;
            this.retention = retention;
            this.integrity = integrity;
            this.storage = storage;
            this.healthScore = healthScore;
            this.overallStatus = Objects.requireNonNull(overallStatus, "overallStatus");
            this.failure = failure;
        }

        public static HealthReport failed(Instant timestamp, String message) {
            return new HealthReport(timestamp, null, Map.of(), null, null, 0.0, OverallStatus.ERROR,
                    message != null ? message : "erro desconhecido");
        }

        public Instant timestamp() { return timestamp; }
        public Optional<FreshnessResult> freshness() { return Optional.ofNullable(freshness); }
        public Optional<RetentionResult> retention(BackupType type) { return Optional.ofNullable(retention.get(type)); }
        public Map<BackupType, RetentionResult> retention() { return retention; }
        public Optional<IntegrityResult> integrity() { return Optional.ofNullable(integrity); }
        public Optional<StorageSummary> storage() { return Optional.ofNullable(storage); }
        public double healthScore() { return healthScore; }
        public OverallStatus overallStatus() { return overallStatus; }
        public Optional<String> failure() { return Optional.ofNullable(failure); }

        public boolean isFailed() {
            return failure != null;
        }

        @Override
        public String toString() {
            return "HealthReport{" + timestamp +
                    ", score=" + healthScore +
                    ", status=" + overallStatus +
                    (failure != null ? ", failure=" + failure : "") +
                    "}";
        }
    }

    /** Combina os sinais de um ciclo em uma pontuação normalizada e um status. */
    public static final class HealthScorer {

        private final ScoringPolicy policy;

        public HealthScorer() {
            this(ScoringPolicy.standard());
        }

        public HealthScorer(ScoringPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * Pontuação em [0,1]. Apenas a retenção diária entra na conta; semanal e mensal são só reportadas.
         */
        public double score(FreshnessResult freshness, RetentionResult dailyRetention, IntegrityResult integrity) {
            int sum = policy.points(freshness.status())
                    + policy.points(dailyRetention.status())
                    + policy.points(integrity.status());
            double score = sum / (double) policy.maxPoints();
            return Math.max(0.0, Math.min(1.0, score));
        }

        public HealthReport evaluate(Instant timestamp,
                                     FreshnessResult freshness,
                                     Map<BackupType, RetentionResult> retention,
                                     IntegrityResult integrity,
                                     StorageSummary storage) {
            Objects.requireNonNull(freshness, "freshness");
            Objects.requireNonNull(integrity, "integrity");
            Objects.requireNonNull(storage, "storage");
            EnumMap<BackupType, RetentionResult> byType = new EnumMap<>(BackupType.class);
            for (BackupType type : BackupType.values()) {
                RetentionResult result = retention.get(type);
                if (result == null) {
                    throw new IllegalStateException("Retenção ausente para a camada " + type);
                }
                byType.put(type, result);
            }
            double score = score(freshness, byType.get(BackupType.DAILY), integrity);
            return new HealthReport(timestamp, freshness, Collections.unmodifiableMap(byType), integrity, storage,
                    score, policy.classify(score), null);
        }
    }
}
