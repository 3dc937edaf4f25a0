package com.example.backupmonitor.analysis;

import com.example.backupmonitor.scan.Scanner.BackupRecord;
import com.example.backupmonitor.scan.Scanner.BackupType;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agrega os sinais calculados sobre os backups de um ciclo: frescor, retenção, integridade e uso de storage.
 *
 * Todos os analisadores são funções puras sobre listas imutáveis de {@link BackupRecord}
 * (ordenadas do mais recente para o mais antigo, como devolvidas pelo scanner).
 */
public final class Analysis {

    private Analysis() {}

    // ---- Resultados ---------------------------------------------------------

    public enum FreshnessStatus { HEALTHY, STALE, MISSING }

    public enum RetentionStatus { CRITICAL, WARNING, HEALTHY }

    public enum IntegrityStatus { HEALTHY, DEGRADED, MISSING, ERROR }

    public static final class FreshnessResult {
        private final FreshnessStatus status;
        private final Double ageHours;
        private final String message;

        private FreshnessResult(FreshnessStatus status, Double ageHours, String message) {
            this.status = Objects.requireNonNull(status, "status");
            this.ageHours = ageHours;
            this.message = Objects.requireNonNull(message, "message");
        }

        public static FreshnessResult missing() {
            return new FreshnessResult(FreshnessStatus.MISSING, null, "No backups found");
        }

        public static FreshnessResult of(FreshnessStatus status, double ageHours, String message) {
            return new FreshnessResult(status, ageHours, message);
        }

        public FreshnessStatus status() { return status; }

        /** Idade do backup mais recente; vazio quando não há backups. */
        public OptionalDouble ageHours() {
            return ageHours == null ? OptionalDouble.empty() : OptionalDouble.of(ageHours);
        }

        public String message() { return message; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FreshnessResult)) return false;
            FreshnessResult that = (FreshnessResult) o;
            return status == that.status && Objects.equals(ageHours, that.ageHours) && message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(status, ageHours, message);
        }

        @Override
        public String toString() {
            return "Freshness{" + status + ", ageHours=" + ageHours + ", " + message + "}";
        }
    }

    public record RetentionResult(BackupType type,
                                  int actualCount,
                                  int expectedCount,
                                  int healthyCount,
                                  RetentionStatus status) {
        public RetentionResult {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(status, "status");
        }
    }

    public static final class IntegrityResult {
        private final IntegrityStatus status;
        private final double score;
        private final double sizeMb;
        private final String filename;
        private final String message;

        private IntegrityResult(IntegrityStatus status, double score, double sizeMb, String filename, String message) {
            this.status = Objects.requireNonNull(status, "status");
            this.score = score;
            this.sizeMb = sizeMb;
            this.filename = filename;
            this.message = message;
        }

        public static IntegrityResult missing() {
            return new IntegrityResult(IntegrityStatus.MISSING, 0.0, 0.0, null, "No backup files found");
        }

        public static IntegrityResult error(String message) {
            return new IntegrityResult(IntegrityStatus.ERROR, 0.0, 0.0, null, message);
        }

        public static IntegrityResult evaluated(IntegrityStatus status, double score, double sizeMb, String filename) {
            return new IntegrityResult(status, score, sizeMb, filename, null);
        }

        public IntegrityStatus status() { return status; }
        public double score() { return score; }
        public double sizeMb() { return sizeMb; }
        public Optional<String> filename() { return Optional.ofNullable(filename); }
        public Optional<String> message() { return Optional.ofNullable(message); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof IntegrityResult)) return false;
            IntegrityResult that = (IntegrityResult) o;
            return status == that.status
                    && Double.compare(score, that.score) == 0
                    && Double.compare(sizeMb, that.sizeMb) == 0
                    && Objects.equals(filename, that.filename)
                    && Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(status, score, sizeMb, filename, message);
        }

        @Override
        public String toString() {
            return "Integrity{" + status + ", score=" + score + ", sizeMb=" + sizeMb + ", file=" + filename + "}";
        }
    }

    public record StorageSummary(double totalSizeMb, int dailyCount, int weeklyCount, int monthlyCount) {

        public int count(BackupType type) {
            return switch (type) {
                case DAILY -> dailyCount;
                case WEEKLY -> weeklyCount;
                case MONTHLY -> monthlyCount;
            };
        }
    }

    // ---- Analisadores -------------------------------------------------------

    /** Verifica se o backup mais recente está dentro do intervalo esperado. */
    public static final class FreshnessAnalyzer {

        public FreshnessResult analyze(List<BackupRecord> records, double expectedIntervalHours) {
            if (records == null || records.isEmpty()) {
                return FreshnessResult.missing();
            }
            double age = records.get(0).ageHours();
            if (age < expectedIntervalHours) {
                return FreshnessResult.of(FreshnessStatus.HEALTHY, age, "Recent backup available");
            }
            return FreshnessResult.of(FreshnessStatus.STALE, age, "Latest backup is " + (int) age + " hours old");
        }
    }

    /** Compara a quantidade de backups de uma camada com a esperada. */
    public static final class RetentionAnalyzer {

        public RetentionResult analyze(BackupType type, List<BackupRecord> records, int expectedCount) {
            int actual = records == null ? 0 : records.size();
            int healthy = records == null ? 0 : (int) records.stream().filter(BackupRecord::healthy).count();
            RetentionStatus status;
            if (actual < expectedCount / 2.0) {
                status = RetentionStatus.CRITICAL;
            } else if (actual < expectedCount) {
                status = RetentionStatus.WARNING;
            } else {
                status = RetentionStatus.HEALTHY;
            }
            return new RetentionResult(type, actual, expectedCount, healthy, status);
        }
    }

    /**
     * Heurística de integridade baseada apenas no tamanho do backup diário mais recente.
     * Não abre nem valida o conteúdo do arquivo.
     */
    public static final class IntegrityAnalyzer {

        private static final Logger log = LoggerFactory.getLogger(IntegrityAnalyzer.class);

        public IntegrityResult analyze(Optional<BackupRecord> latestDaily) {
            try {
                if (latestDaily.isEmpty()) {
                    return IntegrityResult.missing();
                }
                BackupRecord latest = latestDaily.get();
                double sizeMb = latest.sizeMb();
                double score = scoreForSize(sizeMb);
                IntegrityStatus status = score > 0.5 ? IntegrityStatus.HEALTHY : IntegrityStatus.DEGRADED;
                return IntegrityResult.evaluated(status, score, sizeMb, latest.filename());
            } catch (RuntimeException e) {
                log.error("Falha na verificação de integridade do backup: {}", e.getMessage(), e);
                return IntegrityResult.error(String.valueOf(e.getMessage()));
            }
        }

        /** Monotônica e constante por faixas. */
        static double scoreForSize(double sizeMb) {
            if (Double.isNaN(sizeMb) || sizeMb < 0) {
                throw new IllegalArgumentException("Tamanho de backup inválido: " + sizeMb);
            }
            if (sizeMb < 0.1) return 0.0;   // suspeitamente pequeno
            if (sizeMb < 1.0) return 0.3;   // provavelmente faltando componentes
            if (sizeMb < 5.0) return 0.7;
            if (sizeMb < 50.0) return 0.9;
            return 1.0;
        }
    }

    /** Soma descritiva de tamanho e contagens, sem classificação. */
    public static final class StorageAggregator {

        public StorageSummary aggregate(Collection<BackupRecord> daily,
                                        Collection<BackupRecord> weekly,
                                        Collection<BackupRecord> monthly) {
            double total = 0.0;
            for (Collection<BackupRecord> tier : List.of(daily, weekly, monthly)) {
                for (BackupRecord record : tier) {
                    total += record.sizeMb();
                }
            }
            return new StorageSummary(total, daily.size(), weekly.size(), monthly.size());
        }
    }
}
