package com.example.backupmonitor.config;

import com.example.backupmonitor.scan.Scanner.BackupType;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuração tipada e imutável do monitor.
 * Validada uma única vez em {@link Builder#build()}; o restante do código não relê chaves cruas.
 */
public final class MonitorSettings {

    public static final double DEFAULT_EXPECTED_INTERVAL_HOURS = 25;
    public static final int DEFAULT_RETENTION_DAILY = 7;
    public static final int DEFAULT_RETENTION_WEEKLY = 4;
    public static final int DEFAULT_RETENTION_MONTHLY = 6;
    public static final double DEFAULT_MIN_BACKUP_SIZE_MB = 1;
    public static final double DEFAULT_MAX_BACKUP_AGE_HOURS = 168;
    public static final int DEFAULT_EVENT_TTL_SECONDS = 300;
    public static final int DEFAULT_LIVENESS_MINUTES = 10;

    /** Destinos suportados para os eventos. */
    public enum SinkKind { STDOUT, INFLUX }

    private final Path backupRoot;
    private final double expectedIntervalHours;
    private final int retentionDaily;
    private final int retentionWeekly;
    private final int retentionMonthly;
    private final double minBackupSizeMb;
    private final double maxBackupAgeHours;
    private final String host;
    private final int eventTtlSeconds;
    private final int livenessMinutes;
    private final int intervalSeconds;
    private final SinkKind sink;
    private final String influxWriteUrl;

    private MonitorSettings(Builder b, Path backupRoot) {
        this.backupRoot = backupRoot;
        this.expectedIntervalHours = b.expectedIntervalHours;
        this.retentionDaily = b.retentionDaily;
        this.retentionWeekly = b.retentionWeekly;
        this.retentionMonthly = b.retentionMonthly;
        this.minBackupSizeMb = b.minBackupSizeMb;
        this.maxBackupAgeHours = b.maxBackupAgeHours;
        this.host = b.host;
        this.eventTtlSeconds = b.eventTtlSeconds;
        this.livenessMinutes = b.livenessMinutes;
        this.intervalSeconds = b.intervalSeconds;
        this.sink = b.sink;
        this.influxWriteUrl = b.influxWriteUrl;
    }

    public static Builder builder() { return new Builder(); }

    public Path backupRoot() { return backupRoot; }
    public double expectedIntervalHours() { return expectedIntervalHours; }
    public double minBackupSizeMb() { return minBackupSizeMb; }
    public double maxBackupAgeHours() { return maxBackupAgeHours; }
    public String host() { return host; }
    public int eventTtlSeconds() { return eventTtlSeconds; }
    public Duration livenessThreshold() { return Duration.ofMinutes(livenessMinutes); }
    public int intervalSeconds() { return intervalSeconds; }
    public SinkKind sink() { return sink; }
    public Optional<String> influxWriteUrl() { return Optional.ofNullable(influxWriteUrl); }

    /** Quantidade esperada de backups para a camada. */
    public int expectedCount(BackupType type) {
        return switch (type) {
            case DAILY -> retentionDaily;
            case WEEKLY -> retentionWeekly;
            case MONTHLY -> retentionMonthly;
        };
    }

    /** Diretório da camada dentro da raiz: daily/, weekly/ ou monthly/. */
    public Path directoryFor(BackupType type) {
        return backupRoot.resolve(type.directoryName());
    }

    @Override
    public String toString() {
        return "MonitorSettings{" +
                "backupRoot=" + backupRoot +
                ", expectedIntervalHours=" + expectedIntervalHours +
                ", retention=" + retentionDaily + "/" + retentionWeekly + "/" + retentionMonthly +
                ", minBackupSizeMb=" + minBackupSizeMb +
                ", maxBackupAgeHours=" + maxBackupAgeHours +
                ", host=" + host +
                ", ttl=" + eventTtlSeconds +
                ", liveness=" + livenessMinutes + "min" +
                ", interval=" + intervalSeconds + "s" +
                ", sink=" + sink +
                "}";
    }

    public static final class Builder {
        private String backupRoot;
        private double expectedIntervalHours = DEFAULT_EXPECTED_INTERVAL_HOURS;
        private int retentionDaily = DEFAULT_RETENTION_DAILY;
        private int retentionWeekly = DEFAULT_RETENTION_WEEKLY;
        private int retentionMonthly = DEFAULT_RETENTION_MONTHLY;
        private double minBackupSizeMb = DEFAULT_MIN_BACKUP_SIZE_MB;
        private double maxBackupAgeHours = DEFAULT_MAX_BACKUP_AGE_HOURS;
        private String host = "localhost";
        private int eventTtlSeconds = DEFAULT_EVENT_TTL_SECONDS;
        private int livenessMinutes = DEFAULT_LIVENESS_MINUTES;
        private int intervalSeconds;
        private SinkKind sink = SinkKind.STDOUT;
        private String influxWriteUrl;

        public Builder backupRoot(String v) { this.backupRoot = v; return this; }
        public Builder expectedIntervalHours(double v) { this.expectedIntervalHours = v; return this; }
        public Builder retention(int daily, int weekly, int monthly) {
            this.retentionDaily = daily;
            this.retentionWeekly = weekly;
            this.retentionMonthly = monthly;
            return this;
        }
        public Builder minBackupSizeMb(double v) { this.minBackupSizeMb = v; return this; }
        public Builder maxBackupAgeHours(double v) { this.maxBackupAgeHours = v; return this; }
        public Builder host(String v) { this.host = v; return this; }
        public Builder eventTtlSeconds(int v) { this.eventTtlSeconds = v; return this; }
        public Builder livenessMinutes(int v) { this.livenessMinutes = v; return this; }
        public Builder intervalSeconds(int v) { this.intervalSeconds = v; return this; }
        public Builder sink(SinkKind v) { this.sink = v; return this; }
        public Builder influxWriteUrl(String v) { this.influxWriteUrl = v; return this; }

        /**
         * Valida e constrói.
         *
         * @throws IllegalStateException se algum campo estiver fora da faixa aceita
         */
        public MonitorSettings build() {
            if (backupRoot == null || backupRoot.isBlank()) {
                throw new IllegalStateException("BACKUP_ROOT é obrigatório");
            }
            Path root;
            try {
                root = Path.of(backupRoot).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                throw new IllegalStateException("BACKUP_ROOT inválido: " + e.getMessage(), e);
            }
            requirePositive("BACKUP_EXPECTED_INTERVAL_HOURS", expectedIntervalHours);
            requirePositive("BACKUP_MAX_AGE_HOURS", maxBackupAgeHours);
            if (!(minBackupSizeMb >= 0) || Double.isInfinite(minBackupSizeMb)) {
                throw new IllegalStateException("BACKUP_MIN_SIZE_MB deve ser >= 0: " + minBackupSizeMb);
            }
            requireNonNegative("BACKUP_RETENTION_DAILY", retentionDaily);
            requireNonNegative("BACKUP_RETENTION_WEEKLY", retentionWeekly);
            requireNonNegative("BACKUP_RETENTION_MONTHLY", retentionMonthly);
            if (eventTtlSeconds < 1 || eventTtlSeconds > 86400) {
                throw new IllegalStateException("MONITOR_EVENT_TTL_SECONDS fora de [1, 86400]: " + eventTtlSeconds);
            }
            if (livenessMinutes < 1) {
                throw new IllegalStateException("MONITOR_LIVENESS_MINUTES deve ser >= 1: " + livenessMinutes);
            }
            requireNonNegative("MONITOR_INTERVAL_SECONDS", intervalSeconds);
            Objects.requireNonNull(sink, "sink");
            if (host == null || host.isBlank()) {
                throw new IllegalStateException("MONITOR_HOST não pode ser vazio");
            }
            if (sink == SinkKind.INFLUX && (influxWriteUrl == null || influxWriteUrl.isBlank())) {
                throw new IllegalStateException("INFLUXDB_WRITE_URL é obrigatório quando MONITOR_SINK=influx");
            }
            if (influxWriteUrl != null && !influxWriteUrl.startsWith("http")) {
                throw new IllegalStateException("INFLUXDB_WRITE_URL deve começar com http/https");
            }
            return new MonitorSettings(this, root);
        }

        private static void requirePositive(String key, double v) {
            if (!(v > 0) || Double.isInfinite(v)) {
                throw new IllegalStateException(key + " deve ser > 0: " + v);
            }
        }

        private static void requireNonNegative(String key, int v) {
            if (v < 0) {
                throw new IllegalStateException(key + " deve ser >= 0: " + v);
            }
        }
    }
}
