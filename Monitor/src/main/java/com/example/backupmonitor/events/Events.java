package com.example.backupmonitor.events;

import com.example.backupmonitor.analysis.Analysis.FreshnessResult;
import com.example.backupmonitor.analysis.Analysis.IntegrityResult;
import com.example.backupmonitor.analysis.Analysis.RetentionResult;
import com.example.backupmonitor.analysis.Analysis.StorageSummary;
import com.example.backupmonitor.scan.Scanner.BackupType;
import com.example.backupmonitor.scoring.HealthScoring.HealthReport;
import com.example.backupmonitor.scoring.HealthScoring.OverallStatus;
import com.example.backupmonitor.state.RunState.Liveness;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Projeção do relatório de saúde em eventos de métrica genéricos e os destinos (sinks) desses eventos.
 */
public final class Events {

    private Events() {}

    /** Sentinela para a idade quando não há backup algum. */
    public static final double MISSING_AGE_SENTINEL = 999.0;

    /**
     * Registro de métrica emitido para o pipeline de observabilidade.
     *
     * @param service     nome hierárquico separado por pontos (ex.: backup.health.score)
     * @param metric      valor numérico
     * @param state       rótulo de estado em minúsculas; null quando a métrica não é classificada
     * @param description texto legível
     * @param time        instante em segundos unix
     * @param host        host de origem
     * @param ttl         validade em segundos
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"service", "metric", "state", "description", "time", "host", "ttl"})
    public record MetricEvent(@JsonProperty("service") String service,
                              @JsonProperty("metric") double metric,
                              @JsonProperty("state") String state,
                              @JsonProperty("description") String description,
                              @JsonProperty("time") long time,
                              @JsonProperty("host") String host,
                              @JsonProperty("ttl") int ttl) {

        public MetricEvent {
            Objects.requireNonNull(service, "service");
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(host, "host");
        }

        public Optional<String> stateLabel() {
            return Optional.ofNullable(state);
        }
    }

    /**
     * Mapeamento sem estado de {@link HealthReport} para a lista ordenada de {@link MetricEvent}.
     */
    public static final class EventProjector {

        private final String host;
        private final int ttlSeconds;

        public EventProjector(String host, int ttlSeconds) {
            this.host = Objects.requireNonNull(host, "host");
            this.ttlSeconds = ttlSeconds;
        }

        public List<MetricEvent> project(HealthReport report) {
            Objects.requireNonNull(report, "report");
            long time = report.timestamp().getEpochSecond();
            List<MetricEvent> events = new ArrayList<>();

            events.add(event(time, "backup.health.score", report.healthScore(), label(report.overallStatus()),
                    "Overall backup health score: " + format2(report.healthScore())));

            if (report.isFailed()) {
                events.add(processEvent(time, report.overallStatus()));
                events.add(errorEvent(time, report.failure().orElse("")));
                return List.copyOf(events);
            }

            report.freshness().ifPresent(freshness -> events.add(freshnessEvent(time, freshness)));

            for (BackupType type : BackupType.values()) {
                report.retention(type).ifPresent(retention -> {
                    String tier = type.directoryName();
                    events.add(event(time, "backup.retention." + tier + ".count", retention.actualCount(),
                            label(retention.status()), capitalize(tier) + " backups: " + retention.actualCount()));
                });
            }
            for (BackupType type : BackupType.values()) {
                report.retention(type).ifPresent(retention -> events.add(healthyEvent(time, type, retention)));
            }

            report.integrity().ifPresent(integrity -> events.add(integrityEvent(time, integrity)));
            report.storage().ifPresent(storage -> events.addAll(storageEvents(time, storage)));

            events.add(processEvent(time, report.overallStatus()));
            return List.copyOf(events);
        }

        /** Evento de falha do próprio monitor, emitido mesmo sem relatório. */
        public MetricEvent monitorError(Instant at, String message) {
            return errorEvent(at.getEpochSecond(), message);
        }

        /** Evento de vida do monitor (backup.monitor.health). */
        public MetricEvent monitorHealth(Liveness liveness) {
            Objects.requireNonNull(liveness, "liveness");
            String description = liveness.minutesSinceLastRun().isPresent()
                    ? "Backup monitor last ran " + liveness.minutesSinceLastRun().getAsLong() + " minutes ago"
                    : "Backup monitor has not completed a run yet";
            return event(liveness.checkedAt().getEpochSecond(), "backup.monitor.health",
                    liveness.alive() ? 1 : 0, liveness.alive() ? "ok" : "critical", description);
        }

        private MetricEvent freshnessEvent(long time, FreshnessResult freshness) {
            double age = freshness.ageHours().orElse(MISSING_AGE_SENTINEL);
            return event(time, "backup.freshness.age_hours", age, label(freshness.status()), freshness.message());
        }

        private MetricEvent healthyEvent(long time, BackupType type, RetentionResult retention) {
            String tier = type.directoryName();
            return event(time, "backup.retention." + tier + ".healthy", retention.healthyCount(), null,
                    "Healthy " + tier + " backups: " + retention.healthyCount());
        }

        private MetricEvent integrityEvent(long time, IntegrityResult integrity) {
            return event(time, "backup.integrity.score", integrity.score(), label(integrity.status()),
                    "Backup integrity score: " + format2(integrity.score()));
        }

        private List<MetricEvent> storageEvents(long time, StorageSummary storage) {
            List<MetricEvent> events = new ArrayList<>();
            events.add(event(time, "backup.storage.total_size_mb", storage.totalSizeMb(), null,
                    "Total backup storage: " + String.format(Locale.ROOT, "%.1f MB", storage.totalSizeMb())));
            for (BackupType type : BackupType.values()) {
                String tier = type.directoryName();
                events.add(event(time, "backup.storage." + tier + "_count", storage.count(type), null,
                        "Number of " + tier + " backups: " + storage.count(type)));
            }
            return events;
        }

        private MetricEvent processEvent(long time, OverallStatus status) {
            boolean healthy = status == OverallStatus.HEALTHY;
            return event(time, "backup.process.last_success", healthy ? 1 : 0, healthy ? "ok" : "critical",
                    "Last backup process status: " + label(status));
        }

        private MetricEvent errorEvent(long time, String message) {
            return event(time, "backup.monitor.error", 0, "critical", "Backup monitoring error: " + message);
        }

        private MetricEvent event(long time, String service, double metric, String state, String description) {
            return new MetricEvent(service, metric, state, description, time, host, ttlSeconds);
        }

        private static String label(Enum<?> status) {
            return status.name().toLowerCase(Locale.ROOT);
        }

        private static String format2(double value) {
            return String.format(Locale.ROOT, "%.2f", value);
        }

        private static String capitalize(String s) {
            return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
        }
    }

    // ---- Sinks --------------------------------------------------------------

    /** Destino dos eventos. O transporte é responsabilidade de quem implementa. */
    public interface EventSink extends AutoCloseable {

        void publish(List<MetricEvent> events) throws IOException;

        @Override
        default void close() throws IOException {
            // default no-op
        }
    }

    /**
     * Escreve um objeto JSON por linha (Jackson). Por padrão na saída padrão.
     */
    public static final class JsonLinesEventSink implements EventSink {

        private final Writer writer;
        private final ObjectMapper mapper;

        public JsonLinesEventSink() {
            this(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), new ObjectMapper());
        }

        public JsonLinesEventSink(Writer writer, ObjectMapper mapper) {
            this.writer = Objects.requireNonNull(writer, "writer");
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        @Override
        public synchronized void publish(List<MetricEvent> events) throws IOException {
            for (MetricEvent event : events) {
                writer.write(mapper.writeValueAsString(event));
                writer.write('\n');
            }
            writer.flush();
        }
    }

    /**
     * Envia os eventos para o endpoint de escrita do InfluxDB em line protocol.
     * Ex.: {@code backup_health_score,host=srv,state=ok value=0.75 1756857338000000000}
     */
    public static final class InfluxLineProtocolSink implements EventSink {

        private static final MediaType TEXT = MediaType.get("text/plain; charset=utf-8");

        private final OkHttpClient httpClient;
        private final String writeUrl;

        public InfluxLineProtocolSink(String writeUrl) {
            this(new OkHttpClient.Builder()
                    .connectTimeout(10, TimeUnit.SECONDS)
                    .readTimeout(10, TimeUnit.SECONDS)
                    .build(), writeUrl);
        }

        public InfluxLineProtocolSink(OkHttpClient httpClient, String writeUrl) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            this.writeUrl = Objects.requireNonNull(writeUrl, "writeUrl");
        }

        @Override
        public void publish(List<MetricEvent> events) throws IOException {
            if (events.isEmpty()) {
                return;
            }
            Request request = new Request.Builder()
                    .url(writeUrl)
                    .post(RequestBody.create(toLineProtocol(events), TEXT))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("InfluxDB respondeu HTTP " + response.code() + " ao gravar " + events.size() + " eventos");
                }
            }
        }

        static String toLineProtocol(List<MetricEvent> events) {
            StringBuilder sb = new StringBuilder();
            for (MetricEvent event : events) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(escape(event.service().replace('.', '_')))
                        .append(",host=").append(escape(event.host()));
                event.stateLabel().ifPresent(state -> sb.append(",state=").append(escape(state)));
                sb.append(" value=").append(event.metric())
                        .append(' ').append(TimeUnit.SECONDS.toNanos(event.time()));
            }
            return sb.toString();
        }

        /** Escapa vírgula, igual e espaço conforme o line protocol. */
        private static String escape(String raw) {
            return raw.replace("\\", "\\\\").replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
        }

        @Override
        public void close() {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }
}
