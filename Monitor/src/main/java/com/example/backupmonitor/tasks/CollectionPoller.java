package com.example.backupmonitor.tasks;

import com.example.backupmonitor.events.Events.EventSink;
import com.example.backupmonitor.events.Events.MetricEvent;
import com.example.backupmonitor.monitor.BackupMonitor;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agendador externo do monitor: a cada intervalo executa uma coleta e publica os eventos no sink.
 *
 * O motor em si não agenda nada; este poller é o "cron" do processo headless.
 * Falhas de um ciclo são registradas e o próximo ciclo segue normalmente.
 */
public final class CollectionPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CollectionPoller.class);

    private final BackupMonitor monitor;
    private final EventSink sink;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public CollectionPoller(BackupMonitor monitor, EventSink sink, Duration interval) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.interval = interval != null ? interval : Duration.ofMinutes(5);
        if (this.interval.isZero() || this.interval.isNegative()) {
            throw new IllegalArgumentException("interval deve ser positivo");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backup-monitor-poller");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::runOnce, 0, interval.toNanos(), TimeUnit.NANOSECONDS);
        log.info("Collection Poller iniciado. Intervalo: {}ms", interval.toMillis());
    }

    /**
     * Executa um ciclo: coleta, evento de vida do monitor e publicação.
     *
     * @return true se os eventos foram publicados
     */
    public boolean runOnce() {
        try {
            List<MetricEvent> events = new ArrayList<>(monitor.collect());
            events.add(monitor.monitorHealth());
            sink.publish(events);
            log.debug("Publicados {} eventos.", events.size());
            return true;
        } catch (IOException e) {
            log.warn("Falha ao publicar eventos de backup: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // scheduleWithFixedDelay cancela a tarefa se uma exceção escapar
            log.warn("Erro no ciclo de coleta: {}", e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Forçando encerramento do scheduler...");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
