package com.example.backupmonitor;

import com.example.backupmonitor.config.AppConfig;
import com.example.backupmonitor.config.MonitorSettings;
import com.example.backupmonitor.events.Events.EventSink;
import com.example.backupmonitor.events.Events.InfluxLineProtocolSink;
import com.example.backupmonitor.events.Events.JsonLinesEventSink;
import com.example.backupmonitor.monitor.BackupMonitor;
import com.example.backupmonitor.state.RunState;
import com.example.backupmonitor.tasks.CollectionPoller;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrada headless do monitor de backups. Carrega a configuração, monta o motor e
 * executa uma coleta (MONITOR_INTERVAL_SECONDS=0) ou inicia o poller periódico.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        new Main().run();
    }

    public void run() throws Exception {
        AppConfig config = AppConfig.load();
        MonitorSettings settings = config.monitorSettings();
        log.info("Backup monitor inicializado. Config: {}", settings);

        Clock clock = Clock.systemDefaultZone();
        RunState runState = new RunState(clock, settings.livenessThreshold());
        BackupMonitor monitor = new BackupMonitor(settings, clock, runState);
        EventSink sink = createSink(settings);

        if (settings.intervalSeconds() == 0) {
            try (sink; CollectionPoller poller = new CollectionPoller(monitor, sink, Duration.ofMinutes(5))) {
                if (!poller.runOnce()) {
                    log.warn("Coleta única concluída sem publicar eventos.");
                }
            }
            return;
        }

        CollectionPoller poller = new CollectionPoller(monitor, sink, Duration.ofSeconds(settings.intervalSeconds()));
        poller.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            poller.close();
            try {
                sink.close();
            } catch (Exception e) {
                log.warn("Falha ao fechar sink de eventos: {}", e.getMessage());
            }
            latch.countDown();
        }));

        log.info("Monitor headless iniciado. Coleta a cada {}s.", settings.intervalSeconds());
        latch.await();
    }

    private EventSink createSink(MonitorSettings settings) {
        return switch (settings.sink()) {
            case STDOUT -> new JsonLinesEventSink();
            case INFLUX -> new InfluxLineProtocolSink(settings.influxWriteUrl()
                    .orElseThrow(() -> new IllegalStateException("INFLUXDB_WRITE_URL ausente")));
        };
    }
}
