package com.example.backupmonitor.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Responsável por carregar e expor as configurações cruas do monitor de backups.
 *
 * PRINCÍPIOS:
 * - Falhar cedo: valores inválidos explodem ao montar {@link MonitorSettings}, não no meio de um ciclo.
 * - Constantes centralizadas para as chaves.
 * - Precedência: overrides > variáveis de ambiente > system properties > .env.
 *
 * A visão tipada (e validada uma única vez) fica em {@link #monitorSettings()}.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Diretório raiz que contém daily/, weekly/ e monthly/. */
    public static final String BACKUP_ROOT = "BACKUP_ROOT";
    /** Intervalo esperado entre backups diários (horas). Padrão 25 (1h de folga). */
    public static final String EXPECTED_INTERVAL_HOURS = "BACKUP_EXPECTED_INTERVAL_HOURS";
    /** Quantidade esperada de backups por camada. */
    public static final String RETENTION_DAILY = "BACKUP_RETENTION_DAILY";
    public static final String RETENTION_WEEKLY = "BACKUP_RETENTION_WEEKLY";
    public static final String RETENTION_MONTHLY = "BACKUP_RETENTION_MONTHLY";
    /** Tamanho mínimo (MB) para um backup ser considerado saudável. */
    public static final String MIN_BACKUP_SIZE_MB = "BACKUP_MIN_SIZE_MB";
    /** Idade máxima (horas) para um backup ser considerado saudável. Padrão 168 (7 dias). */
    public static final String MAX_BACKUP_AGE_HOURS = "BACKUP_MAX_AGE_HOURS";

    /** Host reportado nos eventos. Padrão: hostname local. */
    public static final String MONITOR_HOST = "MONITOR_HOST";
    /** TTL (segundos) dos eventos emitidos. Padrão 300. */
    public static final String EVENT_TTL_SECONDS = "MONITOR_EVENT_TTL_SECONDS";
    /** Janela (minutos) em que o próprio monitor é considerado vivo. Padrão 10. */
    public static final String LIVENESS_MINUTES = "MONITOR_LIVENESS_MINUTES";
    /** Intervalo entre coletas (segundos). 0 = executa uma vez e encerra. */
    public static final String INTERVAL_SECONDS = "MONITOR_INTERVAL_SECONDS";
    /** Destino dos eventos: "stdout" (padrão) ou "influx". */
    public static final String MONITOR_SINK = "MONITOR_SINK";
    /** Endpoint de escrita do InfluxDB (line protocol). Obrigatório se MONITOR_SINK=influx. */
    public static final String INFLUXDB_WRITE_URL = "INFLUXDB_WRITE_URL";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados das fontes externas. */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (sobrescrevem system properties em conflito)
     * 3) Arquivo .env (preenche apenas ausentes)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        System.getenv().forEach(map::put);

        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor obrigatório; lança IllegalStateException se ausente.
     */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= VISÃO TIPADA =======

    /**
     * Monta e valida a configuração tipada do monitor.
     *
     * @throws IllegalStateException se algum valor for inválido
     */
    public MonitorSettings monitorSettings() {
        return MonitorSettings.builder()
                .backupRoot(getOrDefault(BACKUP_ROOT, System.getProperty("user.home") + "/backups"))
                .expectedIntervalHours(doubleConfig(EXPECTED_INTERVAL_HOURS, MonitorSettings.DEFAULT_EXPECTED_INTERVAL_HOURS))
                .retention(
                        intConfig(RETENTION_DAILY, MonitorSettings.DEFAULT_RETENTION_DAILY),
                        intConfig(RETENTION_WEEKLY, MonitorSettings.DEFAULT_RETENTION_WEEKLY),
                        intConfig(RETENTION_MONTHLY, MonitorSettings.DEFAULT_RETENTION_MONTHLY))
                .minBackupSizeMb(doubleConfig(MIN_BACKUP_SIZE_MB, MonitorSettings.DEFAULT_MIN_BACKUP_SIZE_MB))
                .maxBackupAgeHours(doubleConfig(MAX_BACKUP_AGE_HOURS, MonitorSettings.DEFAULT_MAX_BACKUP_AGE_HOURS))
                .host(find(MONITOR_HOST).orElseGet(AppConfig::localHostname))
                .eventTtlSeconds(intConfig(EVENT_TTL_SECONDS, MonitorSettings.DEFAULT_EVENT_TTL_SECONDS))
                .livenessMinutes(intConfig(LIVENESS_MINUTES, MonitorSettings.DEFAULT_LIVENESS_MINUTES))
                .intervalSeconds(intConfig(INTERVAL_SECONDS, 0))
                .sink(sinkKind())
                .influxWriteUrl(find(INFLUXDB_WRITE_URL).orElse(null))
                .build();
    }

    /**
     * Destino dos eventos. Qualquer valor fora de "stdout"/"influx" falha cedo.
     */
    public MonitorSettings.SinkKind sinkKind() {
        String v = getOrDefault(MONITOR_SINK, "stdout").trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "stdout" -> MonitorSettings.SinkKind.STDOUT;
            case "influx" -> MonitorSettings.SinkKind.INFLUX;
            default -> throw new IllegalStateException("MONITOR_SINK inválido: use 'stdout' ou 'influx'");
        };
    }

    // ======= HELPERS TIPADOS =======

    /** Parser double estrito: valor presente e inválido falha cedo. */
    private double doubleConfig(String key, double def) {
        Optional<String> raw = find(key);
        if (raw.isEmpty()) {
            return def;
        }
        try {
            return Double.parseDouble(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Valor numérico inválido para " + key + ": " + raw.get(), e);
        }
    }

    /** Parser int estrito: valor presente e inválido falha cedo. */
    private int intConfig(String key, int def) {
        Optional<String> raw = find(key);
        if (raw.isEmpty()) {
            return def;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Valor inteiro inválido para " + key + ": " + raw.get(), e);
        }
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
