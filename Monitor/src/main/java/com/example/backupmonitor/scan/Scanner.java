package com.example.backupmonitor.scan;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Módulo de varredura dos diretórios de backup usado pelo monitor.
 *
 * Responsabilidades principais:
 * - Listar os arquivos {@code .tar.gz} de um diretório de camada (daily/weekly/monthly);
 * - Reconstruir os metadados de cada backup ({@link BackupRecord}) contra um único instante de avaliação;
 * - Ser resiliente a erros pontuais (nome sem timestamp, arquivo ilegível, diretório sem permissão),
 *   devolvendo-os como {@link ScanIssue} em vez de exceções.
 */
public final class Scanner {

    private Scanner() {}

    /** Camadas de retenção suportadas. */
    public enum BackupType {
        DAILY,
        WEEKLY,
        MONTHLY;

        /** Nome do subdiretório da camada dentro da raiz de backups. */
        public String directoryName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Representa um arquivo de backup encontrado durante o scan.
     *
     * Imutável; {@code ageHours} e {@code healthy} já vêm calculados contra o instante de avaliação do ciclo.
     */
    public static final class BackupRecord {
        private static final double BYTES_PER_MB = 1024.0 * 1024.0;

        private final String filename;
        private final String absolutePath;
        private final BackupType type;
        private final long sizeBytes;
        private final Instant lastModifiedAt;
        private final Instant parsedTimestamp;
        private final double ageHours;
        private final boolean healthy;

        public BackupRecord(String filename,
                            String absolutePath,
                            BackupType type,
                            long sizeBytes,
                            Instant lastModifiedAt,
                            Instant parsedTimestamp,
                            double ageHours,
                            boolean healthy) {
            this.filename = Objects.requireNonNull(filename, "filename");
            this.absolutePath = Objects.requireNonNull(absolutePath, "absolutePath");
            this.type = Objects.requireNonNull(type, "type");
            this.sizeBytes = sizeBytes;
            this.lastModifiedAt = Objects.requireNonNull(lastModifiedAt, "lastModifiedAt");
            this.parsedTimestamp = parsedTimestamp;
            this.ageHours = ageHours;
            this.healthy = healthy;
        }

        public String filename() { return filename; }
        public String absolutePath() { return absolutePath; }
        public BackupType type() { return type; }
        public long sizeBytes() { return sizeBytes; }
        public Instant lastModifiedAt() { return lastModifiedAt; }

        /** Timestamp extraído do nome do arquivo (não dos metadados do filesystem). */
        public Optional<Instant> parsedTimestamp() { return Optional.ofNullable(parsedTimestamp); }

        public double ageHours() { return ageHours; }
        public boolean healthy() { return healthy; }

        public double sizeMb() {
            return sizeBytes / BYTES_PER_MB;
        }

        @Override
        public String toString() {
            return "BackupRecord{" + type + " " + filename + ", " + sizeBytes + " bytes, age=" + ageHours + "h}";
        }
    }

    /**
     * Problema não-fatal encontrado durante o scan.
     */
    public static final class ScanIssue {

        public enum Kind {
            /** Nome do arquivo sem substring yyyyMMdd_HHmmss. */
            TIMESTAMP_MISSING,
            /** Substring encontrada mas não é uma data válida. */
            TIMESTAMP_INVALID,
            /** Atributos do arquivo não puderam ser lidos; arquivo ignorado. */
            FILE_UNREADABLE,
            /** Diretório existe mas não pôde ser listado; tratado como vazio. */
            DIRECTORY_UNAVAILABLE
        }

        private final Path path;
        private final Kind kind;
        private final String message;

        public ScanIssue(Path path, Kind kind, String message) {
            this.path = Objects.requireNonNull(path, "path");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.message = Objects.requireNonNull(message, "message");
        }

        public Path path() { return path; }
        public Kind kind() { return kind; }
        public String message() { return message; }

        @Override
        public String toString() {
            return kind + " " + path + ": " + message;
        }
    }

    /**
     * Resultado do scan de um diretório: registros (mais recente primeiro) e problemas encontrados.
     */
    public static final class ScanResult {
        private final Path directory;
        private final BackupType type;
        private final List<BackupRecord> records;
        private final List<ScanIssue> issues;

        public ScanResult(Path directory, BackupType type, List<BackupRecord> records, List<ScanIssue> issues) {
            this.directory = Objects.requireNonNull(directory, "directory");
            this.type = Objects.requireNonNull(type, "type");
            this.records = List.copyOf(Objects.requireNonNull(records, "records"));
            this.issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        }

        public static ScanResult empty(Path directory, BackupType type) {
            return new ScanResult(directory, type, List.of(), List.of());
        }

        public Path directory() { return directory; }
        public BackupType type() { return type; }
        public List<BackupRecord> records() { return records; }
        public List<ScanIssue> issues() { return issues; }

        public Optional<BackupRecord> latest() {
            return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
        }
    }

    /**
     * Serviço de varredura de um diretório de camada.
     *
     * Características:
     * - Apenas arquivos regulares terminados em {@code .tar.gz} (sem recursão);
     * - Idade calculada contra o {@code evaluatedAt} recebido, nunca relendo o relógio por arquivo;
     * - Nunca lança exceção: falhas viram {@link ScanIssue}.
     *
     * Sem estado mutável; pode ser compartilhado entre scans concorrentes.
     */
    public static final class ScanService {

        private static final Logger log = LoggerFactory.getLogger(ScanService.class);

        public static final String ARCHIVE_EXTENSION = ".tar.gz";

        private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(\\d{8}_\\d{6})");
        private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
                .ofPattern("uuuuMMdd_HHmmss")
                .withResolverStyle(ResolverStyle.STRICT);

        /**
         * Registros com timestamp no nome vêm antes (mais recente primeiro); os demais ficam depois,
         * ordenados por lastModifiedAt. Um nome corrompido nunca se passa pelo backup mais recente.
         */
        static final Comparator<BackupRecord> MOST_RECENT_FIRST = Comparator
                .comparing((BackupRecord r) -> r.parsedTimestamp().isEmpty())
                .thenComparing(r -> r.parsedTimestamp().orElse(Instant.MIN), Comparator.reverseOrder())
                .thenComparing(BackupRecord::lastModifiedAt, Comparator.reverseOrder())
                .thenComparing(BackupRecord::filename);

        private final ZoneId zone;
        private final double minSizeMb;
        private final double maxAgeHours;

        /**
         * @param zone        fuso usado para interpretar o timestamp do nome (horário local do servidor de backup)
         * @param minSizeMb   tamanho mínimo (exclusivo) para um backup ser saudável
         * @param maxAgeHours idade máxima (exclusiva) para um backup ser saudável
         */
        public ScanService(ZoneId zone, double minSizeMb, double maxAgeHours) {
            this.zone = Objects.requireNonNull(zone, "zone");
            this.minSizeMb = minSizeMb;
            this.maxAgeHours = maxAgeHours;
        }

        /**
         * Varre {@code directory} e devolve os backups da camada, mais recente primeiro.
         * Diretório comprovadamente inexistente resulta em lista vazia sem problemas registrados;
         * se a existência não puder ser determinada, a leitura segue e a falha vira DIRECTORY_UNAVAILABLE.
         */
        public ScanResult scan(Path directory, BackupType type, Instant evaluatedAt) {
            Objects.requireNonNull(directory, "directory");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(evaluatedAt, "evaluatedAt");

            if (Files.notExists(directory)) {
                log.debug("Diretório de backups {} inexistente; camada {} sem backups.", directory, type);
                return ScanResult.empty(directory, type);
            }

            List<BackupRecord> records = new ArrayList<>();
            List<ScanIssue> issues = new ArrayList<>();

            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path file : stream) {
                    if (!file.getFileName().toString().endsWith(ARCHIVE_EXTENSION)) {
                        continue;
                    }
                    analyze(file, type, evaluatedAt, issues).ifPresent(records::add);
                }
            } catch (IOException | DirectoryIteratorException | SecurityException e) {
                String message = "Falha ao ler diretório de backups: " + e.getMessage();
                log.warn("{} ({})", message, directory);
                issues.add(new ScanIssue(directory, ScanIssue.Kind.DIRECTORY_UNAVAILABLE, message));
                return new ScanResult(directory, type, List.of(), issues);
            }

            records.sort(MOST_RECENT_FIRST);
            return new ScanResult(directory, type, records, issues);
        }

        private Optional<BackupRecord> analyze(Path file, BackupType type, Instant evaluatedAt, List<ScanIssue> issues) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(file, BasicFileAttributes.class);
            } catch (IOException e) {
                String message = "Atributos ilegíveis: " + e.getMessage();
                log.warn("Backup {} ignorado. {}", file, message);
                issues.add(new ScanIssue(file, ScanIssue.Kind.FILE_UNREADABLE, message));
                return Optional.empty();
            }
            if (!attrs.isRegularFile()) {
                return Optional.empty();
            }

            String filename = file.getFileName().toString();
            long size = attrs.size();
            Instant modifiedAt = attrs.lastModifiedTime().toInstant();
            double ageHours = Duration.between(modifiedAt, evaluatedAt).toMillis() / 3_600_000.0;
            Instant parsed = parseTimestamp(file, filename, issues);
            double sizeMb = size / (1024.0 * 1024.0);
            boolean healthy = sizeMb > minSizeMb && ageHours < maxAgeHours;

            return Optional.of(new BackupRecord(
                    filename,
                    file.toAbsolutePath().toString(),
                    type,
                    size,
                    modifiedAt,
                    parsed,
                    ageHours,
                    healthy));
        }

        /**
         * Extrai o instante de um nome como {@code alfresco_20250902_235538.tar.gz}.
         * Devolve null (e registra o problema) quando não há substring válida.
         */
        private Instant parseTimestamp(Path file, String filename, List<ScanIssue> issues) {
            Matcher matcher = TIMESTAMP_PATTERN.matcher(filename);
            if (!matcher.find()) {
                String message = "Nome sem timestamp yyyyMMdd_HHmmss";
                log.warn("{}: {}", message, filename);
                issues.add(new ScanIssue(file, ScanIssue.Kind.TIMESTAMP_MISSING, message));
                return null;
            }
            String raw = matcher.group(1);
            try {
                return LocalDateTime.parse(raw, TIMESTAMP_FORMAT).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                String message = "Timestamp inválido '" + raw + "': " + e.getMessage();
                log.warn("Falha ao interpretar timestamp de {}: {}", filename, e.getMessage());
                issues.add(new ScanIssue(file, ScanIssue.Kind.TIMESTAMP_INVALID, message));
                return null;
            }
        }
    }
}
