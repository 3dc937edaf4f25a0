package com.example.backupmonitor.state;

import com.example.backupmonitor.scoring.HealthScoring.HealthReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Estado do último ciclo bem-sucedido do monitor, mantido exclusivamente em memória.
 *
 * Responsabilidade:
 *  - registrar o instante (e o relatório) da última coleta concluída sem falha;
 *  - responder se o próprio monitor está vivo, independente da saúde dos backups.
 *
 * Um único slot atômico: leitores concorrentes veem o snapshot antigo ou o novo, nunca uma mistura.
 * A instância pertence a quem agenda o monitor e é injetada; não há singleton de processo.
 */
public final class RunState {

    /** Snapshot imutável do último ciclo bem-sucedido. */
    public record Snapshot(Instant lastSuccessAt, HealthReport lastReport) {
        public Snapshot {
            Objects.requireNonNull(lastSuccessAt, "lastSuccessAt");
            Objects.requireNonNull(lastReport, "lastReport");
        }
    }

    /**
     * Resultado da verificação de vida.
     *
     * @param checkedAt           instante da verificação
     * @param minutesSinceLastRun minutos inteiros desde o último sucesso; vazio se nunca houve
     * @param alive               true se dentro do limiar
     */
    public record Liveness(Instant checkedAt, OptionalLong minutesSinceLastRun, boolean alive) {}

    private final AtomicReference<Snapshot> last = new AtomicReference<>();
    private final Clock clock;
    private final Duration livenessThreshold;

    public RunState(Clock clock, Duration livenessThreshold) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.livenessThreshold = Objects.requireNonNull(livenessThreshold, "livenessThreshold");
        if (livenessThreshold.isNegative() || livenessThreshold.isZero()) {
            throw new IllegalArgumentException("livenessThreshold deve ser positivo");
        }
    }

    /**
     * Registra um ciclo concluído. Relatórios de falha não contam como sucesso.
     */
    public void recordSuccess(Instant completedAt, HealthReport report) {
        Objects.requireNonNull(report, "report");
        if (report.isFailed()) {
            throw new IllegalArgumentException("Relatório de falha não pode ser registrado como sucesso");
        }
        last.set(new Snapshot(completedAt, report));
    }

    public Optional<Instant> lastSuccessAt() {
        Snapshot s = last.get();
        return s == null ? Optional.empty() : Optional.of(s.lastSuccessAt());
    }

    /** Último relatório bem-sucedido (status atual dos backups). */
    public Optional<HealthReport> lastReport() {
        Snapshot s = last.get();
        return s == null ? Optional.empty() : Optional.of(s.lastReport());
    }

    public OptionalLong minutesSinceLastRun(Instant now) {
        Snapshot s = last.get();
        if (s == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Duration.between(s.lastSuccessAt(), now).toMinutes());
    }

    /**
     * Verifica a vida do monitor contra o relógio atual.
     */
    public Liveness liveness() {
        Instant now = clock.instant();
        Snapshot s = last.get();
        if (s == null) {
            return new Liveness(now, OptionalLong.empty(), false);
        }
        Duration elapsed = Duration.between(s.lastSuccessAt(), now);
        boolean alive = elapsed.compareTo(livenessThreshold) < 0;
        return new Liveness(now, OptionalLong.of(elapsed.toMinutes()), alive);
    }
}
