package it.aw.collectionindex.rebuild;

import it.aw.collectionindex.index.CancellationSignal;
import it.aw.collectionindex.model.RebuildJobStatus;
import it.aw.collectionindex.model.RebuildMode;
import it.aw.collectionindex.model.RebuildOptions;
import it.aw.collectionindex.model.RebuildStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Esegue rebuild e verifiche su un unico thread in background: al massimo un job alla volta.
 */
@Component
public class RebuildJobRunner {

    private static final Logger log = LoggerFactory.getLogger(RebuildJobRunner.class);

    private final RebuildOrchestrator orchestrator;
    private final Clock clock;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "index-rebuild");
        t.setDaemon(true);
        return t;
    });

    private CancellationSignal currentSignal;
    private RebuildMode currentMode;
    private Instant currentStartedAt;
    private volatile RebuildStatistics lastStatistics;

    public RebuildJobRunner(RebuildOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    /**
     * Avvia un job se nessun altro è in corso.
     *
     * @return {@code false} se un job è già in esecuzione
     */
    public synchronized boolean start(RebuildMode mode, RebuildOptions options) {
        return submit(mode, options) != null;
    }

    /** Come {@link #start} ma restituisce il future del job, {@code null} se già occupato. */
    synchronized Future<?> submit(RebuildMode mode, RebuildOptions options) {
        if (currentSignal != null) {
            log.info("Rebuild {} rifiutato: job {} già in corso", mode, currentMode);
            return null;
        }
        CancellationSignal signal = new CancellationSignal();
        currentSignal = signal;
        currentMode = mode;
        currentStartedAt = clock.instant();
        return executor.submit(() -> run(mode, options, signal));
    }

    private void run(RebuildMode mode, RebuildOptions options, CancellationSignal signal) {
        try {
            lastStatistics = orchestrator.rebuild(mode, options, signal);
        } catch (RuntimeException e) {
            log.error("Job di rebuild {} terminato con errore", mode, e);
        } finally {
            synchronized (this) {
                currentSignal = null;
                currentMode = null;
                currentStartedAt = null;
            }
        }
    }

    /** @return {@code true} se c'era un job da annullare */
    public synchronized boolean cancel() {
        if (currentSignal == null) {
            return false;
        }
        currentSignal.cancel();
        log.info("Annullamento richiesto per il rebuild {}", currentMode);
        return true;
    }

    public synchronized boolean isRunning() {
        return currentSignal != null;
    }

    public RebuildStatistics lastStatistics() {
        return lastStatistics;
    }

    public synchronized RebuildJobStatus status() {
        return new RebuildJobStatus(currentSignal != null, currentMode, currentStartedAt, lastStatistics);
    }

    @PreDestroy
    void shutdown() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job di rebuild ancora attivo allo shutdown, interruzione forzata");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
