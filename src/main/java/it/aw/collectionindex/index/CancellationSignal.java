package it.aw.collectionindex.index;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Richiesta di annullamento cooperativa: chi esegue il lavoro la controlla
 * tra un'operazione e l'altra, mai a metà di un upsert.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
