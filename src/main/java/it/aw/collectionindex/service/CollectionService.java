package it.aw.collectionindex.service;

import it.aw.collectionindex.cache.DashboardStatisticsService;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.index.CollectionIndexWriter;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.registry.CollectionRegistry;
import it.aw.collectionindex.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Write path delle collection: persiste la mutazione nel registry e aggiorna
 * subito indice e dashboard.
 * <p>
 * Le mutazioni sullo stesso id sono serializzate (lock a strisce sull'id).
 * Se lo store dell'indice non è raggiungibile la mutazione resta valida nel registry e
 * {@link StoreUnavailableException} arriva al chiamante (503). Un salvataggio mancato
 * viene recuperato dal rebuild CHANGED_ONLY, una cancellazione mancata dalla verifica.
 */
@Service
public class CollectionService {

    private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

    private static final int LOCK_STRIPES = 64;

    private final CollectionRegistry registry;
    private final CollectionIndexWriter writer;
    private final CollectionIndexReader reader;
    private final DashboardStatisticsService dashboard;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public CollectionService(CollectionRegistry registry,
                             CollectionIndexWriter writer,
                             CollectionIndexReader reader,
                             DashboardStatisticsService dashboard,
                             Clock clock) {
        this.registry = registry;
        this.writer = writer;
        this.reader = reader;
        this.dashboard = dashboard;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public Optional<Collection> findById(String collectionId) {
        return registry.findById(collectionId);
    }

    /**
     * Crea o aggiorna la collection. {@code updatedAt} viene sempre fatto avanzare
     * ({@code max(now, precedente + 1ms)}), così il rebuild incrementale vede la modifica.
     *
     * @return la collection salvata, con i timestamp assegnati
     */
    public Collection save(Collection collection) {
        synchronized (lockFor(collection.id())) {
            Optional<Collection> previous = registry.findById(collection.id());
            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            Instant createdAt = previous.map(Collection::createdAt)
                    .orElse(Instant.EPOCH.equals(collection.createdAt()) ? now : collection.createdAt());
            Instant updatedAt = previous
                    .map(p -> p.updatedAt().plusMillis(1))
                    .filter(next -> next.isAfter(now))
                    .orElse(now);
            Collection stamped = new Collection(collection.id(), collection.libraryId(), collection.name(),
                    collection.description(), collection.path(), collection.type(), collection.tags(),
                    collection.imageCount(), collection.thumbnailCount(), collection.cacheCount(),
                    collection.totalSize(), collection.firstImageId(), collection.firstThumbnailPath(),
                    createdAt, updatedAt);
            registry.save(stamped);

            try {
                CollectionSummary previousSummary = reader.getSummary(stamped.id()).orElse(null);
                CollectionSummary summary = writer.upsert(stamped);
                updateDashboard(() -> dashboard.onUpsert(previousSummary, summary));
            } catch (StoreUnavailableException e) {
                log.error("Collection {} salvata nel registry ma non indicizzata: {}. " +
                        "Il prossimo rebuild CHANGED_ONLY la recupera", stamped.id(), e.getMessage());
                throw e;
            }
            log.info("Collection salvata: id={}, nome='{}', {}", stamped.id(), stamped.name(),
                    previous.isPresent() ? "aggiornata" : "nuova");
            return stamped;
        }
    }

    /** @return {@code false} se la collection non esisteva */
    public boolean delete(String collectionId) {
        synchronized (lockFor(collectionId)) {
            boolean existed = registry.remove(collectionId);
            try {
                Optional<CollectionSummary> removed = writer.remove(collectionId);
                removed.ifPresent(summary -> updateDashboard(() -> dashboard.onRemove(summary)));
            } catch (StoreUnavailableException e) {
                log.error("Collection {} eliminata dal registry ma ancora nell'indice: {}. " +
                        "Serve una verifica (VERIFY) per rimuoverla", collectionId, e.getMessage());
                throw e;
            }
            if (existed) {
                log.info("Collection eliminata: id={}", collectionId);
            }
            return existed;
        }
    }

    private void updateDashboard(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("Aggiornamento statistiche dashboard fallito: {}", e.getMessage());
        }
    }

    private Object lockFor(String collectionId) {
        return locks[Math.floorMod(collectionId.hashCode(), LOCK_STRIPES)];
    }
}
