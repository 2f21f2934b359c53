package it.aw.collectionindex.cache;

import it.aw.collectionindex.index.IndexKeys;
import it.aw.collectionindex.store.IndexStore;
import it.aw.collectionindex.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Cache delle thumbnail pronte da servire, chiave {@code collection_index:thumb:{id}}.
 * <p>
 * Le voci scadono dopo {@code index.thumbnail.ttl}; il rebuild scrive in blocco con
 * {@link #putAll(Map)} per evitare un round trip per collection.
 */
@Component
public class ThumbnailCache {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailCache.class);

    private final IndexStore store;
    private final Duration ttl;

    public ThumbnailCache(IndexStore store, @Value("${index.thumbnail.ttl:30d}") Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    public Optional<ThumbnailData> get(String collectionId) {
        return store.get(IndexKeys.thumbnail(collectionId)).map(ThumbnailData::fromDataUrl);
    }

    public void put(String collectionId, ThumbnailData thumbnail) {
        put(collectionId, thumbnail, ttl);
    }

    public void put(String collectionId, ThumbnailData thumbnail, Duration expiration) {
        store.apply(new WriteBatch().set(IndexKeys.thumbnail(collectionId), thumbnail.toDataUrl(), expiration));
        log.debug("Thumbnail in cache per {}: {} byte, scadenza {}", collectionId, thumbnail.bytes().length, expiration);
    }

    /** Scrive tutte le thumbnail in un unico batch. */
    public void putAll(Map<String, ThumbnailData> thumbnails) {
        if (thumbnails.isEmpty()) {
            return;
        }
        WriteBatch batch = new WriteBatch();
        thumbnails.forEach((id, thumbnail) -> batch.set(IndexKeys.thumbnail(id), thumbnail.toDataUrl(), ttl));
        store.apply(batch);
        log.debug("Batch di {} thumbnail scritto in cache", thumbnails.size());
    }

    public void evict(String collectionId) {
        store.apply(new WriteBatch().delete(IndexKeys.thumbnail(collectionId)));
    }
}
