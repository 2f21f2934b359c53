package it.aw.collectionindex.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * {@link IndexStore} su Redis tramite {@link StringRedisTemplate}.
 * <p>
 * Ogni {@link WriteBatch} è inviato come MULTI/EXEC: un upsert non è mai visibile a
 * metà e un batch di thumbnail costa un solo round trip. Gli errori di connessione
 * e i timeout diventano {@link StoreUnavailableException}.
 */
public class RedisIndexStore implements IndexStore {

    private static final Logger log = LoggerFactory.getLogger(RedisIndexStore.class);

    private final StringRedisTemplate template;

    public RedisIndexStore(StringRedisTemplate template) {
        this.template = template;
    }

    @Override
    public void apply(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        call(() -> template.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                // la sessione lega la connessione al thread: il template tipizzato la riusa
                template.multi();
                for (WriteBatch.Op op : batch.ops()) {
                    switch (op.type()) {
                        case SORTED_ADD -> template.opsForZSet().add(op.key(), op.member(), op.score());
                        case SORTED_REMOVE -> template.opsForZSet().remove(op.key(), op.member());
                        case SET -> {
                            if (op.ttl() != null) {
                                template.opsForValue().set(op.key(), op.value(), op.ttl());
                            } else {
                                template.opsForValue().set(op.key(), op.value());
                            }
                        }
                        case DELETE -> template.delete(op.key());
                    }
                }
                return template.exec();
            }
        }));
        log.trace("Batch Redis applicato: {} operazioni", batch.size());
    }

    @Override
    public OptionalLong rank(String key, String member) {
        Long rank = call(() -> template.opsForZSet().rank(key, member));
        return rank == null ? OptionalLong.empty() : OptionalLong.of(rank);
    }

    @Override
    public List<String> rangeByRank(String key, long start, long stop) {
        Set<String> members = call(() -> template.opsForZSet().range(key, start, stop));
        return members == null ? List.of() : new ArrayList<>(members);
    }

    @Override
    public long cardinality(String key) {
        Long size = call(() -> template.opsForZSet().zCard(key));
        return size == null ? 0 : size;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call(() -> template.opsForValue().get(key)));
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> values = call(() -> template.opsForValue().multiGet(keys));
        if (values == null) {
            List<String> empty = new ArrayList<>(keys.size());
            keys.forEach(k -> empty.add(null));
            return empty;
        }
        return values;
    }

    @Override
    public Set<String> keys(String prefix) {
        // KEYS blocca il server: usato da clear, verify e remove senza summary, mai dalle letture
        Set<String> keys = call(() -> template.keys(prefix + "*"));
        return keys == null ? Set.of() : new TreeSet<>(keys);
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = call(() -> template.delete(keys));
        return deleted == null ? 0 : deleted;
    }

    private <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            throw new StoreUnavailableException("Redis non raggiungibile: " + e.getMessage(), e);
        }
    }
}
