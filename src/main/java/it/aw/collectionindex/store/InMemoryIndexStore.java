package it.aw.collectionindex.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Implementazione in memoria di {@link IndexStore}, per i test e per installazioni a nodo singolo.
 * <p>
 * Ogni sorted set è un {@link RankedSet}; l'atomicità è per chiave, come in Redis
 * senza MULTI: un lettore può osservare un batch a metà per la sola durata di
 * {@link #apply(WriteBatch)}. La scadenza dei valori è valutata in lettura.
 */
public class InMemoryIndexStore implements IndexStore {

    private record Value(String data, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentMap<String, RankedSet> sortedSets = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Value> values = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIndexStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryIndexStore() {
        this(Clock.systemUTC());
    }

    @Override
    public void apply(WriteBatch batch) {
        for (WriteBatch.Op op : batch.ops()) {
            switch (op.type()) {
                case SORTED_ADD -> sortedSets.compute(op.key(), (key, set) -> {
                    RankedSet target = set != null ? set : new RankedSet();
                    target.add(op.member(), op.score());
                    return target;
                });
                case SORTED_REMOVE -> sortedSets.computeIfPresent(op.key(), (key, set) -> {
                    set.remove(op.member());
                    return set.isEmpty() ? null : set;
                });
                case SET -> values.put(op.key(), new Value(op.value(),
                        op.ttl() != null ? clock.instant().plus(op.ttl()) : null));
                case DELETE -> {
                    sortedSets.remove(op.key());
                    values.remove(op.key());
                }
            }
        }
    }

    @Override
    public OptionalLong rank(String key, String member) {
        RankedSet set = sortedSets.get(key);
        return set == null ? OptionalLong.empty() : set.rank(member);
    }

    @Override
    public List<String> rangeByRank(String key, long start, long stop) {
        RankedSet set = sortedSets.get(key);
        return set == null ? List.of() : set.range(start, stop);
    }

    @Override
    public long cardinality(String key) {
        RankedSet set = sortedSets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public Optional<String> get(String key) {
        Value value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isExpired(clock.instant())) {
            values.remove(key, value);
            return Optional.empty();
        }
        return Optional.of(value.data());
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        List<String> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(get(key).orElse(null));
        }
        return result;
    }

    @Override
    public Set<String> keys(String prefix) {
        Instant now = clock.instant();
        Set<String> result = new TreeSet<>();
        sortedSets.keySet().stream().filter(k -> k.startsWith(prefix)).forEach(result::add);
        values.forEach((key, value) -> {
            if (key.startsWith(prefix) && !value.isExpired(now)) {
                result.add(key);
            }
        });
        return result;
    }

    @Override
    public long delete(Collection<String> keys) {
        long deleted = 0;
        for (String key : keys) {
            boolean removedSet = sortedSets.remove(key) != null;
            boolean removedValue = values.remove(key) != null;
            if (removedSet || removedValue) {
                deleted++;
            }
        }
        return deleted;
    }
}
