package it.aw.collectionindex.support;

import it.aw.collectionindex.store.InMemoryIndexStore;
import it.aw.collectionindex.store.IndexStore;
import it.aw.collectionindex.store.StoreUnavailableException;
import it.aw.collectionindex.store.WriteBatch;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** Store in memoria che fa fallire le prossime N scritture con {@link StoreUnavailableException}. */
public class FlakyIndexStore implements IndexStore {

    private final InMemoryIndexStore delegate;
    private final AtomicInteger failingWrites = new AtomicInteger();
    private final AtomicInteger writeAttempts = new AtomicInteger();

    public FlakyIndexStore(Clock clock) {
        this.delegate = new InMemoryIndexStore(clock);
    }

    public void failNextWrites(int count) {
        failingWrites.set(count);
    }

    public int writeAttempts() {
        return writeAttempts.get();
    }

    @Override
    public void apply(WriteBatch batch) {
        writeAttempts.incrementAndGet();
        if (failingWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreUnavailableException("connessione rifiutata");
        }
        delegate.apply(batch);
    }

    @Override
    public OptionalLong rank(String key, String member) {
        return delegate.rank(key, member);
    }

    @Override
    public List<String> rangeByRank(String key, long start, long stop) {
        return delegate.rangeByRank(key, start, stop);
    }

    @Override
    public long cardinality(String key) {
        return delegate.cardinality(key);
    }

    @Override
    public Optional<String> get(String key) {
        return delegate.get(key);
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        return delegate.multiGet(keys);
    }

    @Override
    public Set<String> keys(String prefix) {
        return delegate.keys(prefix);
    }

    @Override
    public long delete(Collection<String> keys) {
        return delegate.delete(keys);
    }
}
