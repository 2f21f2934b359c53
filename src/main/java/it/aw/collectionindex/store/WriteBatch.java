package it.aw.collectionindex.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sequenza di scritture da applicare come un'unica unità con {@link IndexStore#apply(WriteBatch)}.
 * Le operazioni sono applicate nell'ordine di inserimento.
 */
public final class WriteBatch {

    public enum OpType { SORTED_ADD, SORTED_REMOVE, SET, DELETE }

    /**
     * Singola operazione. {@code ttl} è null per i valori senza scadenza.
     */
    public record Op(OpType type, String key, String member, double score, String value, Duration ttl) {}

    private final List<Op> ops = new ArrayList<>();

    public WriteBatch sortedAdd(String key, String member, double score) {
        ops.add(new Op(OpType.SORTED_ADD, key, member, score, null, null));
        return this;
    }

    public WriteBatch sortedRemove(String key, String member) {
        ops.add(new Op(OpType.SORTED_REMOVE, key, member, 0, null, null));
        return this;
    }

    public WriteBatch set(String key, String value) {
        ops.add(new Op(OpType.SET, key, null, 0, value, null));
        return this;
    }

    public WriteBatch set(String key, String value, Duration ttl) {
        ops.add(new Op(OpType.SET, key, null, 0, value, ttl));
        return this;
    }

    public WriteBatch delete(String key) {
        ops.add(new Op(OpType.DELETE, key, null, 0, null, null));
        return this;
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public int size() {
        return ops.size();
    }
}
