package it.aw.collectionindex.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Contratto dello store dell'indice: sorted set con rank e valori chiave/stringa con scadenza.
 * <p>
 * Semantica allineata a Redis: nei sorted set gli elementi sono ordinati per score
 * crescente e, a parità di score, per member; i rank sono 0-based e gli indici
 * negativi dei range contano dalla fine ({@code -1} è l'ultimo elemento).
 * Ogni chiave è aggiornata atomicamente; {@link #apply(WriteBatch)} applica il batch
 * come transazione dove il backend lo consente.
 * <p>
 * Tutti i metodi possono lanciare {@link StoreUnavailableException}.
 */
public interface IndexStore {

    void apply(WriteBatch batch);

    /** Rank 0-based di {@code member}, vuoto se assente. O(log N). */
    OptionalLong rank(String key, String member);

    /** Member dal rank {@code start} al rank {@code stop} inclusi, in ordine crescente. O(log N + M). */
    List<String> rangeByRank(String key, long start, long stop);

    /** Cardinalità del sorted set, 0 se la chiave non esiste. O(1). */
    long cardinality(String key);

    Optional<String> get(String key);

    /** Valori nell'ordine delle chiavi; {@code null} per le chiavi assenti o scadute. */
    List<String> multiGet(List<String> keys);

    /** Chiavi esistenti con il prefisso dato. Operazione di manutenzione, non per il percorso interattivo. */
    Set<String> keys(String prefix);

    long delete(Collection<String> keys);
}
