package it.aw.collectionindex.model;

import java.time.Instant;
import java.util.Map;

/**
 * Statistiche aggregate sullo stato dell'indice.
 */
public record IndexStats(
        long              totalCollections,
        Instant           lastRebuildTime,   // null se mai ricostruito
        boolean           valid,
        Map<String, Long> sortedSetSizes     // chiave del sorted set globale -> cardinalità
) {}
