package it.aw.collectionindex.model;

import java.time.Instant;

/**
 * Stato del job di rebuild in background, esposto dall'endpoint di amministrazione.
 */
public record RebuildJobStatus(
        boolean           running,
        RebuildMode       mode,            // modalità del job in corso, null se fermo
        Instant           startedAt,       // avvio del job in corso, null se fermo
        RebuildStatistics lastStatistics   // esito dell'ultimo job concluso, null se mai eseguito
) {}
