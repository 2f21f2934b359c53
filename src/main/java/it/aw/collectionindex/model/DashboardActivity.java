package it.aw.collectionindex.model;

import java.time.Instant;

/**
 * Evento recente mostrato in dashboard (es. "collection_created", "index_rebuilt").
 */
public record DashboardActivity(
        String  type,
        String  message,
        String  collectionId,    // null per eventi di sistema
        String  collectionName,
        Instant timestamp
) {}
