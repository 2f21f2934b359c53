package it.aw.collectionindex.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Esito di un rebuild. Per la modalità VERIFY {@code verify} contiene il dettaglio.
 */
public record RebuildStatistics(
        RebuildMode    mode,
        RebuildOutcome outcome,
        boolean        dryRun,
        int            totalCollections,
        int            skippedCollections,
        int            rebuiltCollections,
        int            removedCollections,
        int            cachedThumbnails,
        Instant        startedAt,
        Instant        completedAt,
        Duration       duration,
        String         failureMessage,   // valorizzato solo per FAILED
        VerifyResult   verify            // valorizzato solo per VERIFY
) {}
