package it.aw.collectionindex.model;

/**
 * Modalità di rebuild dell'indice.
 */
public enum RebuildMode {
    /** Solo le collection con {@code updatedAt > indexedAt} (default). */
    CHANGED_ONLY,
    /** Confronto sorgente/indice tramite il verifier, con correzione se non dry run. */
    VERIFY,
    /** Svuota sorted set, summary e stati, poi ricostruisce tutto. */
    FULL,
    /** Riproietta tutto senza svuotare: per cambi di contenuto del summary. */
    FORCE_REBUILD_ALL
}
