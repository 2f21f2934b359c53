package it.aw.collectionindex.model;

/**
 * Opzioni di un rebuild.
 *
 * @param skipThumbnailCaching non carica le thumbnail (rebuild più veloce, card senza anteprima)
 * @param dryRun               analizza e riporta senza scrivere nulla
 */
public record RebuildOptions(boolean skipThumbnailCaching, boolean dryRun) {

    public static RebuildOptions defaults() {
        return new RebuildOptions(false, false);
    }
}
