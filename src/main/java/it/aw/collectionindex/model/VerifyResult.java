package it.aw.collectionindex.model;

import java.time.Duration;
import java.util.List;

/**
 * Esito della verifica di consistenza tra registry e indice.
 * <p>
 * Le incongruenze sono dati, non eccezioni: ogni lista contiene gli id coinvolti.
 * Con {@code dryRun == false} {@code applied} indica che le correzioni sono state eseguite.
 */
public record VerifyResult(
        boolean        consistent,
        boolean        dryRun,
        boolean        applied,
        boolean        cancelled,
        int            totalInSource,
        int            totalInIndex,
        List<String>   missingInIndex,     // da aggiungere
        List<String>   outdatedInIndex,    // indexedAt < updatedAt
        List<String>   missingThumbnails,  // thumbnail generata dopo l'indicizzazione
        List<String>   scopeMismatches,    // assenti dal sorted set di libreria o tipo
        List<String>   orphanedInIndex,    // nell'indice ma non più nella sorgente
        Duration       duration
) {
    public VerifyResult {
        missingInIndex = List.copyOf(missingInIndex);
        outdatedInIndex = List.copyOf(outdatedInIndex);
        missingThumbnails = List.copyOf(missingThumbnails);
        scopeMismatches = List.copyOf(scopeMismatches);
        orphanedInIndex = List.copyOf(orphanedInIndex);
    }

    public int toAdd() {
        return missingInIndex.size();
    }

    public int toUpdate() {
        return outdatedInIndex.size() + missingThumbnails.size() + scopeMismatches.size();
    }

    public int toRemove() {
        return orphanedInIndex.size();
    }
}
