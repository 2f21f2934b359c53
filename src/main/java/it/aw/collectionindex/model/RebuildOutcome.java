package it.aw.collectionindex.model;

public enum RebuildOutcome {
    COMPLETED,
    /** Interrotto su richiesta: le statistiche sono parziali. */
    CANCELLED,
    /** Store non raggiungibile: le statistiche riportano l'avanzamento fino all'errore. */
    FAILED
}
