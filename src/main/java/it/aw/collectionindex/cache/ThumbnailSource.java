package it.aw.collectionindex.cache;

import it.aw.collectionindex.model.Collection;

import java.util.Optional;

/**
 * Fornisce i byte della prima thumbnail di una collection durante il rebuild.
 * La generazione delle thumbnail è esterna a questo servizio.
 */
public interface ThumbnailSource {

    /** Vuoto se la collection non ha thumbnail o il file non è leggibile. */
    Optional<ThumbnailData> load(Collection collection);
}
