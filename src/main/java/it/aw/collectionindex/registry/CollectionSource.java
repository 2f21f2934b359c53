package it.aw.collectionindex.registry;

import it.aw.collectionindex.model.Collection;

import java.util.List;
import java.util.Optional;

/**
 * Sorgente di verità delle collection, letta dal rebuild, dal verifier e dalla dashboard.
 */
public interface CollectionSource {

    Optional<Collection> findById(String collectionId);

    /**
     * Pagina keyset ordinata per id.
     *
     * @param afterId ultimo id della pagina precedente, {@code null} per la prima pagina
     * @param limit   numero massimo di collection restituite
     */
    List<Collection> findPage(String afterId, int limit);

    long count();
}
