package it.aw.collectionindex.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dimensione di filtro su cui l'indice ordinato è mantenuto separatamente:
 * globale, per libreria, per tipo.
 */
public record IndexScope(Kind kind, String value) {

    public enum Kind { GLOBAL, LIBRARY, TYPE }

    private static final IndexScope GLOBAL = new IndexScope(Kind.GLOBAL, null);

    public IndexScope {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.GLOBAL && (value == null || value.isBlank())) {
            throw new IllegalArgumentException("Lo scope " + kind + " richiede un valore");
        }
    }

    public static IndexScope global() {
        return GLOBAL;
    }

    public static IndexScope library(String libraryId) {
        return new IndexScope(Kind.LIBRARY, libraryId);
    }

    public static IndexScope type(CollectionType type) {
        return new IndexScope(Kind.TYPE, type.key());
    }

    /**
     * Scope a cui appartiene un summary: sempre il globale e il tipo,
     * la libreria solo se valorizzata.
     */
    public static List<IndexScope> of(CollectionSummary summary) {
        List<IndexScope> scopes = new ArrayList<>(3);
        scopes.add(GLOBAL);
        if (summary.libraryId() != null && !summary.libraryId().isBlank()) {
            scopes.add(library(summary.libraryId()));
        }
        scopes.add(type(summary.type()));
        return scopes;
    }
}
