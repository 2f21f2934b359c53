package it.aw.collectionindex.registry;

import it.aw.collectionindex.support.TestCollections;

import java.nio.file.Path;

/** Apre un registry DuckDB su file come farebbe il contesto Spring. */
public final class TestRegistries {

    private TestRegistries() {}

    public static CollectionRegistry open(Path dbFile) throws Exception {
        CollectionRegistry registry = new CollectionRegistry(TestCollections.objectMapper(), dbFile.toString());
        registry.init();
        return registry;
    }

    public static void close(CollectionRegistry registry) {
        registry.close();
    }
}
