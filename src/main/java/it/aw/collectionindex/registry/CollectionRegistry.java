package it.aw.collectionindex.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro delle collection (sorgente di verità), persistito nella tabella
 * {@code collections} di un file DuckDB.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato (DuckDBConnection non è thread-safe).
 * I timestamp sono salvati come epoch millis per non dipendere dal fuso del processo.
 * <p>
 * Migrazione schema additiva: le colonne introdotte dopo la prima versione
 * vengono aggiunte con {@code ADD COLUMN IF NOT EXISTS}, i dati esistenti restano.
 */
@Component
public class CollectionRegistry implements CollectionSource {

    private static final Logger log = LoggerFactory.getLogger(CollectionRegistry.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS collections (
                collection_id   VARCHAR PRIMARY KEY,
                library_id      VARCHAR,
                name            VARCHAR NOT NULL,
                description     VARCHAR,
                path            VARCHAR NOT NULL,
                type            VARCHAR NOT NULL,
                image_count     INTEGER NOT NULL,
                total_size      BIGINT  NOT NULL,
                created_at_ms   BIGINT  NOT NULL,
                updated_at_ms   BIGINT  NOT NULL
            )
            """;

    /** Colonne aggiunte nelle versioni successive (DuckDB non accetta vincoli in ADD COLUMN). */
    private static final Map<String, String> ADDED_COLUMNS = Map.of(
            "tags",                 "VARCHAR DEFAULT '[]'",
            "thumbnail_count",      "INTEGER DEFAULT 0",
            "cache_count",          "INTEGER DEFAULT 0",
            "first_image_id",       "VARCHAR",
            "first_thumbnail_path", "VARCHAR"
    );

    private static final String COLUMNS =
            "collection_id, library_id, name, description, path, type, image_count, total_size, " +
            "created_at_ms, updated_at_ms, tags, thumbnail_count, cache_count, first_image_id, first_thumbnail_path";

    private static final TypeReference<List<String>> TAG_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String dbPath;
    private Connection conn;

    public CollectionRegistry(ObjectMapper objectMapper,
                              @Value("${store.collections.path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
            for (Map.Entry<String, String> column : ADDED_COLUMNS.entrySet()) {
                stmt.execute("ALTER TABLE collections ADD COLUMN IF NOT EXISTS "
                        + column.getKey() + " " + column.getValue());
            }
        }
        log.info("CollectionRegistry: tabella 'collections' pronta su {} ({} collection)",
                path.toAbsolutePath(), count());
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    /** Inserisce o sostituisce la collection. */
    public synchronized void save(Collection collection) {
        String sql = "INSERT INTO collections (" + COLUMNS + ") " + """
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (collection_id) DO UPDATE SET
                    library_id           = EXCLUDED.library_id,
                    name                 = EXCLUDED.name,
                    description          = EXCLUDED.description,
                    path                 = EXCLUDED.path,
                    type                 = EXCLUDED.type,
                    image_count          = EXCLUDED.image_count,
                    total_size           = EXCLUDED.total_size,
                    created_at_ms        = EXCLUDED.created_at_ms,
                    updated_at_ms        = EXCLUDED.updated_at_ms,
                    tags                 = EXCLUDED.tags,
                    thumbnail_count      = EXCLUDED.thumbnail_count,
                    cache_count          = EXCLUDED.cache_count,
                    first_image_id       = EXCLUDED.first_image_id,
                    first_thumbnail_path = EXCLUDED.first_thumbnail_path
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, collection.id());
            ps.setString(2, collection.libraryId());
            ps.setString(3, collection.name() != null ? collection.name() : "");
            ps.setString(4, collection.description());
            ps.setString(5, collection.path() != null ? collection.path() : "");
            ps.setString(6, collection.type().name());
            ps.setInt(7, collection.imageCount());
            ps.setLong(8, collection.totalSize());
            ps.setLong(9, collection.createdAt().toEpochMilli());
            ps.setLong(10, collection.updatedAt().toEpochMilli());
            ps.setString(11, objectMapper.writeValueAsString(collection.tags()));
            ps.setInt(12, collection.thumbnailCount());
            ps.setInt(13, collection.cacheCount());
            ps.setString(14, collection.firstImageId());
            ps.setString(15, collection.firstThumbnailPath());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Errore salvataggio collection " + collection.id() + " nel registry", e);
        }
    }

    @Override
    public synchronized Optional<Collection> findById(String collectionId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM collections WHERE collection_id = ?")) {
            ps.setString(1, collectionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toCollection(rs));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura collection dal registry", e);
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<Collection> findPage(String afterId, int limit) {
        List<Collection> result = new ArrayList<>();
        String sql = afterId != null
                ? "SELECT " + COLUMNS + " FROM collections WHERE collection_id > ? ORDER BY collection_id LIMIT ?"
                : "SELECT " + COLUMNS + " FROM collections ORDER BY collection_id LIMIT ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (afterId != null) ps.setString(i++, afterId);
            ps.setInt(i, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toCollection(rs));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura pagina del registry", e);
        }
        return result;
    }

    @Override
    public synchronized long count() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM collections")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio collection", e);
        }
    }

    /** Rimuove la collection; {@code false} se non esisteva. */
    public synchronized boolean remove(String collectionId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM collections WHERE collection_id = ?")) {
            ps.setString(1, collectionId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore rimozione collection dal registry", e);
        }
    }

    private Collection toCollection(ResultSet rs) throws SQLException, IOException {
        String tags = rs.getString("tags");
        return new Collection(
                rs.getString("collection_id"),
                rs.getString("library_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("path"),
                CollectionType.fromKey(rs.getString("type")),
                tags != null ? objectMapper.readValue(tags, TAG_LIST_TYPE) : List.of(),
                rs.getInt("image_count"),
                rs.getInt("thumbnail_count"),
                rs.getInt("cache_count"),
                rs.getLong("total_size"),
                rs.getString("first_image_id"),
                rs.getString("first_thumbnail_path"),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms"))
        );
    }
}
