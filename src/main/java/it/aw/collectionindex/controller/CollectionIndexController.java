package it.aw.collectionindex.controller;

import it.aw.collectionindex.cache.ThumbnailCache;
import it.aw.collectionindex.cache.ThumbnailData;
import it.aw.collectionindex.cache.ThumbnailSource;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.CollectionType;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.NavigationResult;
import it.aw.collectionindex.model.PageRequest;
import it.aw.collectionindex.model.PageResult;
import it.aw.collectionindex.model.SiblingsResult;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import it.aw.collectionindex.service.CollectionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Espone navigazione, paginazione e ricerca sull'indice delle collection,
 * più il write path (salvataggio e cancellazione) che mantiene l'indice allineato.
 *
 * Endpoint disponibili:
 *   GET    /api/collections                       - pagina ordinata (filtro opzionale libraryId o type)
 *   GET    /api/collections/search?q=             - ricerca testuale, poi ordinamento e paginazione
 *   GET    /api/collections/count                 - numero di collection nello scope
 *   GET    /api/collections/{id}                  - summary indicizzato
 *   GET    /api/collections/{id}/navigation       - precedente/successiva e posizione
 *   GET    /api/collections/{id}/siblings         - pagina di vicini
 *   GET    /api/collections/{id}/thumbnail        - prima thumbnail (dalla cache)
 *   PUT    /api/collections/{id}                  - crea o aggiorna una collection
 *   DELETE /api/collections/{id}                  - elimina una collection
 *
 * Parametri di ordinamento comuni: sortBy (updatedAt, createdAt, name, imageCount, totalSize;
 * default updatedAt) e sortDirection (asc, desc; default desc).
 */
@RestController
@RequestMapping("/api/collections")
public class CollectionIndexController {

    private final CollectionIndexReader reader;
    private final CollectionService collectionService;
    private final ThumbnailCache thumbnailCache;
    private final ThumbnailSource thumbnailSource;

    public CollectionIndexController(CollectionIndexReader reader,
                                     CollectionService collectionService,
                                     ThumbnailCache thumbnailCache,
                                     ThumbnailSource thumbnailSource) {
        this.reader = reader;
        this.collectionService = collectionService;
        this.thumbnailCache = thumbnailCache;
        this.thumbnailSource = thumbnailSource;
    }

    /** Corpo di PUT /api/collections/{id}: la collection senza id e timestamp. */
    public record CollectionBody(
            String         libraryId,
            String         name,
            String         description,
            String         path,
            CollectionType type,
            List<String>   tags,
            int            imageCount,
            int            thumbnailCount,
            int            cacheCount,
            long           totalSize,
            String         firstImageId,
            String         firstThumbnailPath
    ) {
        Collection toCollection(String id) {
            return new Collection(id, libraryId, name, description, path, type, tags,
                    imageCount, thumbnailCount, cacheCount, totalSize,
                    firstImageId, firstThumbnailPath, null, null);
        }
    }

    // -------------------------------------------------------------------------
    // GET /api/collections?page=&pageSize=&sortBy=&sortDirection=&libraryId=&type=
    // -------------------------------------------------------------------------

    /**
     * Pagina ordinata di summary. libraryId e type sono alternativi.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/collections?page=2&pageSize=50&sortBy=name&sortDirection=asc"
     *   curl "http://localhost:8889/api/collections?type=zip"
     */
    @GetMapping
    public ResponseEntity<PageResult> list(
            @RequestParam(value = "page",          defaultValue = "1") int page,
            @RequestParam(value = "pageSize",      defaultValue = "" + PageRequest.DEFAULT_PAGE_SIZE) int pageSize,
            @RequestParam(value = "sortBy",        defaultValue = "updatedAt") String sortBy,
            @RequestParam(value = "sortDirection", defaultValue = "desc") String sortDirection,
            @RequestParam(value = "libraryId",     required = false) String libraryId,
            @RequestParam(value = "type",          required = false) String type) {
        return ResponseEntity.ok(reader.getPage(scope(libraryId, type), new PageRequest(page, pageSize),
                SortField.fromKey(sortBy), SortDirection.fromKey(sortDirection)));
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/search?q=...
    // -------------------------------------------------------------------------

    /**
     * Ricerca su nome, path, descrizione e tag (case-insensitive). Scorre l'intero scope:
     * più lenta della paginazione semplice.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/collections/search?q=vacanze&sortBy=createdAt"
     */
    @GetMapping("/search")
    public ResponseEntity<PageResult> search(
            @RequestParam("q") String query,
            @RequestParam(value = "page",          defaultValue = "1") int page,
            @RequestParam(value = "pageSize",      defaultValue = "" + PageRequest.DEFAULT_PAGE_SIZE) int pageSize,
            @RequestParam(value = "sortBy",        defaultValue = "updatedAt") String sortBy,
            @RequestParam(value = "sortDirection", defaultValue = "desc") String sortDirection,
            @RequestParam(value = "libraryId",     required = false) String libraryId,
            @RequestParam(value = "type",          required = false) String type) {
        return ResponseEntity.ok(reader.searchPage(query, new PageRequest(page, pageSize),
                SortField.fromKey(sortBy), SortDirection.fromKey(sortDirection), scope(libraryId, type)));
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/count
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/collections/count?libraryId=lib-1"
     */
    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> count(
            @RequestParam(value = "libraryId", required = false) String libraryId,
            @RequestParam(value = "type",      required = false) String type) {
        return ResponseEntity.ok(Map.of("count", reader.getCount(scope(libraryId, type))));
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/{id}
    // -------------------------------------------------------------------------

    @GetMapping("/{id}")
    public ResponseEntity<CollectionSummary> getSummary(@PathVariable String id) {
        return reader.getSummary(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/{id}/navigation
    // -------------------------------------------------------------------------

    /**
     * Precedente e successiva nell'ordinamento richiesto. Una collection non indicizzata
     * restituisce 200 con {@code found=false}.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/collections/abc123/navigation?sortBy=name&sortDirection=asc"
     */
    @GetMapping("/{id}/navigation")
    public ResponseEntity<NavigationResult> navigation(
            @PathVariable String id,
            @RequestParam(value = "sortBy",        defaultValue = "updatedAt") String sortBy,
            @RequestParam(value = "sortDirection", defaultValue = "desc") String sortDirection,
            @RequestParam(value = "libraryId",     required = false) String libraryId,
            @RequestParam(value = "type",          required = false) String type) {
        return ResponseEntity.ok(reader.getNavigation(id, SortField.fromKey(sortBy),
                SortDirection.fromKey(sortDirection), scope(libraryId, type)));
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/{id}/siblings
    // -------------------------------------------------------------------------

    /**
     * Senza {@code page} restituisce la pagina che contiene la collection.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/collections/abc123/siblings?pageSize=10"
     */
    @GetMapping("/{id}/siblings")
    public ResponseEntity<SiblingsResult> siblings(
            @PathVariable String id,
            @RequestParam(value = "page",          required = false) Integer page,
            @RequestParam(value = "pageSize",      defaultValue = "" + PageRequest.DEFAULT_PAGE_SIZE) int pageSize,
            @RequestParam(value = "sortBy",        defaultValue = "updatedAt") String sortBy,
            @RequestParam(value = "sortDirection", defaultValue = "desc") String sortDirection) {
        return ResponseEntity.ok(reader.getSiblings(id, page, pageSize,
                SortField.fromKey(sortBy), SortDirection.fromKey(sortDirection)));
    }

    // -------------------------------------------------------------------------
    // GET /api/collections/{id}/thumbnail
    // -------------------------------------------------------------------------

    /**
     * Serve la prima thumbnail dalla cache; in caso di miss la carica dal filesystem
     * e la mette in cache per le richieste successive.
     *
     * Esempio:
     *   curl -o thumb.jpg http://localhost:8889/api/collections/abc123/thumbnail
     */
    @GetMapping("/{id}/thumbnail")
    public ResponseEntity<byte[]> thumbnail(@PathVariable String id) {
        Optional<ThumbnailData> thumbnail = thumbnailCache.get(id);
        if (thumbnail.isEmpty()) {
            thumbnail = collectionService.findById(id).flatMap(thumbnailSource::load);
            thumbnail.ifPresent(t -> thumbnailCache.put(id, t));
        }
        return thumbnail
                .map(t -> ResponseEntity.ok().contentType(MediaType.parseMediaType(t.contentType())).body(t.bytes()))
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // PUT /api/collections/{id}
    // -------------------------------------------------------------------------

    /**
     * Crea o aggiorna una collection; l'indice è aggiornato prima della risposta.
     *
     * Esempio:
     *   curl -X PUT http://localhost:8889/api/collections/abc123 \
     *        -H "Content-Type: application/json" \
     *        -d '{"name":"Vacanze 2024","path":"/media/vacanze","type":"FOLDER","imageCount":120}'
     */
    @PutMapping("/{id}")
    public ResponseEntity<Collection> save(@PathVariable String id, @RequestBody CollectionBody body) {
        return ResponseEntity.ok(collectionService.save(body.toCollection(id)));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/collections/{id}
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X DELETE http://localhost:8889/api/collections/abc123
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return collectionService.delete(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private static IndexScope scope(String libraryId, String type) {
        if (libraryId != null && !libraryId.isBlank() && type != null && !type.isBlank()) {
            throw new IllegalArgumentException("libraryId e type sono alternativi");
        }
        if (libraryId != null && !libraryId.isBlank()) {
            return IndexScope.library(libraryId);
        }
        if (type != null && !type.isBlank()) {
            return IndexScope.type(CollectionType.fromKey(type));
        }
        return IndexScope.global();
    }
}
