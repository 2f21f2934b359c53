package it.aw.collectionindex.controller;

import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.IndexStats;
import it.aw.collectionindex.model.RebuildJobStatus;
import it.aw.collectionindex.model.RebuildMode;
import it.aw.collectionindex.model.RebuildOptions;
import it.aw.collectionindex.rebuild.RebuildJobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

/**
 * Operazioni di manutenzione sull'indice: rebuild, verifica, annullamento e diagnostica.
 * Rebuild e verifica girano in background; lo stato si legge da /status.
 *
 * Endpoint disponibili:
 *   POST /api/admin/index/rebuild?mode=&skipThumbnails=&dryRun=  - avvia un rebuild (202, 409 se occupato)
 *   POST /api/admin/index/verify?dryRun=                         - avvia una verifica di consistenza
 *   POST /api/admin/index/cancel                                 - annulla il job in corso
 *   GET  /api/admin/index/status                                 - job in corso e ultimo esito
 *   GET  /api/admin/index/stats                                  - cardinalità e ultimo rebuild
 *   GET  /api/admin/index/state/{id}                             - stato di indicizzazione di una collection
 */
@RestController
@RequestMapping("/api/admin/index")
public class IndexAdminController {

    private static final Logger log = LoggerFactory.getLogger(IndexAdminController.class);

    private final RebuildJobRunner jobRunner;
    private final CollectionIndexReader reader;

    public IndexAdminController(RebuildJobRunner jobRunner, CollectionIndexReader reader) {
        this.jobRunner = jobRunner;
        this.reader = reader;
    }

    // -------------------------------------------------------------------------
    // POST /api/admin/index/rebuild
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/admin/index/rebuild?mode=full&skipThumbnails=true"
     */
    @PostMapping("/rebuild")
    public ResponseEntity<RebuildJobStatus> rebuild(
            @RequestParam(value = "mode",           defaultValue = "changed_only") String mode,
            @RequestParam(value = "skipThumbnails", defaultValue = "false") boolean skipThumbnails,
            @RequestParam(value = "dryRun",         defaultValue = "false") boolean dryRun) {
        return start(parseMode(mode), new RebuildOptions(skipThumbnails, dryRun));
    }

    // -------------------------------------------------------------------------
    // POST /api/admin/index/verify
    // -------------------------------------------------------------------------

    /**
     * Con {@code dryRun=true} (default) riporta soltanto le differenze.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/admin/index/verify?dryRun=false"
     */
    @PostMapping("/verify")
    public ResponseEntity<RebuildJobStatus> verify(
            @RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {
        return start(RebuildMode.VERIFY, new RebuildOptions(false, dryRun));
    }

    // -------------------------------------------------------------------------
    // POST /api/admin/index/cancel
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/admin/index/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<RebuildJobStatus> cancel() {
        if (!jobRunner.cancel()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(jobRunner.status());
        }
        return ResponseEntity.accepted().body(jobRunner.status());
    }

    @GetMapping("/status")
    public ResponseEntity<RebuildJobStatus> status() {
        return ResponseEntity.ok(jobRunner.status());
    }

    /**
     * Esempio:
     *   curl http://localhost:8889/api/admin/index/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(reader.getIndexStats());
    }

    @GetMapping("/state/{id}")
    public ResponseEntity<CollectionIndexState> state(@PathVariable String id) {
        return reader.getIndexState(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<RebuildJobStatus> start(RebuildMode mode, RebuildOptions options) {
        if (!jobRunner.start(mode, options)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(jobRunner.status());
        }
        log.info("Job {} avviato da richiesta admin (dryRun={})", mode, options.dryRun());
        return ResponseEntity.accepted().body(jobRunner.status());
    }

    private static RebuildMode parseMode(String mode) {
        return RebuildMode.valueOf(mode.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
