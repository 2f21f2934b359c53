package it.aw.collectionindex.rebuild;

import it.aw.collectionindex.model.RebuildMode;
import it.aw.collectionindex.model.RebuildOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * All'avvio lancia in background un rebuild (di default CHANGED_ONLY) se
 * {@code index.rebuild.on-startup} è attivo.
 */
@Component
public class IndexStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexStartupRunner.class);

    private final RebuildJobRunner jobRunner;
    private final boolean enabled;
    private final RebuildMode mode;

    public IndexStartupRunner(RebuildJobRunner jobRunner,
                              @Value("${index.rebuild.on-startup:true}") boolean enabled,
                              @Value("${index.rebuild.startup-mode:CHANGED_ONLY}") RebuildMode mode) {
        this.jobRunner = jobRunner;
        this.enabled = enabled;
        this.mode = mode;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Rebuild all'avvio disabilitato");
            return;
        }
        log.info("Avvio rebuild indice {} in background", mode);
        jobRunner.start(mode, RebuildOptions.defaults());
    }
}
