package it.aw.collectionindex.config;

import it.aw.collectionindex.store.InMemoryIndexStore;
import it.aw.collectionindex.store.IndexStore;
import it.aw.collectionindex.store.RedisIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Configura lo store dell'indice e l'orologio condiviso.
 *
 * IndexStore: Redis con {@code index.store.type=redis} (configurazione di produzione,
 *             connessione da {@code spring.redis.*}); in memoria con
 *             {@code index.store.type=memory} o proprietà assente (test, nodo singolo).
 *             Lo store in memoria non sopravvive al riavvio: il rebuild all'avvio lo ripopola.
 * Clock:      UTC, sostituibile nei test.
 */
@Configuration
public class IndexStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "index.store.type", havingValue = "redis")
    public IndexStore redisIndexStore(StringRedisTemplate template) {
        log.info("IndexStore: Redis");
        return new RedisIndexStore(template);
    }

    @Bean
    @ConditionalOnProperty(name = "index.store.type", havingValue = "memory", matchIfMissing = true)
    public IndexStore inMemoryIndexStore(Clock clock) {
        log.info("IndexStore: in memoria (i dati si perdono al riavvio)");
        return new InMemoryIndexStore(clock);
    }
}
