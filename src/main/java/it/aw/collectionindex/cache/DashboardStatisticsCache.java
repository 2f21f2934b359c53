package it.aw.collectionindex.cache;

import it.aw.collectionindex.index.IndexJson;
import it.aw.collectionindex.index.IndexKeys;
import it.aw.collectionindex.model.DashboardActivity;
import it.aw.collectionindex.model.DashboardDelta;
import it.aw.collectionindex.model.DashboardStatistics;
import it.aw.collectionindex.store.IndexStore;
import it.aw.collectionindex.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Aggregato della dashboard in {@code dashboard:statistics} e registro delle attività
 * recenti in {@code dashboard:activity}.
 * <p>
 * L'aggregato scade dopo {@code dashboard.ttl}; è considerato fresco se il suo ultimo
 * ricalcolo completo ({@code computedAt}) rientra in {@code dashboard.freshness}.
 * Le patch incrementali non ne rinnovano la freschezza.
 */
@Component
public class DashboardStatisticsCache {

    private static final Logger log = LoggerFactory.getLogger(DashboardStatisticsCache.class);

    static final int MAX_ACTIVITY = 100;

    private final IndexStore store;
    private final IndexJson json;
    private final Clock clock;
    private final Duration ttl;
    private final Duration freshness;

    public DashboardStatisticsCache(IndexStore store,
                                    IndexJson json,
                                    Clock clock,
                                    @Value("${dashboard.ttl:5m}") Duration ttl,
                                    @Value("${dashboard.freshness:1m}") Duration freshness) {
        this.store = store;
        this.json = json;
        this.clock = clock;
        this.ttl = ttl;
        this.freshness = freshness;
    }

    public Optional<DashboardStatistics> get() {
        return store.get(IndexKeys.DASHBOARD_STATISTICS).map(s -> json.read(s, DashboardStatistics.class));
    }

    public void store(DashboardStatistics statistics) {
        store.apply(new WriteBatch().set(IndexKeys.DASHBOARD_STATISTICS, json.write(statistics), ttl));
    }

    public boolean isFresh(DashboardStatistics statistics) {
        return statistics.computedAt() != null
                && !statistics.computedAt().plus(freshness).isBefore(clock.instant());
    }

    /**
     * Applica la variazione all'aggregato in cache. Se l'aggregato non c'è non fa nulla:
     * la prossima lettura lo ricalcola dalla sorgente.
     *
     * @return l'aggregato aggiornato, vuoto se non era in cache
     */
    public synchronized Optional<DashboardStatistics> applyDelta(DashboardDelta delta) {
        if (delta.isEmpty()) {
            return get();
        }
        Optional<DashboardStatistics> patched = get().map(current -> current.apply(delta, clock.instant()));
        patched.ifPresent(this::store);
        if (patched.isEmpty()) {
            log.debug("Statistiche dashboard assenti in cache, variazione ignorata");
        }
        return patched;
    }

    /** Aggiunge un evento in testa al registro, che conserva gli ultimi {@value #MAX_ACTIVITY}. */
    public synchronized void recordActivity(DashboardActivity activity) {
        List<DashboardActivity> activities = new ArrayList<>(MAX_ACTIVITY);
        activities.add(activity);
        for (DashboardActivity previous : readActivity()) {
            if (activities.size() >= MAX_ACTIVITY) {
                break;
            }
            activities.add(previous);
        }
        store.apply(new WriteBatch().set(IndexKeys.DASHBOARD_ACTIVITY, json.write(activities)));
    }

    /** Eventi più recenti per primi. */
    public List<DashboardActivity> recentActivity(int limit) {
        List<DashboardActivity> activities = readActivity();
        return activities.subList(0, Math.min(Math.max(limit, 0), activities.size()));
    }

    private List<DashboardActivity> readActivity() {
        return store.get(IndexKeys.DASHBOARD_ACTIVITY)
                .map(s -> Arrays.asList(json.read(s, DashboardActivity[].class)))
                .orElse(List.of());
    }
}
