package it.aw.collectionindex.controller;

import it.aw.collectionindex.cache.DashboardStatisticsService;
import it.aw.collectionindex.model.DashboardActivity;
import it.aw.collectionindex.model.DashboardStatistics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Statistiche aggregate e attività recenti per la dashboard.
 *
 * Endpoint disponibili:
 *   GET /api/dashboard/statistics        - aggregato (dalla cache se fresco)
 *   GET /api/dashboard/activity?limit=   - ultimi eventi, più recenti per primi
 */
@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardStatisticsService dashboardService;

    public DashboardController(DashboardStatisticsService dashboardService) {
        this.dashboardService = dashboardService;
    }

    /**
     * Esempio:
     *   curl http://localhost:8889/api/dashboard/statistics
     */
    @GetMapping("/statistics")
    public ResponseEntity<DashboardStatistics> statistics() {
        return ResponseEntity.ok(dashboardService.getStatistics());
    }

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/dashboard/activity?limit=20"
     */
    @GetMapping("/activity")
    public ResponseEntity<List<DashboardActivity>> activity(
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        if (limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(dashboardService.recentActivity(limit));
    }
}
