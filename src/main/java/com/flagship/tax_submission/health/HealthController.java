package com.flagship.tax_submission.health;

import com.flagship.tax_submission.catalog.TaxCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain probe for load balancers.
 *
 * The service can only issue documents with a reachable database and loaded
 * regulatory catalogs; either one missing reports DOWN with 503. The document
 * time zone is included because issue dates are derived from it.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final TaxCatalog taxCatalog;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseReachable();
        boolean catalogsLoaded = !taxCatalog.codes(TaxCatalog.DOCUMENT_KINDS).isEmpty();
        boolean up = databaseUp && catalogsLoaded;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("catalogs", catalogsLoaded ? "UP" : "DOWN");
        body.put("documentTimeZone", clock.getZone().getId());
        body.put("timestamp", Instant.now(clock).toString());

        return up ? ResponseEntity.ok(body) : ResponseEntity.status(503).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
