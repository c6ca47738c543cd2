package com.flagship.gambling_ledger.health;

import com.flagship.gambling_ledger.lock.LockCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for load balancers. Reports the database and the lock
 * store; the service cannot move money without either.
 */
@RestController
@Slf4j
public class HealthController {

    private static final String PING_RESOURCE = "health:ping";

    private final DataSource dataSource;
    private final LockCoordinator lockCoordinator;

    public HealthController(DataSource dataSource, LockCoordinator lockCoordinator) {
        this.dataSource = dataSource;
        this.lockCoordinator = lockCoordinator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        boolean lockStoreHealthy = checkLockStore();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("lockStore", lockStoreHealthy ? "UP" : "DOWN");

        if (!dbHealthy || !lockStoreHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean checkLockStore() {
        try {
            lockCoordinator.isLocked(PING_RESOURCE);
            return true;
        } catch (Exception e) {
            log.warn("Lock store health check failed: {}", e.getMessage());
            return false;
        }
    }
}
