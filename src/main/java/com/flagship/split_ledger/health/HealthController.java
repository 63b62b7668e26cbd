package com.flagship.split_ledger.health;

import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain readiness check for load balancers. The ledger can serve writes only
 * while the database answers and the change tracker accepts notifications;
 * Redis and Kafka are optional and reported through actuator instead.
 */
@RestController
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final ChangeNotificationTracker tracker;
    private final Clock clock;

    public HealthController(DataSource dataSource, ChangeNotificationTracker tracker, Clock clock) {
        this.dataSource = dataSource;
        this.tracker = tracker;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseAnswers();
        boolean trackerUp = tracker.isRunning();
        boolean ready = databaseUp && trackerUp;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("change_tracker", trackerUp ? "UP" : "DOWN");
        body.put("pending_notifications", tracker.pendingCount());
        body.put("timestamp", clock.instant().toString());

        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseAnswers() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }
}
