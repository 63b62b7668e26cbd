package com.flagship.split_ledger.notification;

import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The tracker is a plain class so tests can build isolated instances; here
 * the application context owns the shared one and drives its lifecycle.
 */
@Configuration
public class ChangeNotificationConfig {

    @Bean(initMethod = "init", destroyMethod = "teardown")
    public ChangeNotificationTracker changeNotificationTracker(ChangeTrackingWriter writer,
                                                              LedgerProperties properties,
                                                              Clock clock,
                                                              LedgerMetrics metrics,
                                                              MeterRegistry registry) {
        LedgerProperties.Notification settings = properties.getNotification();
        ChangeNotificationTracker tracker = new ChangeNotificationTracker(
                writer,
                settings.getDebounceWindow(),
                settings.getSchedulerThreads(),
                settings.getMaxFlushAttempts(),
                clock,
                metrics);
        Gauge.builder("ledger.notifications.pending", tracker, ChangeNotificationTracker::pendingCount)
                .description("Keys with a debounced change waiting to be written")
                .register(registry);
        return tracker;
    }
}
