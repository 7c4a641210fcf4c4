package io.github.chirino.conversations.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Micrometer configuration for conversation-store metrics.
 *
 * <ul>
 *   <li>http_server_requests_seconds_* - HTTP request metrics
 *   <li>conversation_store_operation_seconds_* - Store operation timing
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    static final String APPLICATION = "conversation-store";

    /** Tags every meter with the application name. */
    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", APPLICATION)));
    }

    /** Publishes p95/p99 and histogram buckets for request and store operation timers. */
    @Produces
    @Singleton
    public MeterFilter histogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().startsWith("http.server.requests")
                        || id.getName().startsWith("conversation.store.operation")) {
                    return DistributionStatisticConfig.builder()
                            .percentiles(0.95, 0.99)
                            .percentilesHistogram(true)
                            .build()
                            .merge(config);
                }
                return config;
            }
        };
    }
}
