package com.courier.delivery.config;

import com.courier.database.JdbcEventLog;
import com.courier.delivery.domain.DeliveryReducers;
import com.courier.delivery.domain.DeliveryState;
import com.courier.eventstore.Aggregator;
import com.courier.eventstore.CommandDispatcher;
import com.courier.eventstore.EventLog;
import com.courier.eventstore.InMemoryEventLog;
import com.courier.eventstore.InMemoryProjectionCache;
import com.courier.eventstore.ProjectionCache;
import com.courier.eventstore.ProjectionService;
import com.courier.eventstore.ReducerRegistry;
import com.courier.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the event-sourcing engine for deliveries.
 *
 * <p>{@code courier.event-store.type} selects the backing {@link EventLog}. The JDBC log relies on
 * Spring Boot's Flyway auto-configuration to create its table before the first request.
 */
@Configuration
public class EventStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "courier.event-store",
            name = "type",
            havingValue = EventStoreProperties.TYPE_JDBC,
            matchIfMissing = true)
    public EventLog jdbcEventLog(JdbcTemplate jdbcTemplate, Clock clock) {
        log.info("Using JDBC event log");
        return new JdbcEventLog(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "courier.event-store", name = "type", havingValue = EventStoreProperties.TYPE_MEMORY)
    public EventLog inMemoryEventLog(Clock clock) {
        log.warn("Using in-memory event log, events are lost on restart");
        return new InMemoryEventLog(clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, DeliveryServiceProperties service) {
        return new MetricFactory(meterRegistry, service.name());
    }

    @Bean
    public ReducerRegistry<DeliveryState> deliveryReducers() {
        return DeliveryReducers.registry();
    }

    @Bean
    public ProjectionCache<DeliveryState> deliveryProjectionCache(EventStoreProperties properties) {
        if (!properties.projectionCacheEnabled()) {
            log.info("Projection cache disabled, every read replays the event log");
            return ProjectionCache.disabled();
        }
        return new InMemoryProjectionCache<>();
    }

    @Bean
    public Aggregator<DeliveryState> deliveryAggregator(EventLog eventLog, ReducerRegistry<DeliveryState> reducers) {
        return new Aggregator<>(eventLog, reducers);
    }

    @Bean
    public ProjectionService<DeliveryState> deliveryProjections(
            EventLog eventLog,
            Aggregator<DeliveryState> aggregator,
            ProjectionCache<DeliveryState> cache,
            MetricFactory metrics) {
        return new ProjectionService<>(eventLog, aggregator, cache, metrics);
    }

    @Bean
    public CommandDispatcher<DeliveryState> deliveryDispatcher(
            EventLog eventLog,
            ReducerRegistry<DeliveryState> reducers,
            ProjectionService<DeliveryState> projections,
            MetricFactory metrics) {
        return new CommandDispatcher<>(eventLog, reducers, projections, metrics);
    }
}
