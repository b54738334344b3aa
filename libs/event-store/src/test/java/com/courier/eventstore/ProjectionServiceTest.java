package com.courier.eventstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.courier.observability.MetricFactory;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProjectionService")
class ProjectionServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryEventLog log;
    private InMemoryProjectionCache<Tally> cache;
    private MetricFactory metrics;
    private ProjectionService<Tally> service;

    @BeforeEach
    void setUp() {
        log = new InMemoryEventLog(new MutableClock(T0));
        cache = new InMemoryProjectionCache<>();
        metrics = MetricFactory.inMemory("test");
        service = new ProjectionService<>(log, new Aggregator<>(log, Tally.registry()), cache, metrics);
    }

    private double reads(String result) {
        var counter = metrics.registry().find(ProjectionService.READS_METRIC).tag("result", result).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("returns empty for an aggregate with no events")
    void emptyAggregate() {
        assertThat(service.load("missing")).isEmpty();
        assertThatThrownBy(() -> service.currentState("missing"))
                .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    @DisplayName("replays on a miss and caches the result")
    void missThenHit() {
        log.append("t-1", Tally.OPEN, Map.of("amount", 4));

        assertThat(service.currentState("t-1")).isEqualTo(new Tally("open", 4));
        assertThat(cache.get("t-1")).isPresent();
        assertThat(service.currentState("t-1")).isEqualTo(new Tally("open", 4));

        assertThat(reads("miss")).isEqualTo(1.0);
        assertThat(reads("hit")).isEqualTo(1.0);
        assertThat(metrics.registry().find(ProjectionService.REPLAY_METRIC).timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("does not serve a cached projection once the log has moved past it")
    void staleEntryIsReplayed() {
        log.append("t-1", Tally.OPEN, Map.of("amount", 4));
        service.currentState("t-1");

        // written by someone that bypassed the cache
        log.append("t-1", Tally.ADD, Map.of("amount", 6));

        assertThat(service.currentState("t-1")).isEqualTo(new Tally("open", 10));
        assertThat(cache.get("t-1")).map(Projection::lastEventId).contains(2L);
    }

    @Test
    @DisplayName("ignores a cache entry that claims a position the log does not have")
    void bogusEntryIsReplayed() {
        log.append("t-1", Tally.OPEN, Map.of("amount", 4));
        cache.put("t-1", new Projection<>(new Tally("open", 999), 7, T0));

        assertThat(service.currentState("t-1")).isEqualTo(new Tally("open", 4));
    }

    @Test
    @DisplayName("keeps working when the cache throws")
    void failingCacheIsBypassed() {
        ProjectionCache<Tally> broken = new ProjectionCache<>() {
            @Override
            public Optional<Projection<Tally>> get(String aggregateId) {
                throw new IllegalStateException("cache down");
            }

            @Override
            public void put(String aggregateId, Projection<Tally> projection) {
                throw new IllegalStateException("cache down");
            }

            @Override
            public void invalidate(String aggregateId) {
                throw new IllegalStateException("cache down");
            }
        };
        var resilient = new ProjectionService<>(log, new Aggregator<>(log, Tally.registry()), broken, metrics);
        log.append("t-1", Tally.OPEN, Map.of("amount", 2));

        assertThat(resilient.currentState("t-1")).isEqualTo(new Tally("open", 2));
        resilient.evict("t-1");
    }

    @Test
    @DisplayName("works with the cache disabled")
    void disabledCache() {
        var uncached = new ProjectionService<>(
                log, new Aggregator<>(log, Tally.registry()), ProjectionCache.disabled(), metrics);
        log.append("t-1", Tally.OPEN, Map.of("amount", 2));
        log.append("t-1", Tally.ADD, Map.of("amount", 3));

        assertThat(uncached.currentState("t-1")).isEqualTo(new Tally("open", 5));
        assertThat(uncached.currentState("t-1")).isEqualTo(new Tally("open", 5));
    }
}
