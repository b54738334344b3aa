package com.courier.eventstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;
import com.courier.observability.MetricFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CommandDispatcher")
class CommandDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private ControllableEventLog log;
    private InMemoryProjectionCache<Tally> cache;
    private MetricFactory metrics;
    private ProjectionService<Tally> projections;
    private CommandDispatcher<Tally> dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        log = new ControllableEventLog(new InMemoryEventLog(clock));
        cache = new InMemoryProjectionCache<>();
        metrics = MetricFactory.inMemory("test");
        dispatcher = newDispatcher(cache);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private CommandDispatcher<Tally> newDispatcher(ProjectionCache<Tally> projectionCache) {
        var registry = Tally.registry();
        projections = new ProjectionService<>(log, new Aggregator<>(log, registry), projectionCache, metrics);
        return new CommandDispatcher<>(log, registry, projections, metrics);
    }

    private double commands(String type, String outcome) {
        var counter = metrics.registry().find(CommandDispatcher.COMMANDS_METRIC)
                .tag("type", type)
                .tag("outcome", outcome)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("accepted commands")
    class Accepted {

        @Test
        @DisplayName("appends one event and returns the new state")
        void appendsAndReturnsState() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of("amount", 10));

            Tally state = dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 5));

            assertThat(state).isEqualTo(new Tally("open", 15));
            assertThat(log.listByAggregate("t-1")).hasSize(2);
            assertThat(projections.currentState("t-1")).isEqualTo(state);
        }

        @Test
        @DisplayName("caches the committed state at the new event id")
        void cachesCommittedState() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of("amount", 1));
            dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 2));

            assertThat(cache.get("t-1")).contains(new Projection<>(new Tally("open", 3), 2, T0));
        }

        @Test
        @DisplayName("treats a null payload as empty")
        void nullPayload() {
            assertThat(dispatcher.dispatch("t-1", Tally.OPEN, null)).isEqualTo(new Tally("open", 0));
        }

        @Test
        @DisplayName("counts committed commands by type")
        void countsCommitted() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());
            dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1));
            dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1));

            assertThat(commands(Tally.OPEN, "committed")).isEqualTo(1.0);
            assertThat(commands(Tally.ADD, "committed")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("removes the aggregate id from the MDC afterwards")
        void clearsMdc() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());

            assertThat(MDC.get(CommandDispatcher.MDC_AGGREGATE_ID)).isNull();
        }

        @Test
        @DisplayName("works with the projection cache disabled")
        void disabledCache() {
            var uncached = newDispatcher(ProjectionCache.disabled());

            uncached.dispatch("t-1", Tally.OPEN, Map.of("amount", 1));
            uncached.dispatch("t-1", Tally.ADD, Map.of("amount", 1));

            assertThat(uncached.dispatch("t-1", Tally.CLOSE, Map.of())).isEqualTo(new Tally("closed", 2));
        }
    }

    @Nested
    @DisplayName("rejected commands")
    class Rejected {

        @Test
        @DisplayName("a failing reducer appends nothing")
        void ruleViolationAppendsNothing() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of("amount", 40));

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", -100)))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .hasMessage("total would become negative");

            assertThat(log.listByAggregate("t-1")).hasSize(1);
            assertThat(projections.currentState("t-1")).isEqualTo(new Tally("open", 40));
            assertThat(commands(Tally.ADD, "rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an invalid status transition appends nothing")
        void invalidTransition() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());
            dispatcher.dispatch("t-1", Tally.CLOSE, Map.of());

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.CLOSE, Map.of()))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .hasMessage("invalid status transition");
            assertThat(log.listByAggregate("t-1")).hasSize(2);
        }

        @Test
        @DisplayName("a non-creation type on a missing aggregate is not found")
        void notFound() {
            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1)))
                    .isInstanceOf(AggregateNotFoundException.class);

            assertThat(log.listByAggregate("t-1")).isEmpty();
        }

        @Test
        @DisplayName("a creation type on an existing aggregate already exists")
        void alreadyExists() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.OPEN, Map.of()))
                    .isInstanceOf(AggregateAlreadyExistsException.class);
            assertThat(log.listByAggregate("t-1")).hasSize(1);
        }

        @Test
        @DisplayName("an unregistered type is unknown and counted under a fixed tag")
        void unknownType() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", "REOPEN", Map.of()))
                    .isInstanceOf(UnknownEventTypeException.class)
                    .hasMessageContaining("REOPEN");
            assertThat(log.listByAggregate("t-1")).hasSize(1);
            assertThat(commands("unknown", "rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an unknown type on a missing aggregate reports the missing aggregate")
        void existenceBeforeUnknownType() {
            assertThatThrownBy(() -> dispatcher.dispatch("missing", "REOPEN", Map.of()))
                    .isInstanceOf(AggregateNotFoundException.class)
                    .hasMessageContaining("missing");
            assertThat(log.appendCalls()).isZero();
            assertThat(commands("unknown", "rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a blank aggregate id or type is an invalid argument")
        void invalidArguments() {
            assertThatThrownBy(() -> dispatcher.dispatch(" ", Tally.OPEN, Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Invalid command");
            assertThatThrownBy(() -> dispatcher.dispatch("t-1", "", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(log.appendCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("storage failures")
    class StorageFailures {

        @Test
        @DisplayName("a failed append propagates and leaves the cache untouched")
        void failedAppend() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of("amount", 5));
            var before = cache.get("t-1");
            log.failAppends(true);

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1)))
                    .isInstanceOf(EventStorageException.class);

            assertThat(cache.get("t-1")).isEqualTo(before);
            assertThat(commands(Tally.ADD, "failed")).isEqualTo(1.0);

            log.failAppends(false);
            assertThat(dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1))).isEqualTo(new Tally("open", 6));
        }

        @Test
        @DisplayName("an unreadable log fails the command before anything is appended")
        void failedRead() {
            log.failReads(true);

            assertThatThrownBy(() -> dispatcher.dispatch("t-1", Tally.OPEN, Map.of()))
                    .isInstanceOf(EventStorageException.class);
            assertThat(log.appendCalls()).isZero();
        }

        @Test
        @DisplayName("a write from outside the dispatcher is detected at append time")
        void concurrentAppendFromOutside() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());
            // another process commits between this dispatcher's read and its append
            EventLog racingLog = new EventLog() {
                @Override
                public StoredEvent append(PendingEvent event) {
                    return log.append(event);
                }

                @Override
                public StoredEvent append(PendingEvent event, long expectedLatestId) {
                    log.append("t-1", Tally.ADD, Map.of("amount", 1));
                    return log.append(event, expectedLatestId);
                }

                @Override
                public List<StoredEvent> listByAggregate(String aggregateId) {
                    return log.listByAggregate(aggregateId);
                }

                @Override
                public long latestEventId(String aggregateId) {
                    return log.latestEventId(aggregateId);
                }
            };
            var registry = Tally.registry();
            var racing = new CommandDispatcher<>(racingLog, registry,
                    new ProjectionService<>(racingLog, new Aggregator<>(racingLog, registry),
                            ProjectionCache.<Tally>disabled(), metrics),
                    metrics);

            assertThatThrownBy(() -> racing.dispatch("t-1", Tally.ADD, Map.of("amount", 1)))
                    .isInstanceOf(ConcurrentAppendException.class);
            assertThat(log.listByAggregate("t-1")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("concurrent commands on one aggregate are serialized")
        void serializesSameAggregate() throws Exception {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());
            int threads = 2;
            int perThread = 50;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Void>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    Callable<Void> worker = () -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 100));
                        }
                        return null;
                    };
                    futures.add(pool.submit(worker));
                }
                start.countDown();
                for (Future<Void> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(projections.currentState("t-1")).isEqualTo(new Tally("open", 100L * threads * perThread));
            assertThat(log.listByAggregate("t-1")).hasSize(1 + threads * perThread);
        }

        @Test
        @DisplayName("an event stamped before the previous one evicts the cached projection")
        void clockSkewEvicts() {
            dispatcher.dispatch("t-1", Tally.OPEN, Map.of());
            clock.set(T0.plusSeconds(120));
            dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 1));
            clock.set(T0.plusSeconds(60));

            // sorts between OPEN and the first ADD on replay
            Tally returned = dispatcher.dispatch("t-1", Tally.ADD, Map.of("amount", 4));

            assertThat(returned).isEqualTo(new Tally("open", 5));
            assertThat(cache.get("t-1")).isEmpty();
            assertThat(projections.currentState("t-1")).isEqualTo(new Tally("open", 5));
        }
    }
}
