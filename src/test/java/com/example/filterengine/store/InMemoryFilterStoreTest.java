package com.example.filterengine.store;

import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.model.FilterRun;
import com.example.filterengine.model.RuleClause;
import com.example.filterengine.model.SavedFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFilterStoreTest {

    private InMemoryFilterStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFilterStore();
        store.putFilter(SavedFilter.builder().id("f1").ownerId("alice").name("f").visibility("private")
                .rules(new ArrayList<>(List.of(RuleClause.builder().field("provider").operator("eq")
                        .value("openai").type("hard").build())))
                .build());
    }

    @Test
    void testFindFilter_ReturnsCopy() {
        SavedFilter loaded = store.findFilter("f1").orElseThrow();
        loaded.getRules().clear();

        assertEquals(1, store.findFilter("f1").orElseThrow().getRules().size());
    }

    @Test
    void testInsertRun_DuplicateIdRejected() {
        FilterRun run = run("r1", "2024-05-01T10:00:00Z");
        store.insertRun(run);

        assertThrows(PersistenceException.class, () -> store.insertRun(run));
    }

    @Test
    void testInTransaction_FailureDiscardsInsertedRuns() {
        assertThrows(PersistenceException.class, () -> store.inTransaction(() -> {
            store.insertRun(run("r1", "2024-05-01T10:00:00Z"));
            store.incrementUsage("missing", Instant.now());
            return null;
        }));

        assertTrue(store.findRun("f1", "r1").isEmpty());
    }

    @Test
    void testIncrementUsage() {
        Instant now = Instant.parse("2024-05-02T00:00:00Z");
        store.incrementUsage("f1", now);
        store.incrementUsage("f1", now);

        SavedFilter filter = store.findFilter("f1").orElseThrow();
        assertEquals(2, filter.getUsageCount());
        assertEquals(now, filter.getLastUsedAt());
    }

    @Test
    void testIncrementUsage_ConcurrentCallsOutsideTransactionAreAtomic() throws Exception {
        // Given
        int threads = 16;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int n = 0; n < perThread; n++) {
                    store.incrementUsage("f1", Instant.now());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertEquals((long) threads * perThread, store.findFilter("f1").orElseThrow().getUsageCount());
    }

    @Test
    void testFindRuns_NewestFirstAndScopedToFilter() {
        store.insertRun(run("r1", "2024-05-01T10:00:00Z"));
        store.insertRun(run("r2", "2024-05-03T10:00:00Z"));
        store.insertRun(run("r3", "2024-05-02T10:00:00Z"));
        store.insertRun(FilterRun.builder().id("other").filterId("f2").executedAt(Instant.now()).build());

        RunPage first = store.findRuns("f1", 1, 2);
        RunPage second = store.findRuns("f1", 2, 2);

        assertEquals(List.of("r2", "r3"), first.getRuns().stream().map(FilterRun::getId).collect(Collectors.toList()));
        assertEquals(List.of("r1"), second.getRuns().stream().map(FilterRun::getId).collect(Collectors.toList()));
        assertEquals(3, first.getTotal());
        assertTrue(store.findRun("f2", "r1").isEmpty());
    }

    private static FilterRun run(String id, String executedAt) {
        return FilterRun.builder().id(id).filterId("f1").executedAt(Instant.parse(executedAt)).build();
    }
}
