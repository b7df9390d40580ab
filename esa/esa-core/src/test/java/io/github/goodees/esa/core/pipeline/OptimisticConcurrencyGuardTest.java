package io.github.goodees.esa.core.pipeline;

/*-
 * #%L
 * esa
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.esa.core.Counters.Added;
import io.github.goodees.esa.core.Counters.Opened;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OptimisticConcurrencyGuardTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final InMemoryEventStore backend = new InMemoryEventStore();

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    private EventStorePipeline pipeline(GuardConfiguration conf, StoreMiddleware... after) {
        EventStorePipeline.Builder builder = EventStorePipeline.builder(backend)
                .use(new OptimisticConcurrencyGuard(conf));
        for (StoreMiddleware middleware : after) {
            builder.use(middleware);
        }
        return builder.build();
    }

    @Test
    public void stale_expected_version_conflicts_and_leaves_stream_unchanged() throws EventStoreException {
        EventStorePipeline store = pipeline(GuardConfiguration.blocking());
        store.create("c1", new Opened("one"), new Added(1));
        try {
            store.append("c1", 1, new Added(2));
            fail("Append at stale version should fail");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
            assertTrue(e.isRecoverable());
        }
        assertEquals(2, store.versionOf("c1"));
        assertEquals(2, store.read("c1").get().size());
    }

    @Test
    public void append_ahead_of_stream_conflicts() throws EventStoreException {
        EventStorePipeline store = pipeline(GuardConfiguration.blocking());
        store.create("c1", new Opened("one"));
        try {
            store.append("c1", 5, new Added(2));
            fail("Append at future version should fail");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
    }

    @Test
    public void append_to_unknown_aggregate_is_refused() {
        EventStorePipeline store = pipeline(GuardConfiguration.blocking());
        try {
            store.append("nope", 0, new Added(2));
            fail("Append to unknown aggregate should fail");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.UNKNOWN_AGGREGATE, e.getFault());
        }
    }

    @Test
    public void concurrent_appends_at_same_version_let_exactly_one_win() throws Exception {
        EventStorePipeline store = pipeline(GuardConfiguration.blocking());
        store.create("c1", new Opened("one"));
        int writers = 8;
        CyclicBarrier start = new CyclicBarrier(writers);
        AtomicInteger conflicts = new AtomicInteger();
        AtomicInteger successes = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            int amount = i;
            futures.add(executor.submit(() -> {
                start.await(5, TimeUnit.SECONDS);
                try {
                    store.append("c1", 1, new Added(amount));
                    successes.incrementAndGet();
                } catch (EventStoreException e) {
                    assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        assertEquals(1, successes.get());
        assertEquals(writers - 1, conflicts.get());
        assertEquals(2, store.versionOf("c1"));
    }

    @Test
    public void fail_fast_guard_times_out_while_same_aggregate_is_written() throws Exception {
        Gate gate = new Gate("slow");
        EventStorePipeline store = pipeline(GuardConfiguration.failFast(50, TimeUnit.MILLISECONDS), gate);
        store.create("slow", new Opened("slow"));
        gate.armed = true;
        Future<?> holder = executor.submit(() -> {
            store.append("slow", 1, new Added(1));
            return null;
        });
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));
        try {
            store.append("slow", 1, new Added(2));
            fail("Second writer should time out");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.LOCK_TIMEOUT, e.getFault());
            assertTrue(e.isRecoverable());
        } finally {
            gate.release.countDown();
        }
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(2, store.versionOf("slow"));
    }

    @Test
    public void writes_to_distinct_aggregates_do_not_wait_for_each_other() throws Exception {
        Gate gate = new Gate("slow");
        EventStorePipeline store = pipeline(GuardConfiguration.failFast(50, TimeUnit.MILLISECONDS), gate);
        store.create("slow", new Opened("slow"));
        store.create("fast", new Opened("fast"));
        gate.armed = true;
        Future<?> holder = executor.submit(() -> {
            store.append("slow", 1, new Added(1));
            return null;
        });
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));
        try {
            store.append("fast", 1, new Added(2));
            assertEquals(2, store.versionOf("fast"));
            assertEquals(1, store.versionOf("slow"));
        } finally {
            gate.release.countDown();
        }
        holder.get(5, TimeUnit.SECONDS);
    }

    /**
     * Holds appends of one aggregate until released, while the guard's lock is taken.
     */
    static class Gate implements StoreMiddleware {
        final String blockedId;
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean armed;

        Gate(String blockedId) {
            this.blockedId = blockedId;
        }

        @Override
        public void append(Append append, Chain next) throws EventStoreException {
            if (armed && append.aggregateId().equals(blockedId)) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            next.proceed(append);
        }
    }
}
