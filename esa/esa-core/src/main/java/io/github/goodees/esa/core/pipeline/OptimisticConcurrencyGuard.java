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

import io.github.goodees.esa.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes writes per aggregate and rejects appends whose expected version doesn't match the stream.
 *
 * <p>Every aggregate id gets its own lock. The lock is created atomically on the first write for the id, be it the
 * creation of the stream or an append, and lives as long as the guard. While holding the lock the guard compares
 * the expected version of the append with the current version of the stream, and only passes the append on when
 * they are equal. A mismatch fails with {@link EventStoreException.Fault#CONCURRENCY_CONFLICT} before anything is
 * written. Appends for different aggregates never wait for each other.</p>
 *
 * <p>Middleware placed after the guard, such as {@link EventPublisher}, runs while the lock is held.</p>
 */
public class OptimisticConcurrencyGuard implements StoreMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(OptimisticConcurrencyGuard.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final GuardConfiguration conf;

    public OptimisticConcurrencyGuard(GuardConfiguration conf) {
        this.conf = Objects.requireNonNull(conf, "Guard configuration must be specified");
    }

    public OptimisticConcurrencyGuard() {
        this(GuardConfiguration.blocking());
    }

    @Override
    public void append(Append append, Chain next) throws EventStoreException {
        String id = append.aggregateId();
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        acquire(id, lock);
        try {
            if (!append.createsStream()) {
                if (!next.exists(id)) {
                    throw EventStoreException.unknownAggregate(id);
                }
                long actualVersion = next.currentVersion(id);
                if (actualVersion != append.expectedVersion()) {
                    logger.debug("Rejecting append to {} at version {}, stream is at {}", id,
                        append.expectedVersion(), actualVersion);
                    throw EventStoreException.concurrencyConflict(id, append.expectedVersion(), actualVersion);
                }
            }
            next.proceed(append);
        } finally {
            lock.unlock();
        }
    }

    private void acquire(String id, ReentrantLock lock) throws EventStoreException {
        if (conf.getMode() == GuardConfiguration.LockingMode.BLOCK) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(conf.getTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                throw EventStoreException.lockTimeout(id, conf.getTimeoutMillis(), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw EventStoreException.lockTimeout(id, conf.getTimeoutMillis(), e);
        }
    }

    @Override
    public String toString() {
        return "OptimisticConcurrencyGuard[" + conf + "]";
    }
}
