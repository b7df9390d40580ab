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

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * How {@link OptimisticConcurrencyGuard} waits for a write lock of an aggregate that another thread is appending to.
 */
public final class GuardConfiguration {

    public enum LockingMode {
        /**
         * Wait until the lock is released.
         */
        BLOCK,
        /**
         * Wait at most the configured timeout, then fail with
         * {@link io.github.goodees.esa.core.store.EventStoreException.Fault#LOCK_TIMEOUT}.
         */
        FAIL_FAST
    }

    private final LockingMode mode;
    private final long timeoutMillis;

    private GuardConfiguration(LockingMode mode, long timeoutMillis) {
        this.mode = Objects.requireNonNull(mode, "Locking mode must be specified");
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("Lock timeout cannot be negative");
        }
        this.timeoutMillis = timeoutMillis;
    }

    public static GuardConfiguration blocking() {
        return new GuardConfiguration(LockingMode.BLOCK, 0);
    }

    public static GuardConfiguration failFast(long timeout, TimeUnit unit) {
        return new GuardConfiguration(LockingMode.FAIL_FAST, unit.toMillis(timeout));
    }

    public LockingMode getMode() {
        return mode;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String toString() {
        return mode == LockingMode.BLOCK ? "GuardConfiguration[BLOCK]"
                : "GuardConfiguration[FAIL_FAST, timeout=" + timeoutMillis + "ms]";
    }
}
