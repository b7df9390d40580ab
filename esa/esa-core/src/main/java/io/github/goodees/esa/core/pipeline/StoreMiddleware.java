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

/**
 * A step of the {@link EventStorePipeline}. Middleware is assembled into fixed order when the pipeline is built, every
 * write passes through all of them before it reaches the {@link io.github.goodees.esa.core.store.EventStore backend}.
 * <p>A middleware either rejects the write by throwing, or passes it on by calling {@link Chain#proceed(Append)}
 * exactly once. Code after {@code proceed} runs after all inner steps and the backend succeeded.</p>
 */
@FunctionalInterface
public interface StoreMiddleware {

    /**
     * Handle a write.
     * @param append the write
     * @param next the rest of the pipeline
     * @throws EventStoreException when the write is rejected, or any inner step fails
     */
    void append(Append append, Chain next) throws EventStoreException;

    /**
     * Rest of the pipeline as seen by a middleware.
     */
    interface Chain {
        /**
         * Pass the write to next middleware, or to the backend if this is the last one.
         * @param append the write
         * @throws EventStoreException when an inner step fails
         */
        void proceed(Append append) throws EventStoreException;

        /**
         * Current version of the stream in the backend.
         * @param aggregateId aggregate id
         * @return the version, 0 if the stream doesn't exist
         */
        long currentVersion(String aggregateId);

        /**
         * Whether backend holds the stream.
         * @param aggregateId aggregate id
         * @return true if stream exists
         */
        boolean exists(String aggregateId);
    }
}
