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

/**
 * Logs every write and its outcome. Failures are logged and rethrown.
 */
public class LoggingMiddleware implements StoreMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public void append(Append append, Chain next) throws EventStoreException {
        try {
            next.proceed(append);
            if (append.createsStream()) {
                logger.debug("Created stream {} with {} events", append.aggregateId(), append.events().size());
            } else {
                logger.debug("Appended {} events to {} at version {}", append.events().size(),
                    append.aggregateId(), append.expectedVersion());
            }
        } catch (EventStoreException e) {
            if (e.isRecoverable()) {
                logger.info("Append to {} rejected: {}", append.aggregateId(), e.getMessage());
            } else {
                logger.warn("Append to {} failed with {}: {}", append.aggregateId(), e.getFault(), e.getMessage());
            }
            throw e;
        }
    }
}
