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

import io.github.goodees.esa.core.StoredEvent;

/**
 * Receiver of events published by {@link EventPublisher}.
 * <p>Subscribers are invoked synchronously within the append that produced the event, while the write lock of the
 * aggregate is held. They must not block for unbounded time.</p>
 */
@FunctionalInterface
public interface EventSubscriber {
    void apply(StoredEvent event);
}
