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

/**
 * What {@link EventPublisher} does when a subscriber throws.
 */
public enum SubscriberFailurePolicy {
    /**
     * Stop notifying and fail the append with
     * {@link io.github.goodees.esa.core.store.EventStoreException.Fault#SUBSCRIBER_FAILED}. The events remain stored,
     * only the caller learns that projections may be behind.
     */
    PROPAGATE,
    /**
     * Log the failure and continue with next subscriber. The append succeeds.
     */
    ISOLATE
}
