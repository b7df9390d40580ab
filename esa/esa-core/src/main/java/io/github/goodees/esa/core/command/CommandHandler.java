package io.github.goodees.esa.core.command;

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
 * Decides on a command and records the resulting events. Returning normally means the command was accepted and its
 * events are stored.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * Handle a command.
     * @param command the command
     * @throws CommandRejectedException when the command violates the rules of the aggregate. Nothing was stored.
     * @throws EventStoreException when the events could not be stored, e.g. because of concurrent modification
     */
    void handle(Command command) throws CommandRejectedException, EventStoreException;
}
