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

import io.github.goodees.esa.core.matching.TypeSwitch;
import io.github.goodees.esa.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single entry point for commands of all aggregates. Handlers are registered at startup, each command type may have
 * only one handler.
 * <p>A command goes to the handler registered for its exact class. Otherwise it goes to the handler of the first
 * registered type it is assignable to, in the order of registration.</p>
 */
public class CommandRouter {
    private static final Logger logger = LoggerFactory.getLogger(CommandRouter.class);

    private final Map<Class<?>, CommandHandler> handlers = new LinkedHashMap<>();
    private volatile TypeSwitch<CommandHandler> routes = TypeSwitch.<CommandHandler>builder().build();

    /**
     * Register handler for command types.
     * @param handler the handler
     * @param commandTypes types it will receive
     * @throws IllegalStateException when any of the types already has a handler. Nothing is registered then.
     */
    public synchronized void register(CommandHandler handler, Class<?>... commandTypes) {
        Objects.requireNonNull(handler, "Handler must be specified");
        for (Class<?> type : commandTypes) {
            if (!Command.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(type + " is not a command");
            }
            if (handlers.containsKey(type)) {
                throw new IllegalStateException("Handler for " + type.getName() + " is already registered: "
                        + handlers.get(type));
            }
        }
        for (Class<?> type : commandTypes) {
            handlers.put(type, handler);
            logger.debug("Registered {} for {}", handler, type.getName());
        }
        TypeSwitch.Builder<CommandHandler> builder = TypeSwitch.builder();
        handlers.forEach(builder::on);
        routes = builder.build();
    }

    public boolean isRegistered(Class<?> commandType) {
        return routes.lookup(commandType).isPresent();
    }

    /**
     * Pass the command to its handler.
     * @param command the command
     * @throws CommandRejectedException when handler rejects the command
     * @throws EventStoreException when handler fails to store the events
     * @throws UnregisteredCommandException when there is no handler for command's type
     */
    public void route(Command command) throws CommandRejectedException, EventStoreException {
        Objects.requireNonNull(command, "Command must be specified");
        CommandHandler handler = routes.lookup(command.getClass())
                .orElseThrow(() -> new UnregisteredCommandException(command.getClass()));
        handler.handle(command);
    }
}
