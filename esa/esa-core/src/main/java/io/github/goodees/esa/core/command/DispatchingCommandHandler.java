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

import java.util.Set;

/**
 * Command handler that passes each command to the step registered for its type.
 * <pre>
 * CommandHandler handler = DispatchingCommandHandler.builder()
 *         .on(ArchiveRecording.class, this::archive)
 *         .build();
 * </pre>
 */
public class DispatchingCommandHandler implements CommandHandler {

    /**
     * Processing step for one command type.
     * @param <C> type of command
     */
    @FunctionalInterface
    public interface Process<C extends Command> {
        void process(C command) throws CommandRejectedException, EventStoreException;
    }

    private final TypeSwitch<Process<Command>> steps;

    DispatchingCommandHandler(TypeSwitch<Process<Command>> steps) {
        this.steps = steps;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void handle(Command command) throws CommandRejectedException, EventStoreException {
        Process<Command> step = steps.lookup(command.getClass())
                .orElseThrow(() -> new UnregisteredCommandException(command.getClass()));
        step.process(command);
    }

    /**
     * Command types this handler processes.
     * @return the types in registration order
     */
    public Set<Class<?>> commandTypes() {
        return steps.types();
    }

    public static class Builder {
        private final TypeSwitch.Builder<Process<Command>> steps = TypeSwitch.builder();

        public <C extends Command> Builder on(Class<C> type, Process<? super C> step) {
            steps.on(type, command -> step.process(type.cast(command)));
            return this;
        }

        public DispatchingCommandHandler build() {
            return new DispatchingCommandHandler(steps.build());
        }
    }
}
