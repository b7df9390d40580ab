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

import io.github.goodees.esa.core.Event;
import io.github.goodees.esa.core.UnitOfWork;
import io.github.goodees.esa.core.aggregate.Repository;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.validation.ValidationResult;
import io.github.goodees.esa.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Handler for aggregates that are only created and overwritten.
 *
 * <p>Create command: rejected with {@link CommandRejectedException.Reason#ALREADY_EXISTS} when the stream exists,
 * otherwise the candidate state built from the command is validated and the stream is created with the created event
 * in single operation.</p>
 *
 * <p>Update command: rejected with {@link CommandRejectedException.Reason#NOT_FOUND} when the aggregate can't be
 * loaded, otherwise the command is applied to the loaded state, the result validated, and the updated event appended
 * at the version the state was loaded at.</p>
 *
 * <p>All rejections happen before anything is written.</p>
 * @param <T> type of aggregate state
 */
public class CrudCommandHandler<T> implements CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(CrudCommandHandler.class);

    private final Repository<T> repository;
    private final Validator<T> validator;
    private final DispatchingCommandHandler dispatch;

    private CrudCommandHandler(Builder<T> builder, Repository<T> repository) {
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
        this.validator = builder.validator;
        DispatchingCommandHandler.Builder steps = DispatchingCommandHandler.builder();
        builder.steps.forEach(s -> s.register(this, steps));
        this.dispatch = steps.build();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    @Override
    public void handle(Command command) throws CommandRejectedException, EventStoreException {
        dispatch.handle(command);
    }

    public Set<Class<?>> commandTypes() {
        return dispatch.commandTypes();
    }

    public Repository<T> getRepository() {
        return repository;
    }

    <C extends Command> void create(C command, Function<? super C, T> candidate,
            Function<? super T, ? extends Event> created) throws CommandRejectedException, EventStoreException {
        String id = command.getAggregateId();
        if (repository.exists(id)) {
            throw CommandRejectedException.alreadyExists(command);
        }
        T state = candidate.apply(command);
        validate(command, state);
        UnitOfWork uow = repository.unitOfWork(id);
        try {
            uow.createWith(created.apply(state));
        } catch (EventStoreException e) {
            if (e.getFault() == EventStoreException.Fault.DUPLICATE_STREAM) {
                logger.debug("Stream {} was created concurrently", id);
                throw CommandRejectedException.alreadyExists(command);
            }
            throw e;
        }
    }

    <C extends Command> void update(C command, BiFunction<T, ? super C, T> overwrite,
            Function<? super T, ? extends Event> updated) throws CommandRejectedException, EventStoreException {
        String id = command.getAggregateId();
        // version is captured before loading, so a write in between conflicts on append
        UnitOfWork uow = repository.unitOfWork(id);
        T current = repository.find(id).orElseThrow(() -> CommandRejectedException.notFound(command));
        T state = overwrite.apply(current, command);
        validate(command, state);
        uow.append(updated.apply(state));
    }

    private void validate(Command command, T candidate) throws CommandRejectedException {
        ValidationResult result = validator.validate(candidate);
        if (!result.isValid()) {
            throw CommandRejectedException.invalid(command, result);
        }
    }

    @FunctionalInterface
    interface Step<T> {
        void register(CrudCommandHandler<T> handler, DispatchingCommandHandler.Builder steps);
    }

    public static class Builder<T> {
        private Validator<T> validator = Validator.none();
        private final List<Step<T>> steps = new ArrayList<>();

        public Builder<T> validator(Validator<T> validator) {
            this.validator = Objects.requireNonNull(validator, "Validator must be specified");
            return this;
        }

        /**
         * Register a create command.
         * @param type command type
         * @param candidate builds the initial state from the command
         * @param created builds the created event from validated state
         * @param <C> command type
         * @return this builder
         */
        public <C extends Command> Builder<T> create(Class<C> type, Function<? super C, T> candidate,
                Function<? super T, ? extends Event> created) {
            Objects.requireNonNull(candidate);
            Objects.requireNonNull(created);
            steps.add((handler, b) -> b.on(type, c -> handler.create(c, candidate, created)));
            return this;
        }

        /**
         * Register an update command.
         * @param type command type
         * @param overwrite computes the new state from current state and the command
         * @param updated builds the updated event from validated state
         * @param <C> command type
         * @return this builder
         */
        public <C extends Command> Builder<T> update(Class<C> type, BiFunction<T, ? super C, T> overwrite,
                Function<? super T, ? extends Event> updated) {
            Objects.requireNonNull(overwrite);
            Objects.requireNonNull(updated);
            steps.add((handler, b) -> b.on(type, c -> handler.update(c, overwrite, updated)));
            return this;
        }

        public CrudCommandHandler<T> build(Repository<T> repository) {
            return new CrudCommandHandler<>(this, repository);
        }
    }
}
