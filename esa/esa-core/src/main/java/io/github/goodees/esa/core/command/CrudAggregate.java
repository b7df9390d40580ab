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
import io.github.goodees.esa.core.aggregate.AggregateType;
import io.github.goodees.esa.core.aggregate.Repository;
import io.github.goodees.esa.core.pipeline.EventStorePipeline;
import io.github.goodees.esa.core.validation.Validator;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Wiring of an aggregate that follows the create/update convention: its repository, its validated command handler
 * and the registration of the handler's commands on a router.
 * <pre>
 * CrudAggregate&lt;Recording&gt; recordings = CrudAggregate.of(Recording.TYPE)
 *         .validator(new RecordingValidator())
 *         .create(CreateRecording.class, CreateRecording::toRecording, RecordingCreatedEvent::of)
 *         .update(UpdateRecording.class, Recording::overwrite, RecordingUpdatedEvent::of)
 *         .registerOn(store, router);
 * </pre>
 * @param <T> type of aggregate state
 */
public final class CrudAggregate<T> {
    private final Repository<T> repository;
    private final CrudCommandHandler<T> handler;
    private final Validator<T> validator;

    private CrudAggregate(Repository<T> repository, CrudCommandHandler<T> handler, Validator<T> validator) {
        this.repository = repository;
        this.handler = handler;
        this.validator = validator;
    }

    public static <T> Builder<T> of(AggregateType<T> type) {
        return new Builder<>(type);
    }

    public Repository<T> getRepository() {
        return repository;
    }

    public CrudCommandHandler<T> getHandler() {
        return handler;
    }

    public Validator<T> getValidator() {
        return validator;
    }

    public static class Builder<T> {
        private final AggregateType<T> type;
        private final CrudCommandHandler.Builder<T> handler = CrudCommandHandler.builder();
        private Validator<T> validator = Validator.none();
        private boolean hasCreate;
        private boolean hasUpdate;

        Builder(AggregateType<T> type) {
            this.type = Objects.requireNonNull(type, "Aggregate type must be specified");
        }

        public Builder<T> validator(Validator<T> validator) {
            this.validator = validator;
            handler.validator(validator);
            return this;
        }

        public <C extends Command> Builder<T> create(Class<C> commandType, Function<? super C, T> candidate,
                Function<? super T, ? extends Event> created) {
            handler.create(commandType, candidate, created);
            hasCreate = true;
            return this;
        }

        public <C extends Command> Builder<T> update(Class<C> commandType, BiFunction<T, ? super C, T> overwrite,
                Function<? super T, ? extends Event> updated) {
            handler.update(commandType, overwrite, updated);
            hasUpdate = true;
            return this;
        }

        /**
         * Create repository and command handler over the store, and register the handler for all create and update
         * commands.
         * @param store the store
         * @param router the router
         * @return the wired aggregate
         * @throws IllegalStateException when create or update command is missing, or any command already has a
         * handler in the router
         */
        public CrudAggregate<T> registerOn(EventStorePipeline store, CommandRouter router) {
            if (!hasCreate || !hasUpdate) {
                throw new IllegalStateException(type + " needs both create and update command");
            }
            Repository<T> repository = new Repository<>(store, type);
            CrudCommandHandler<T> crud = handler.build(repository);
            router.register(new LoggingCommandHandler(type.getName(), crud),
                    crud.commandTypes().toArray(new Class<?>[0]));
            return new CrudAggregate<>(repository, crud, validator);
        }
    }
}
