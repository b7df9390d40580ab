package io.github.goodees.esa.core.matching;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Explicit dispatch table from a type to its handler. Used wherever behaviour depends on concrete type of an event or
 * a command, instead of dispatching by reflection or method names.
 *
 * <p>A branch registered for exactly the looked up class wins. Otherwise branches are checked in the order they were
 * registered, and the first one whose type is assignable from the class wins. Resolutions are cached, so generated subclasses of registered types (e.g. Immutables implementations
 * of an event interface) resolve only once.</p>
 * <pre>
 * TypeSwitch&lt;Apply&gt; table = TypeSwitch.&lt;Apply&gt;builder()
 *         .on(RecordingCreatedEvent.class, this::created)
 *         .on(RecordingUpdatedEvent.class, this::updated)
 *         .build();
 * table.require(event).apply(state, event);
 * </pre>
 * @param <H> type of handlers in the table
 */
public class TypeSwitch<H> {
    private final List<SwitchBranch<H>> branches;
    private final ConcurrentMap<Class<?>, Optional<H>> resolved = new ConcurrentHashMap<>();

    private TypeSwitch(Builder<H> b) {
        this.branches = new ArrayList<>(b.branches);
    }

    public static <H> Builder<H> builder() {
        return new Builder<>();
    }

    /**
     * Find the handler for given class.
     * @param type the class to look up
     * @return handler of first branch the type matches, or empty if no branch does
     */
    public Optional<H> lookup(Class<?> type) {
        return resolved.computeIfAbsent(type, this::resolve);
    }

    private Optional<H> resolve(Class<?> type) {
        for (SwitchBranch<H> branch : branches) {
            if (branch.caseClass == type) {
                return Optional.of(branch.handler);
            }
        }
        for (SwitchBranch<H> branch : branches) {
            if (branch.caseClass.isAssignableFrom(type)) {
                return Optional.of(branch.handler);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the handler for given instance, failing when there's none.
     * @param instance the instance to match
     * @return the handler
     * @throws IllegalStateException when no branch matches
     */
    public H require(Object instance) {
        Objects.requireNonNull(instance, "Cannot match null");
        return lookup(instance.getClass())
                .orElseThrow(() -> new IllegalStateException("No handler registered for " + instance.getClass()));
    }

    public boolean handles(Object instance) {
        return instance != null && lookup(instance.getClass()).isPresent();
    }

    /**
     * The registered types, in registration order.
     * @return unmodifiable set of types
     */
    public Set<Class<?>> types() {
        Set<Class<?>> result = new LinkedHashSet<>();
        for (SwitchBranch<H> branch : branches) {
            result.add(branch.caseClass);
        }
        return Collections.unmodifiableSet(result);
    }

    public static class Builder<H> {
        private final List<SwitchBranch<H>> branches = new ArrayList<>();

        public Builder<H> on(Class<?> clazz, H handler) {
            for (SwitchBranch<H> branch : branches) {
                if (branch.caseClass == clazz) {
                    throw new IllegalArgumentException("Handler for " + clazz + " is already registered");
                }
            }
            branches.add(new SwitchBranch<>(clazz, handler));
            return this;
        }

        public TypeSwitch<H> build() {
            return new TypeSwitch<>(this);
        }
    }

    private static class SwitchBranch<H> {
        private final Class<?> caseClass;
        private final H handler;

        SwitchBranch(Class<?> caseClass, H handler) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }
    }
}
