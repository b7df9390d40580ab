package io.github.goodees.esa.core.projection;

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

import io.github.goodees.esa.core.aggregate.Repository;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Projection that replays the aggregate on every query. Always current, but every query reads the whole stream.
 * @param <T> type of aggregate state
 * @param <V> type of view
 */
public class RepositoryProjection<T, V> implements Projection<V> {
    private final Repository<T> repository;
    private final Function<? super T, ? extends V> toView;

    public RepositoryProjection(Repository<T> repository, Function<? super T, ? extends V> toView) {
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
        this.toView = Objects.requireNonNull(toView, "View mapping must be specified");
    }

    @Override
    public Optional<V> find(String aggregateId) {
        return repository.find(aggregateId).map(toView);
    }
}
