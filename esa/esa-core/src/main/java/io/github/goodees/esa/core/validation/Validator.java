package io.github.goodees.esa.core.validation;

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

import java.util.Objects;

/**
 * Domain rules of an aggregate, checked on the candidate state before any event is stored.
 * @param <T> type of aggregate state
 */
@FunctionalInterface
public interface Validator<T> {

    ValidationResult validate(T candidate);

    default Validator<T> and(Validator<? super T> other) {
        Objects.requireNonNull(other);
        return candidate -> validate(candidate).and(other.validate(candidate));
    }

    static <T> Validator<T> none() {
        return candidate -> ValidationResult.ok();
    }
}
