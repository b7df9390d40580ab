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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating an aggregate state, listing violated rules.
 */
public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(Collections.emptyList());

    private final List<String> violations;

    private ValidationResult(List<String> violations) {
        this.violations = violations;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String violation, String... more) {
        List<String> list = new ArrayList<>(1 + more.length);
        list.add(violation);
        Collections.addAll(list, more);
        return new ValidationResult(Collections.unmodifiableList(list));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<String> getViolations() {
        return violations;
    }

    /**
     * Combine with another result.
     * @param other result to merge
     * @return result that holds violations of both
     */
    public ValidationResult and(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (this.isValid()) {
            return other;
        }
        List<String> list = new ArrayList<>(violations);
        list.addAll(other.violations);
        return new ValidationResult(Collections.unmodifiableList(list));
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[OK]" : "ValidationResult" + violations;
    }

    public static class Builder {
        private final List<String> violations = new ArrayList<>();

        /**
         * Record violation unless condition holds.
         * @param condition the rule
         * @param violation message to record when the rule is broken
         * @return this builder
         */
        public Builder check(boolean condition, String violation) {
            if (!condition) {
                violations.add(violation);
            }
            return this;
        }

        public ValidationResult build() {
            return violations.isEmpty() ? OK : new ValidationResult(Collections.unmodifiableList(new ArrayList<>(violations)));
        }
    }
}
