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

import io.github.goodees.esa.core.validation.ValidationResult;

import java.util.Collections;
import java.util.List;

/**
 * Command was refused by its handler before anything was stored.
 */
public class CommandRejectedException extends Exception {

    public enum Reason {
        NOT_FOUND,
        ALREADY_EXISTS,
        INVALID
    }

    private final Reason reason;
    private final String aggregateId;
    private final List<String> violations;

    private CommandRejectedException(Reason reason, String aggregateId, List<String> violations, String message) {
        super(message);
        this.reason = reason;
        this.aggregateId = aggregateId;
        this.violations = violations;
    }

    public Reason getReason() {
        return reason;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Violated domain rules, when reason is {@link Reason#INVALID}.
     * @return the violations, empty for other reasons
     */
    public List<String> getViolations() {
        return violations;
    }

    public static CommandRejectedException notFound(Command command) {
        return new CommandRejectedException(Reason.NOT_FOUND, command.getAggregateId(), Collections.emptyList(),
                "Aggregate " + command.getAggregateId() + " not found for " + command.getClass().getSimpleName());
    }

    public static CommandRejectedException alreadyExists(Command command) {
        return new CommandRejectedException(Reason.ALREADY_EXISTS, command.getAggregateId(), Collections.emptyList(),
                "Aggregate " + command.getAggregateId() + " already exists");
    }

    public static CommandRejectedException invalid(Command command, ValidationResult result) {
        if (result.isValid()) {
            throw new IllegalArgumentException("Cannot reject a command with valid result");
        }
        return new CommandRejectedException(Reason.INVALID, command.getAggregateId(), result.getViolations(),
                command.getClass().getSimpleName() + " for " + command.getAggregateId() + " is invalid: "
                        + result.getViolations());
    }
}
