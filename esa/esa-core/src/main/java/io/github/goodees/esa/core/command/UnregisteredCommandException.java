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

/**
 * No handler is registered for a command type. This is an error in configuration of the application.
 */
public class UnregisteredCommandException extends RuntimeException {
    private final Class<?> commandType;

    public UnregisteredCommandException(Class<?> commandType) {
        super("No handler registered for " + commandType.getName());
        this.commandType = commandType;
    }

    public Class<?> getCommandType() {
        return commandType;
    }
}
