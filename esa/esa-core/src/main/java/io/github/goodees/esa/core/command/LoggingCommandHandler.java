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

import io.github.goodees.esa.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Logs outcome of every command passing to the delegate.
 */
public class LoggingCommandHandler implements CommandHandler {
    private final CommandHandler delegate;
    private final Logger logger;

    public LoggingCommandHandler(String aggregateName, CommandHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + aggregateName);
    }

    @Override
    public void handle(Command command) throws CommandRejectedException, EventStoreException {
        try {
            delegate.handle(command);
            logger.debug("Accepted {}", command);
        } catch (CommandRejectedException e) {
            logger.info("Rejected {}: {}", command, e.getMessage());
            throw e;
        } catch (EventStoreException e) {
            logger.info("Failed to store events of {}: {}", command, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Failed to handle {}", command, e);
            throw e;
        }
    }

    public CommandHandler getDelegate() {
        return delegate;
    }
}
