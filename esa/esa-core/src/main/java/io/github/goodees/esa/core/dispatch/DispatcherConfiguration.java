package io.github.goodees.esa.core.dispatch;

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

import io.github.goodees.esa.core.command.Command;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies and strategies for {@link CommandDispatcher}.
 */
public interface DispatcherConfiguration {
    String dispatcherName();

    /**
     * The thread pool commands are executed on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Thread pool for delayed submissions and retries. <strong>Should be different from executorService!</strong>
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    /**
     * Execute the command. Called on executor thread, never concurrently for the same aggregate.
     * @param command the command
     * @throws Exception when the command is rejected or its events are not stored
     */
    void execute(Command command) throws Exception;

    /**
     * Decide whether and when the command should be retried after failure.
     * @param command command that failed
     * @param t the failure
     * @param completedAttempts number of attempts so far, at least {@code 1}
     * @return negative to fail the command, zero to retry immediately, positive for delay in ms until next attempt
     */
    long retryDelay(Command command, Throwable t, int completedAttempts);
}
