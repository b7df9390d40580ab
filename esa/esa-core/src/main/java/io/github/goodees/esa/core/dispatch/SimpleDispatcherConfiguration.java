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
import io.github.goodees.esa.core.store.EventStoreException;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * General dispatcher configuration. Its dependencies are passed to constructor, and {@linkplain CommandExecutor
 * execution} and {@linkplain RetryStrategy retries} are strategies represented by functional interfaces.
 * <pre>
 * new SimpleDispatcherConfiguration("recordings", executor, scheduler, router::route,
 *         SimpleDispatcherConfiguration.retryOnConflict(3, 10, TimeUnit.MILLISECONDS));
 * </pre>
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final CommandExecutor commandExecutor;
    private final RetryStrategy retryStrategy;

    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, CommandExecutor commandExecutor,
                                         RetryStrategy retryStrategy) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "Command executor must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, CommandExecutor commandExecutor) {
        this(name, executorService, schedulerService, commandExecutor, noRetries());
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public void execute(Command command) throws Exception {
        commandExecutor.execute(command);
    }

    @Override
    public long retryDelay(Command command, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(command, t, completedAttempts);
    }

    /**
     * Strategy for executing a command, usually {@code CommandRouter::route}.
     */
    @FunctionalInterface
    public interface CommandExecutor {
        void execute(Command command) throws Exception;
    }

    /**
     * Strategy for retrying a command.
     * @see DispatcherConfiguration#retryDelay(Command, Throwable, int)
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;

        long retryDelay(Command command, Throwable t, int completedAttempts);
    }

    static final RetryStrategy NO_RETRIES = (command, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Retry any failure until number of attempts is reached, with delay of 100 milliseconds.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedRepeat(attempts, 100);
    }

    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    /**
     * Retry only failures caused by concurrent modification of the aggregate, i.e.
     * {@linkplain EventStoreException#isRecoverable() recoverable} store failures. Rejected commands fail
     * immediately.
     * @param attempts number of attempts to allow
     * @param delay delay before retrying
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy retryOnConflict(int attempts, long delay, TimeUnit unit) {
        FixedRepeat repeat = new FixedRepeat(attempts, unit.toMillis(delay));
        return (command, t, completedAttempts) -> t instanceof EventStoreException
                && ((EventStoreException) t).isRecoverable()
                ? repeat.retryDelay(command, t, completedAttempts) : RetryStrategy.DO_NOT_RETRY;
    }

    static class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(Command command, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
