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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous command dispatcher. Executes at most one command at time per aggregate, commands for different
 * aggregates run in parallel on the configured executor. Internally the dispatcher maintains a queue of invocations
 * for every aggregate id.
 *
 * <p>Since commands of one aggregate don't overlap, they cannot conflict with each other. Conflicts with writers
 * outside of the dispatcher are handled by the {@linkplain DispatcherConfiguration#retryDelay retry strategy}.</p>
 */
public class CommandDispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public CommandDispatcher(DispatcherConfiguration conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Submit a command. It is added to aggregate's mailbox and executed after all commands submitted before.
     * @param command the command
     * @return future that completes when the command is accepted, or exceptionally with the reason of failure
     */
    public CompletableFuture<Void> submit(Command command) {
        return mailbox(command).enqueueInvocation(new Invocation(command));
    }

    /**
     * Submit a command after a delay.
     * @param command the command
     * @param delay delay before the command is put in the mailbox
     * @param unit unit of delay
     * @return future of the result
     */
    public CompletableFuture<Void> submitLater(Command command, long delay, TimeUnit unit) {
        Mailbox mailbox = mailbox(command);
        Invocation inv = new Invocation(command);
        conf.schedulerService().schedule(() -> mailbox.enqueueInvocation(inv), delay, unit);
        return inv.result;
    }

    private Mailbox mailbox(Command command) {
        Objects.requireNonNull(command, "Command must be specified");
        return mailboxes.computeIfAbsent(command.getAggregateId(), Mailbox::new);
    }

    private class Invocation {
        private final Command command;
        private final CompletableFuture<Void> result = new CompletableFuture<>();
        private final Instant submission = Instant.now();
        private int completedAttempts;

        Invocation(Command command) {
            this.command = command;
        }

        @Override
        public String toString() {
            return "Invocation[command=" + command + ", submissionTime=" + submission
                    + ", attempts=" + completedAttempts + "]";
        }
    }

    /**
     * Queue of commands for single aggregate. Handles the concurrency between adding new command, and executing only
     * single one.
     */
    private class Mailbox implements Runnable {
        private final String id;
        private final Deque<Invocation> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation> currentInvocation = new AtomicReference<>();

        Mailbox(String id) {
            this.id = id;
        }

        CompletableFuture<Void> enqueueInvocation(Invocation inv) {
            queue.add(inv);
            if (canStartProcessing()) {
                conf.executorService().submit(this);
            }
            return inv.result;
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", id);
                return true;
            }
            logger.debug("Will not start processing queue for {}, {} commands enqueued during current execution",
                    id, queueSize);
            return false;
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        @Override
        public void run() {
            Invocation inv = nextInvocation();
            if (inv == null) {
                return;
            }
            if (!currentInvocation.compareAndSet(null, inv)) {
                logger.error("Mailbox ran while invocation is in progress. Current invocation: {}, "
                        + "dequeued invocation: {}", currentInvocation.get(), inv);
                queue.addFirst(inv);
                return;
            }
            if (inv.result.isDone()) {
                logger.info("Invocation attempted to run after it was cancelled: {}", inv);
            } else {
                execute(inv);
            }
            finish(inv);
        }

        private Invocation nextInvocation() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Invocation inv = queue.poll();
                if (inv != null) {
                    return inv;
                }
                // an invocation might have been queued after the poll, in that case we need to poll again
                if (canStopProcessing(enqueues)) {
                    logger.debug("Stopping processing of queue for {}", id);
                    return null;
                }
            }
        }

        private void execute(Invocation inv) {
            inv.completedAttempts++;
            try {
                conf.execute(inv.command);
                inv.result.complete(null);
            } catch (Exception e) {
                handleFailure(inv, e);
            }
        }

        private void handleFailure(Invocation inv, Exception e) {
            long delay = conf.retryDelay(inv.command, e, inv.completedAttempts);
            if (delay == 0) {
                logger.debug("Retrying {} after {}", inv, e.toString());
                queue.addFirst(inv);
            } else if (delay > 0) {
                logger.debug("Retrying {} in {} ms after {}", inv, delay, e.toString());
                conf.schedulerService().schedule(() -> enqueueInvocation(inv), delay, TimeUnit.MILLISECONDS);
            } else {
                inv.result.completeExceptionally(e);
            }
        }

        private void finish(Invocation inv) {
            if (currentInvocation.compareAndSet(inv, null)) {
                conf.executorService().submit(this);
            } else {
                logger.error("Invocation finished, but wasn't current invocation: {}", inv);
            }
        }
    }
}
