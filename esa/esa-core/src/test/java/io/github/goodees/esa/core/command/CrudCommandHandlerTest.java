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

import io.github.goodees.esa.core.Counters;
import io.github.goodees.esa.core.Counters.Added;
import io.github.goodees.esa.core.Counters.AddToCounter;
import io.github.goodees.esa.core.Counters.Counter;
import io.github.goodees.esa.core.Counters.OpenCounter;
import io.github.goodees.esa.core.Counters.Opened;
import io.github.goodees.esa.core.Counters.RenameCounter;
import io.github.goodees.esa.core.Counters.Renamed;
import io.github.goodees.esa.core.aggregate.Repository;
import io.github.goodees.esa.core.pipeline.EventPublisher;
import io.github.goodees.esa.core.pipeline.EventStorePipeline;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.inmemory.InMemoryEventStore;
import org.hamcrest.Matchers;
import org.junit.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class CrudCommandHandlerTest {
    private final EventStorePipeline store = EventStorePipeline.standard(new InMemoryEventStore(),
            new EventPublisher());
    private final Repository<Counter> repository = new Repository<>(store, Counters.TYPE);

    private CrudCommandHandler<Counter> handler() {
        return CrudCommandHandler.<Counter>builder()
                .validator(Counters.NAME_RULES)
                .create(OpenCounter.class, OpenCounter::toCounter, c -> new Opened(c.getName()))
                .update(RenameCounter.class, (c, cmd) -> c.rename(cmd.getName()), c -> new Renamed(c.getName()))
                .build(repository);
    }

    @Test
    public void create_stores_the_created_event() throws Exception {
        handler().handle(new OpenCounter("c1", "one"));

        assertEquals(1, store.versionOf("c1"));
        assertThat(store.read("c1").get().get(0), instanceOf(Opened.class));
        assertEquals(Optional.of(new Counter("one", 0)), repository.find("c1"));
    }

    @Test
    public void create_of_existing_aggregate_is_rejected() throws Exception {
        CrudCommandHandler<Counter> handler = handler();
        handler.handle(new OpenCounter("c1", "one"));
        try {
            handler.handle(new OpenCounter("c1", "two"));
            fail("Second create should be rejected");
        } catch (CommandRejectedException e) {
            assertEquals(CommandRejectedException.Reason.ALREADY_EXISTS, e.getReason());
            assertEquals("c1", e.getAggregateId());
        }
        assertEquals(1, store.versionOf("c1"));
    }

    @Test
    public void invalid_create_stores_nothing() throws Exception {
        try {
            handler().handle(new OpenCounter("c1", " "));
            fail("Blank name should be rejected");
        } catch (CommandRejectedException e) {
            assertEquals(CommandRejectedException.Reason.INVALID, e.getReason());
            assertThat(e.getViolations(), contains("name must not be blank"));
        }
        assertFalse(store.exists("c1"));
    }

    @Test
    public void update_of_unknown_aggregate_is_rejected_as_not_found() throws Exception {
        try {
            handler().handle(new RenameCounter("nope", "two"));
            fail("Update of unknown aggregate should be rejected");
        } catch (CommandRejectedException e) {
            assertEquals(CommandRejectedException.Reason.NOT_FOUND, e.getReason());
        }
        assertFalse(store.exists("nope"));
    }

    @Test
    public void update_appends_the_updated_state() throws Exception {
        CrudCommandHandler<Counter> handler = handler();
        handler.handle(new OpenCounter("c1", "one"));
        handler.handle(new RenameCounter("c1", "two"));

        assertEquals(2, store.versionOf("c1"));
        assertEquals("two", repository.find("c1").get().getName());
    }

    @Test
    public void invalid_update_leaves_aggregate_unchanged() throws Exception {
        CrudCommandHandler<Counter> handler = handler();
        handler.handle(new OpenCounter("c1", "one"));
        try {
            handler.handle(new RenameCounter("c1", "a name that is way too long"));
            fail("Long name should be rejected");
        } catch (CommandRejectedException e) {
            assertEquals(CommandRejectedException.Reason.INVALID, e.getReason());
            assertThat(e.getViolations(), containsInAnyOrder("name must have at most 20 characters"));
        }
        assertEquals(1, store.versionOf("c1"));
    }

    @Test
    public void write_between_load_and_append_makes_update_conflict() throws Exception {
        CrudCommandHandler<Counter> handler = CrudCommandHandler.<Counter>builder()
                .create(OpenCounter.class, OpenCounter::toCounter, c -> new Opened(c.getName()))
                .update(RenameCounter.class, (c, cmd) -> {
                    try {
                        store.append(cmd.getAggregateId(), store.versionOf(cmd.getAggregateId()), new Added(1));
                    } catch (EventStoreException e) {
                        throw new IllegalStateException(e);
                    }
                    return c.rename(cmd.getName());
                }, c -> new Renamed(c.getName()))
                .build(repository);
        handler.handle(new OpenCounter("c1", "one"));
        try {
            handler.handle(new RenameCounter("c1", "two"));
            fail("Update should conflict with concurrent write");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
        assertEquals(new Counter("one", 1), repository.find("c1").get());
    }

    @Test(expected = UnregisteredCommandException.class)
    public void command_without_step_is_a_configuration_error() throws Exception {
        handler().handle(new AddToCounter("c1", 1));
    }

    @Test
    public void handler_lists_its_command_types() {
        assertThat(handler().commandTypes(), Matchers.<Class<?>>contains(OpenCounter.class, RenameCounter.class));
    }
}
