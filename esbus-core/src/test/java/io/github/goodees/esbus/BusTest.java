package io.github.goodees.esbus;

/*-
 * #%L
 * esbus
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

import io.github.goodees.esbus.aggregate.Actor;
import io.github.goodees.esbus.aggregate.Aggregate;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.inmemory.InMemoryEventStore;
import io.github.goodees.esbus.trace.Tracer;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BusTest {
    static final Actor actor = Actor.of("user-1", "User", "tenant-1", "admin");

    @Rule
    public TestName testName = new TestName();

    CountingEventStore store;
    Bus bus;

    @Before
    public void setUp() throws CommandBusException {
        store = new CountingEventStore(new InMemoryEventStore());
        bus = new Bus(store, Collections.singletonList(Calculator.TYPE));
    }

    String name() {
        return testName.getMethodName();
    }

    @Test
    public void new_aggregate_gets_generated_id_and_first_version() throws CommandBusException {
        Aggregate<?> aggregate = bus.command(actor, "AddNumbers", Calculator.numbers(1, 2));
        assertNotNull(aggregate.getAggregateId());
        assertEquals(0, aggregate.getAggregateVersion());
        assertEquals(3, ((Calculator.State) aggregate.getState()).getResult());
        assertTrue(aggregate.getUncommittedEvents().isEmpty());
    }

    @Test
    public void no_op_command_commits_nothing_and_leaves_cache_untouched() throws CommandBusException {
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        int commits = store.commits.get();
        List<String> cached = bus.getCache().keys();

        Aggregate<?> aggregate = bus.command(actor, "Peek", name(), Collections.emptyMap());

        assertEquals(0, aggregate.getAggregateVersion());
        assertEquals(commits, store.commits.get());
        assertEquals(cached, bus.getCache().keys());
    }

    @Test
    public void committing_events_advances_version_by_their_count() throws CommandBusException {
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 1));
        Map<String, Object> payload = Calculator.numbers(2, 3);
        payload.put("times", 3);

        Aggregate<?> aggregate = bus.command(actor, "AddNumbers", name(), 0, payload);

        assertEquals(3, aggregate.getAggregateVersion());
        List<EventRecord> events = store.lastCommitted();
        assertEquals(3, events.size());
        for (int i = 0; i < events.size(); i++) {
            assertEquals(0 + i + 1, events.get(i).getAggregateVersion());
            assertEquals(6, events.get(i).getPaddedAggregateVersion().length());
        }
    }

    @Test
    public void cached_aggregate_is_used_for_matching_version() throws CommandBusException {
        Aggregate<?> first = bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        Object stateAfterCommit = first.getState();
        int loads = store.loads.get();

        Aggregate<?> peeked = bus.command(actor, "Peek", name(), 0, Collections.emptyMap());

        assertEquals("Cache hit should not read the store", loads, store.loads.get());
        assertEquals(stateAfterCommit, peeked.getState());
        assertEquals(0, peeked.getAggregateVersion());
    }

    @Test
    public void cache_is_not_trusted_without_expected_version() throws CommandBusException {
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        int loads = store.loads.get();

        bus.command(actor, "Peek", name(), Collections.emptyMap());

        assertEquals(loads + 1, store.loads.get());
    }

    @Test
    public void cache_with_other_version_is_reloaded() throws CommandBusException {
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(2, 2));
        int loads = store.loads.get();

        try {
            bus.command(actor, "SubtractNumbers", name(), 0, Calculator.numbers(5, 1));
            fail("Stale expected version should fail");
        } catch (CommandBusException e) {
            assertEquals(CommandBusException.Fault.CONCURRENCY, e.getFault());
        }
        assertEquals(loads + 1, store.loads.get());
    }

    @Test
    public void unspecified_version_commits_against_latest() throws CommandBusException {
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        bus.command(actor, "AddNumbers", name(), Calculator.numbers(2, 2));
        Aggregate<?> aggregate = bus.command(actor, "SubtractNumbers", name(), Calculator.numbers(9, 2));

        assertEquals(2, aggregate.getAggregateVersion());
        assertEquals(7, ((Calculator.State) aggregate.getState()).getResult());
        assertEquals(3, ((Calculator.State) aggregate.getState()).getOperations());
    }

    @Test
    public void concurrent_commands_with_same_expected_version_let_one_win() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 10; round++) {
                String id = name() + round;
                bus.command(actor, "AddNumbers", id, Calculator.numbers(1, 1));
                CountDownLatch start = new CountDownLatch(1);
                Callable<Aggregate<?>> command = () -> {
                    start.await();
                    return bus.command(actor, "AddNumbers", id, 0, Calculator.numbers(2, 2));
                };
                List<Future<Aggregate<?>>> results = new ArrayList<>();
                results.add(executor.submit(command));
                results.add(executor.submit(command));
                start.countDown();

                int succeeded = 0;
                for (Future<Aggregate<?>> result : results) {
                    try {
                        assertEquals(1, result.get(5, TimeUnit.SECONDS).getAggregateVersion());
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause(), instanceOf(CommandBusException.class));
                        assertEquals(CommandBusException.Fault.CONCURRENCY,
                            ((CommandBusException) e.getCause()).getFault());
                    }
                }
                assertEquals("Exactly one command should win in round " + round, 1, succeeded);
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void exceeding_max_events_fails_before_write() throws CommandBusException {
        CountingEventStore limitedStore = new CountingEventStore(new InMemoryEventStore());
        Bus limited = new Bus(limitedStore, Collections.singletonList(Calculator.type("Calculator", 5)));
        for (int i = 0; i < 4; i++) {
            limited.command(actor, "AddNumbers", name(), Calculator.numbers(i, i));
        }
        long position = limitedStore.streamPosition(actor.tenant(), "main");
        try {
            limited.command(actor, "AddNumbers", name(), 3, Calculator.numbers(1, 1));
            fail("Fifth event should not fit");
        } catch (CommandBusException e) {
            assertEquals(CommandBusException.Fault.PRECONDITION, e.getFault());
        }
        assertEquals(position, limitedStore.streamPosition(actor.tenant(), "main"));
        assertEquals(3, limited.command(actor, "Peek", name(), Collections.emptyMap()).getAggregateVersion());
    }

    @Test
    public void handler_failure_propagates_without_commit() throws CommandBusException {
        try {
            bus.command(actor, "AddNumbers", name(), Collections.singletonMap("number1", 1));
            fail("Missing operand should fail");
        } catch (CommandBusException e) {
            assertEquals(CommandBusException.Fault.MISSING_ARGUMENTS, e.getFault());
        }
        assertEquals(0, store.commits.get());
        assertEquals(0, bus.getCache().size());
    }

    @Test
    public void invalid_invocations_are_rejected() {
        assertFault(CommandBusException.Fault.MISSING_ARGUMENTS,
            () -> bus.command(null, "AddNumbers", Calculator.numbers(1, 1)));
        assertFault(CommandBusException.Fault.MISSING_ARGUMENTS,
            () -> bus.command(Actor.of("id", "name", ""), "AddNumbers", Calculator.numbers(1, 1)));
        assertFault(CommandBusException.Fault.MISSING_ARGUMENTS,
            () -> bus.command(actor, "", Calculator.numbers(1, 1)));
        assertFault(CommandBusException.Fault.MISSING_ARGUMENTS,
            () -> bus.command(actor, "AddNumbers", null, 2, Calculator.numbers(1, 1)));
        assertFault(CommandBusException.Fault.INVALID_ARGUMENTS,
            () -> bus.command(actor, "MultiplyNumbers", Calculator.numbers(1, 1)));
        assertFault(CommandBusException.Fault.INVALID_ARGUMENTS,
            () -> new Bus(null, Collections.singletonList(Calculator.TYPE)));
        assertEquals(0, store.loads.get());
    }

    @Test
    public void tracer_receives_command_lifecycle() throws CommandBusException {
        List<String> methods = Collections.synchronizedList(new ArrayList<>());
        Tracer tracer = record -> methods.add((String) record.get().get("method"));
        Bus traced = new Bus(new InMemoryEventStore(false, tracer), Arrays.asList(Calculator.TYPE),
                SimpleBusConfiguration.builder().tracer(tracer).build());

        traced.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));
        traced.command(actor, "AddNumbers", name(), Calculator.numbers(1, 2));

        assertThat(methods.subList(0, 3), contains("command", "loadAggregate", "commitEvents"));
        assertThat(methods, hasItem("loadEvent"));
    }

    interface Invocation {
        void run() throws CommandBusException;
    }

    static void assertFault(CommandBusException.Fault expected, Invocation invocation) {
        try {
            invocation.run();
            fail("Expected failure " + expected);
        } catch (CommandBusException e) {
            assertEquals(e.getMessage(), expected, e.getFault());
        }
    }
}
