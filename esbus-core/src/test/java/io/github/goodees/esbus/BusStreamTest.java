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
import io.github.goodees.esbus.store.inmemory.InMemoryEventStore;
import io.github.goodees.esbus.stream.EventHandler;
import io.github.goodees.esbus.stream.EventStream;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.github.goodees.esbus.BusTest.assertFault;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BusStreamTest {
    static final Actor alice = Actor.of("alice", "Alice", "tenant-a");
    static final Actor bob = Actor.of("bob", "Bob", "tenant-b");

    CountingEventStore store;
    Bus bus;

    @Before
    public void setUp() throws CommandBusException {
        store = new CountingEventStore(new InMemoryEventStore());
        bus = new Bus(store, Collections.singletonList(Calculator.TYPE),
                SimpleBusConfiguration.builder().pollLimit(2).build());
    }

    void addNumbers(Actor actor, String id, int times) throws CommandBusException {
        for (int i = 0; i < times; i++) {
            bus.command(actor, "AddNumbers", id, Calculator.numbers(i, 1));
        }
    }

    @Test
    public void subscribed_handler_catches_up_and_follows_live() throws Exception {
        addNumbers(alice, "calc-1", 3);
        EventCounter counter = new EventCounter("counter");

        bus.subscribe(Collections.singletonList(bus.openStream(alice.tenant(), "main")),
            Collections.singletonList(counter)).get(5, TimeUnit.SECONDS);
        assertEquals(3, counter.count());

        addNumbers(alice, "calc-2", 2);
        bus.flush(alice.tenant());

        assertThat(counter.positions(), contains(0L, 1L, 2L, 3L, 4L));
    }

    @Test
    public void live_events_are_delivered_without_reading_the_log() throws Exception {
        // delivering in the committing thread, so that every push finds its event in the window
        bus = new Bus(store, Collections.singletonList(Calculator.TYPE),
                SimpleBusConfiguration.builder().streamExecutor(Runnable::run).build());
        EventCounter counter = new EventCounter("counter");
        bus.subscribe(Collections.singletonList(bus.openStream(alice.tenant(), "main")),
            Collections.singletonList(counter)).get(5, TimeUnit.SECONDS);
        int reads = store.streamReads.get();

        addNumbers(alice, "calc-1", 3);
        bus.flush(alice.tenant());

        assertEquals(3, counter.count());
        assertEquals(reads, store.streamReads.get());
    }

    @Test
    public void streams_of_tenants_are_separate() throws Exception {
        EventCounter aliceCounter = new EventCounter("counter");
        EventCounter bobCounter = new EventCounter("counter");
        bus.subscribe(Collections.singletonList(bus.openStream(alice.tenant(), "main")),
            Collections.singletonList(aliceCounter)).get(5, TimeUnit.SECONDS);
        bus.subscribe(Collections.singletonList(bus.openStream(bob.tenant(), "main")),
            Collections.singletonList(bobCounter)).get(5, TimeUnit.SECONDS);

        addNumbers(alice, "calc-1", 2);
        addNumbers(bob, "calc-1", 1);
        bus.flush(alice.tenant());
        bus.flush(bob.tenant());

        assertThat(aliceCounter.positions(), contains(0L, 1L));
        assertThat(bobCounter.positions(), contains(0L));
    }

    @Test
    public void explicit_poll_delivers_in_batches() throws CommandBusException {
        addNumbers(alice, "calc-1", 3);
        EventStream stream = bus.openStream(alice.tenant(), "main");
        EventCounter counter = new EventCounter("late");
        List<EventHandler> handlers = Arrays.asList(counter);

        assertTrue(bus.poll(alice.tenant(), "main", handlers, 2));
        assertEquals(2, counter.count());
        assertFalse(bus.poll(alice.tenant(), "main", handlers, 2));
        assertEquals(3, counter.count());
        assertThat(stream.getHandlers(), empty());
    }

    @Test
    public void poll_of_registered_stream_delivers_everything() throws Exception {
        EventStream stream = bus.openStream(alice.tenant(), "main");
        EventCounter counter = new EventCounter("counter");
        stream.subscribe(counter);
        addNumbers(alice, "calc-1", 5);
        bus.flush(alice.tenant());

        assertFalse(bus.poll(alice.tenant(), "main").get(5, TimeUnit.SECONDS));
        assertThat(counter.positions(), contains(0L, 1L, 2L, 3L, 4L));
    }

    @Test
    public void opening_stream_twice_returns_same_stream() throws CommandBusException {
        assertSame(bus.openStream(alice.tenant(), "main"), bus.openStream(alice.tenant(), "main"));
    }

    @Test
    public void polling_unknown_stream() throws Exception {
        assertFalse(bus.poll(alice.tenant(), "audit").get(5, TimeUnit.SECONDS));
        assertFault(CommandBusException.Fault.INVALID_ARGUMENTS,
            () -> bus.poll(alice.tenant(), "audit", Collections.emptyList(), 1));
    }
}
