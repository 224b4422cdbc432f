package io.github.goodees.esbus.stream;

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

import io.github.goodees.esbus.Calculator;
import io.github.goodees.esbus.CommandBusException;
import io.github.goodees.esbus.EventCounter;
import io.github.goodees.esbus.aggregate.Actor;
import io.github.goodees.esbus.aggregate.Aggregate;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.inmemory.InMemoryEventStore;
import io.github.goodees.esbus.trace.Tracer;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StoredEventStreamTest {
    static final Actor actor = Actor.of("user-1", "User", "tenant-1");
    static ExecutorService executor = Executors.newFixedThreadPool(2);

    InMemoryEventStore store;

    @AfterClass
    public static void shutdown() {
        executor.shutdown();
    }

    @Before
    public void setUp() {
        store = new InMemoryEventStore();
    }

    StoredEventStream stream(int batchSize) {
        return new StoredEventStream(actor.tenant(), "main", store, Tracer.NONE, executor, batchSize);
    }

    List<EventRecord> addNumbers(String id, int times) throws CommandBusException {
        List<EventRecord> result = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            Aggregate<Calculator.State> aggregate = store.loadAggregate(actor.tenant(), Calculator.TYPE, id);
            long version = aggregate.getAggregateVersion();
            Calculator.run(aggregate, actor, "AddNumbers", Calculator.numbers(i, i));
            result.addAll(store.commitEvents(actor, "AddNumbers", aggregate, version));
        }
        return result;
    }

    @Test
    public void late_handler_polls_backlog_in_batches() throws CommandBusException {
        addNumbers("calc", 3);
        StoredEventStream stream = stream(10);
        EventCounter counter = new EventCounter("counter");
        List<EventHandler> handlers = Collections.singletonList(counter);

        assertTrue("Still behind after first batch", stream.poll(handlers, 2));
        assertEquals(2, counter.count());
        assertFalse("Caught up after second batch", stream.poll(handlers, 2));
        assertEquals(3, counter.count());
        assertFalse(stream.poll(handlers, 2));
        assertEquals(3, counter.count());
    }

    @Test
    public void catchup_and_live_delivery_see_every_position_once_with_single_event_batches() throws Exception {
        catchupThenLive(1);
    }

    @Test
    public void catchup_and_live_delivery_see_every_position_once_with_large_batches() throws Exception {
        catchupThenLive(100);
    }

    private void catchupThenLive(int batchSize) throws Exception {
        addNumbers("before", 4);
        StoredEventStream stream = stream(batchSize);
        EventCounter counter = new EventCounter("counter");
        stream.subscribe(counter);
        stream.catchup();

        for (EventRecord event : addNumbers("after", 3)) {
            stream.push(event, false);
        }
        stream.flush();

        assertThat(counter.positions(), contains(0L, 1L, 2L, 3L, 4L, 5L, 6L));
    }

    @Test
    public void handlers_progress_independently() throws Exception {
        addNumbers("calc", 2);
        StoredEventStream stream = stream(10);
        EventCounter early = new EventCounter("early");
        stream.subscribe(early);
        stream.catchup().get(5, TimeUnit.SECONDS);

        addNumbers("calc", 2);
        EventCounter late = new EventCounter("late");
        stream.subscribe(late);
        stream.push(null, true).get(5, TimeUnit.SECONDS);

        assertThat(early.positions(), contains(0L, 1L, 2L, 3L));
        assertThat(late.positions(), contains(0L, 1L, 2L, 3L));
        assertEquals(Long.valueOf(3), store.readCursors(actor.tenant(), "main").get("late"));
    }

    @Test
    public void failing_handler_keeps_its_position_and_does_not_block_others() throws Exception {
        addNumbers("calc", 3);
        StoredEventStream stream = stream(10);
        EventCounter failing = new EventCounter("failing");
        failing.failOnceAt(1);
        EventCounter healthy = new EventCounter("healthy");
        List<EventHandler> handlers = Arrays.asList(failing, healthy);

        assertTrue(stream.poll(handlers, 10));
        assertThat(failing.positions(), contains(0L));
        assertThat(healthy.positions(), contains(0L, 1L, 2L));
        HandlerFailure failure = stream.getFailures().get("failing");
        assertEquals(1, failure.getStreamPosition());
        assertTrue(failure.getError() instanceof IllegalStateException);

        assertFalse(stream.poll(handlers, 10));
        assertThat(failing.positions(), contains(0L, 1L, 2L));
        assertTrue(stream.getFailures().isEmpty());
    }

    @Test
    public void broken_handler_far_behind_does_not_hold_back_others() throws Exception {
        addNumbers("calc", 15);
        StoredEventStream stream = stream(10);
        EventCounter healthy = new EventCounter("healthy");
        stream.poll(Collections.singletonList(healthy), 12);
        EventHandler broken = new EventHandler() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void handle(String tenant, EventRecord event) {
                throw new IllegalStateException("Cannot handle " + event.getStreamPosition());
            }
        };
        List<EventHandler> handlers = Arrays.asList(broken, healthy);

        assertTrue(stream.poll(handlers, 10));
        assertEquals(15, healthy.count());
        assertEquals(0, stream.getFailures().get("broken").getStreamPosition());

        stream.subscribe(broken);
        stream.subscribe(healthy);
        addNumbers("calc", 2);
        assertTrue("Broken handler stays behind", stream.push(null, true).get(5, TimeUnit.SECONDS));
        assertEquals(17, healthy.count());
    }

    @Test
    public void unsubscribed_handler_receives_nothing_more() throws Exception {
        addNumbers("calc", 2);
        StoredEventStream stream = stream(10);
        EventCounter staying = new EventCounter("staying");
        EventCounter leaving = new EventCounter("leaving");
        stream.subscribe(staying);
        stream.subscribe(leaving);
        stream.catchup().get(5, TimeUnit.SECONDS);

        stream.unsubscribe(leaving);
        addNumbers("calc", 2);
        stream.push(null, true).get(5, TimeUnit.SECONDS);

        assertThat(staying.positions(), contains(0L, 1L, 2L, 3L));
        assertThat(leaving.positions(), contains(0L, 1L));
        assertThat(stream.getHandlers(), contains((EventHandler) staying));
    }

    @Test
    public void cursor_survives_new_stream_instance() throws CommandBusException {
        addNumbers("calc", 3);
        EventCounter first = new EventCounter("counter");
        stream(10).poll(Collections.singletonList(first), 2);

        EventCounter restarted = new EventCounter("counter");
        stream(10).poll(Collections.singletonList(restarted), 10);

        assertThat(first.positions(), contains(0L, 1L));
        assertThat(restarted.positions(), contains(2L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void handler_of_other_stream_is_rejected() {
        stream(10).subscribe(new EventCounter("audit") {
            @Override
            public String stream() {
                return "audit";
            }
        });
    }

    @Test(expected = IllegalArgumentException.class)
    public void handler_names_are_unique() {
        StoredEventStream stream = stream(10);
        stream.subscribe(new EventCounter("counter"));
        stream.subscribe(new EventCounter("counter"));
    }
}
