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

import io.github.goodees.esbus.CommandBusException;
import io.github.goodees.esbus.store.EventLog;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executor;

/**
 * Event stream reading from an {@link EventLog}, with handler cursors persisted in the same log. Events pushed after
 * commit are kept in a bounded window, so that handlers following the stream live do not need to read the log.
 *
 * <p>A handler only advances past an event it handled successfully, and only by one position at a time, so it never
 * skips an event. Cursors are written with compare-and-set. When another process moved the cursor meanwhile, the
 * delivery is not recorded and the events may reach the handler twice.</p>
 */
public class StoredEventStream extends EventStream {
    private static final Logger logger = LoggerFactory.getLogger(StoredEventStream.class);

    public static final int DEFAULT_WINDOW_SIZE = 100;

    private final EventLog log;
    private final int windowSize;
    private final NavigableMap<Long, EventRecord> window = new TreeMap<>();

    public StoredEventStream(String tenant, String name, EventLog log, Tracer tracer, Executor executor,
            int batchSize) {
        this(tenant, name, log, tracer, executor, batchSize, DEFAULT_WINDOW_SIZE);
    }

    public StoredEventStream(String tenant, String name, EventLog log, Tracer tracer, Executor executor,
            int batchSize, int windowSize) {
        super(tenant, name, tracer, executor, batchSize);
        this.log = Objects.requireNonNull(log, "Event log must be provided");
        this.windowSize = windowSize;
    }

    @Override
    protected void offer(EventRecord event) {
        if (windowSize < 1) {
            return;
        }
        synchronized (window) {
            window.put(event.getStreamPosition(), event);
            while (window.size() > windowSize) {
                window.pollFirstEntry();
            }
        }
    }

    /**
     * Contiguous run of events from the window.
     * @return the events, or null if the window does not hold the event right after {@code afterPosition}
     */
    private List<EventRecord> fromWindow(long afterPosition, int limit) {
        synchronized (window) {
            if (!window.containsKey(afterPosition + 1)) {
                return null;
            }
            List<EventRecord> result = new ArrayList<>();
            long expected = afterPosition + 1;
            for (EventRecord event : window.tailMap(afterPosition, false).values()) {
                if (event.getStreamPosition() != expected || result.size() >= limit) {
                    break;
                }
                result.add(event);
                expected++;
            }
            return result;
        }
    }

    @Override
    protected Progress doPoll(List<EventHandler> pollHandlers, int limit, boolean load)
            throws CommandBusException {
        if (pollHandlers.isEmpty()) {
            return new Progress(0, false);
        }
        Map<String, Long> cursors = log.readCursors(getTenant(), getName());
        long watermark = log.streamPosition(getTenant(), getName());
        Map<Long, List<EventRecord>> batches = new HashMap<>();

        int delivered = 0;
        boolean behind = false;
        for (EventHandler handler : pollHandlers) {
            long start = cursors.getOrDefault(handler.name(), -1L);
            if (start >= watermark) {
                continue;
            }
            long cursor = start;
            for (EventRecord event : batch(batches, start, limit, load)) {
                long position = event.getStreamPosition();
                if (position != cursor + 1 || !dispatch(handler, event)) {
                    break;
                }
                cursor = position;
                delivered++;
            }
            if (cursor != start && !log.commitCursor(getTenant(), getName(), handler.name(), start, cursor)) {
                logger.warn("Cursor of {} on stream {}/{} was moved concurrently, positions {} to {} may be "
                        + "delivered again", handler.name(), getTenant(), getName(), start + 1, cursor);
            }
            if (cursor < watermark) {
                behind = true;
            }
        }
        return new Progress(delivered, behind);
    }

    /**
     * Events following a cursor. Handlers at the same cursor share one read.
     */
    private List<EventRecord> batch(Map<Long, List<EventRecord>> batches, long after, int limit, boolean load)
            throws CommandBusException {
        List<EventRecord> events = batches.get(after);
        if (events == null) {
            events = load ? null : fromWindow(after, limit);
            if (events == null) {
                logger.debug("Reading stream {}/{} after {}", getTenant(), getName(), after);
                events = log.readStream(getTenant(), getName(), after, limit);
            }
            batches.put(after, events);
        }
        return events;
    }
}
