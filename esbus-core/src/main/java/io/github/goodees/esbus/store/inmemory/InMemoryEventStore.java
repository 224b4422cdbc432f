package io.github.goodees.esbus.store.inmemory;

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
import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.store.AbstractEventStore;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.trace.Tracer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Event store keeping everything in memory of the process. Commits are atomic, because they are fully prepared before
 * any structure is touched, and all structures are only accessed under single lock.
 */
public class InMemoryEventStore extends AbstractEventStore {
    private final Object lock = new Object();
    private final Map<String, StreamData> streams = new HashMap<>();
    private final Map<String, NavigableMap<String, EventRecord>> aggregates = new HashMap<>();
    private final Map<String, StoredSnapshot> snapshots = new HashMap<>();

    public InMemoryEventStore() {
        this(true, Tracer.NONE);
    }

    public InMemoryEventStore(boolean snapshots, Tracer tracer) {
        super(snapshots, tracer);
    }

    public InMemoryEventStore(boolean snapshots, Tracer tracer, Supplier<String> idGenerator, Executor executor) {
        super(snapshots, tracer, idGenerator, executor);
    }

    private static String streamKey(String tenant, String stream) {
        return "/tenants/" + tenant + "/streams/" + stream;
    }

    private static String aggregateKey(String tenant, String type, String aggregateId) {
        return tenant + "/" + type + "/" + aggregateId;
    }

    @Override
    protected StoredSnapshot readSnapshot(String tenant, AggregateType<?> type, String aggregateId) {
        synchronized (lock) {
            return snapshots.get(snapshotPath(tenant, type, aggregateId));
        }
    }

    @Override
    protected List<EventRecord> readEvents(String tenant, AggregateType<?> type, String aggregateId,
            String fromPaddedVersion) {
        synchronized (lock) {
            NavigableMap<String, EventRecord> events = aggregates.get(aggregateKey(tenant, type.getName(),
                aggregateId));
            if (events == null) {
                return Collections.emptyList();
            }
            return new ArrayList<>(events.tailMap(fromPaddedVersion, true).values());
        }
    }

    @Override
    protected List<EventRecord> commit(Commit commit) throws CommandBusException {
        synchronized (lock) {
            String aggregateKey = aggregateKey(commit.getTenant(), commit.getAggregateType(), commit.getAggregateId());
            NavigableMap<String, EventRecord> aggregateEvents = aggregates.get(aggregateKey);
            if (aggregateEvents != null && aggregateEvents.higherKey(commit.getPaddedExpectedVersion()) != null) {
                throw CommandBusException.concurrency(commit.getAggregateId(), commit.getExpectedVersion());
            }
            StreamData stream = stream(commit.getTenant(), commit.getStreamName());
            List<EventRecord> records = commit.toRecords(stream.position);

            if (aggregateEvents == null) {
                aggregateEvents = new TreeMap<>();
                aggregates.put(aggregateKey, aggregateEvents);
            }
            for (EventRecord record : records) {
                aggregateEvents.put(record.getPaddedAggregateVersion(), record);
                stream.events.put(record.getStreamPosition(), record);
            }
            stream.position += records.size();
            if (commit.getSnapshot() != null) {
                snapshots.put(commit.getSnapshotPath(), commit.getSnapshot());
            }
            return records;
        }
    }

    private StreamData stream(String tenant, String stream) {
        return streams.computeIfAbsent(streamKey(tenant, stream), k -> new StreamData());
    }

    @Override
    public long streamPosition(String tenant, String stream) {
        synchronized (lock) {
            StreamData data = streams.get(streamKey(tenant, stream));
            return data == null ? -1 : data.position;
        }
    }

    @Override
    public List<EventRecord> readStream(String tenant, String stream, long afterPosition, int limit) {
        synchronized (lock) {
            StreamData data = streams.get(streamKey(tenant, stream));
            if (data == null) {
                return Collections.emptyList();
            }
            List<EventRecord> result = new ArrayList<>();
            for (EventRecord record : data.events.tailMap(afterPosition, false).values()) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(record);
            }
            return result;
        }
    }

    @Override
    public Map<String, Long> readCursors(String tenant, String stream) {
        synchronized (lock) {
            StreamData data = streams.get(streamKey(tenant, stream));
            return data == null ? Collections.emptyMap() : new HashMap<>(data.cursors);
        }
    }

    @Override
    public boolean commitCursor(String tenant, String stream, String handler, long expected, long position) {
        synchronized (lock) {
            StreamData data = stream(tenant, stream);
            long current = data.cursors.getOrDefault(handler, -1L);
            if (current != expected || position < current) {
                return false;
            }
            data.cursors.put(handler, position);
            return true;
        }
    }

    static class StreamData {
        long position = -1;
        final NavigableMap<Long, EventRecord> events = new TreeMap<>();
        final Map<String, Long> cursors = new HashMap<>();
    }
}
