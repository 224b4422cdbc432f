package io.github.goodees.esbus.store;

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
import io.github.goodees.esbus.aggregate.Actor;
import io.github.goodees.esbus.aggregate.Aggregate;
import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.dispatch.Lane;
import io.github.goodees.esbus.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Common part of event stores. Handles aggregate lifecycle, preconditions of commits and serializes commits of the
 * process through a single {@link Lane}. Subclasses only provide the storage primitives:
 * <ul>
 *     <li>{@link #readSnapshot(String, AggregateType, String)}</li>
 *     <li>{@link #readEvents(String, AggregateType, String, String)}</li>
 *     <li>{@link #commit(Commit)}, which must be atomic</li>
 * </ul>
 */
public abstract class AbstractEventStore implements EventStore, EventLog {
    private static final Logger logger = LoggerFactory.getLogger(AbstractEventStore.class);

    private static final ExecutorService COMMIT_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "esbus-commits");
        t.setDaemon(true);
        return t;
    });

    public static final Supplier<String> UUID_GENERATOR = () -> UUID.randomUUID().toString();

    private final boolean snapshots;
    private final Tracer tracer;
    private final Supplier<String> idGenerator;
    private final Lane commits;

    protected AbstractEventStore(boolean snapshots, Tracer tracer) {
        this(snapshots, tracer, UUID_GENERATOR, COMMIT_EXECUTOR);
    }

    protected AbstractEventStore(boolean snapshots, Tracer tracer, Supplier<String> idGenerator,
            Executor commitExecutor) {
        this.snapshots = snapshots;
        this.tracer = Objects.requireNonNull(tracer, "Tracer must be provided, use Tracer.NONE for no tracing");
        this.idGenerator = Objects.requireNonNull(idGenerator, "Id generator must be provided");
        this.commits = new Lane("commits", commitExecutor);
    }

    /**
     * Path of the snapshot document of an aggregate.
     * @param tenant the tenant
     * @param type type of the aggregate
     * @param aggregateId id of the aggregate
     * @return path in form {@code /tenants/{tenant}{storagePath}/{aggregateId}}
     */
    public static String snapshotPath(String tenant, AggregateType<?> type, String aggregateId) {
        return "/tenants/" + tenant + type.getStoragePath() + "/" + aggregateId;
    }

    @Override
    public <S> Aggregate<S> loadAggregate(String tenant, AggregateType<S> type, String aggregateId)
            throws CommandBusException {
        if (type == null) {
            throw CommandBusException.missingArguments("aggregate type");
        }
        if (aggregateId == null || aggregateId.isEmpty()) {
            return type.newInstance(idGenerator.get());
        }
        VersionPadder padder = VersionPadder.forMaxEvents(type.getMaxEvents());
        Aggregate<S> aggregate = null;
        if (snapshots) {
            StoredSnapshot snapshot = readSnapshot(tenant, type, aggregateId);
            if (snapshot != null) {
                aggregate = restore(type, aggregateId, snapshot);
            }
        }
        if (aggregate == null) {
            aggregate = type.newInstance(aggregateId);
        }
        List<EventRecord> events = readEvents(tenant, type, aggregateId,
            padder.pad(aggregate.getAggregateVersion() + 1));
        for (EventRecord event : events) {
            tracer.trace(() -> Tracer.record("loadEvent", "aggregateType", type.getName(), "event", event));
            type.replay(aggregate, event);
        }
        return aggregate;
    }

    private static <S> Aggregate<S> restore(AggregateType<S> type, String aggregateId, StoredSnapshot snapshot) {
        try {
            Aggregate<S> aggregate = type.restore(aggregateId, snapshot.getVersion(), snapshot.getPayloadVersion(),
                snapshot.getPayload());
            if (aggregate == null) {
                logger.warn("Snapshot of {} {} is not understood, replaying all events", type.getName(),
                    aggregateId);
            }
            return aggregate;
        } catch (RuntimeException e) {
            logger.warn("Snapshot of {} {} could not be read, replaying all events", type.getName(), aggregateId, e);
            return null;
        }
    }

    @Override
    public List<EventRecord> commitEvents(Actor actor, String command, Aggregate<?> aggregate, long expectedVersion)
            throws CommandBusException {
        if (actor == null) {
            throw CommandBusException.missingArguments("actor");
        }
        if (aggregate == null) {
            throw CommandBusException.missingArguments("aggregate");
        }
        if (aggregate.getAggregateVersion() != expectedVersion) {
            throw CommandBusException.precondition("aggregate " + aggregate.getAggregateId() + " is at version "
                    + aggregate.getAggregateVersion() + ", cannot commit against version " + expectedVersion);
        }
        AggregateType<?> type = aggregate.getType();
        int count = aggregate.getUncommittedEvents().size();
        if (expectedVersion + count >= type.getMaxEvents() - 1) {
            throw CommandBusException.precondition("max events reached for " + type.getName() + " "
                    + aggregate.getAggregateId());
        }
        if (count == 0) {
            return Collections.emptyList();
        }
        Commit commit = new Commit(actor, command, aggregate, expectedVersion,
            VersionPadder.forMaxEvents(type.getMaxEvents()), snapshots);
        List<EventRecord> records = await(commits.submit(() -> commit(commit)));
        markCommitted(aggregate, commit.getFinalVersion());
        return records;
    }

    private static <S> void markCommitted(Aggregate<S> aggregate, long version) {
        aggregate.getType().committed(aggregate, version);
    }

    private static <T> T await(Future<T> future) throws CommandBusException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CommandBusException.storeFailed("Waiting for commit", e);
        } catch (ExecutionException e) {
            throw CommandBusException.unwrap(e);
        }
    }

    /**
     * Read the snapshot of an aggregate.
     * @param tenant the tenant
     * @param type type of the aggregate
     * @param aggregateId id of the aggregate
     * @return the snapshot or null if there is none
     * @throws CommandBusException when the store cannot be read
     */
    protected abstract StoredSnapshot readSnapshot(String tenant, AggregateType<?> type, String aggregateId)
            throws CommandBusException;

    /**
     * Read events of an aggregate starting at given version.
     * @param tenant the tenant
     * @param type type of the aggregate
     * @param aggregateId id of the aggregate
     * @param fromPaddedVersion inclusive lower bound of padded aggregate version
     * @return events in ascending version order
     * @throws CommandBusException when the store cannot be read
     */
    protected abstract List<EventRecord> readEvents(String tenant, AggregateType<?> type, String aggregateId,
            String fromPaddedVersion) throws CommandBusException;

    /**
     * Atomically write a commit. Implementations read the stream position, fail with {@code CONCURRENCY} fault
     * when an event of the aggregate newer than {@link Commit#getPaddedExpectedVersion()} exists, and then write the
     * events, the new stream position and the snapshot. Called one at a time.
     * @param commit the commit
     * @return the committed records
     * @throws CommandBusException when the commit fails. Nothing may be written in such case
     */
    protected abstract List<EventRecord> commit(Commit commit) throws CommandBusException;

    /**
     * Snapshot as read from the store.
     */
    public static final class StoredSnapshot {
        private final long version;
        private final int payloadVersion;
        private final String payload;

        public StoredSnapshot(long version, int payloadVersion, String payload) {
            this.version = version;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }

        public long getVersion() {
            return version;
        }

        public int getPayloadVersion() {
            return payloadVersion;
        }

        public String getPayload() {
            return payload;
        }
    }

    /**
     * Everything a store needs to write a commit, captured before the commit is queued.
     */
    public static final class Commit {
        private final String tenant;
        private final String streamName;
        private final String aggregateType;
        private final String aggregateId;
        private final String snapshotPath;
        private final String committerId;
        private final String command;
        private final long expectedVersion;
        private final VersionPadder padder;
        private final List<Map<String, Object>> events;
        private final StoredSnapshot snapshot;

        <S> Commit(Actor actor, String command, Aggregate<S> aggregate, long expectedVersion, VersionPadder padder,
                boolean snapshots) {
            AggregateType<S> type = aggregate.getType();
            this.tenant = actor.tenant();
            this.streamName = type.getStreamName();
            this.aggregateType = type.getName();
            this.aggregateId = aggregate.getAggregateId();
            this.snapshotPath = snapshotPath(tenant, type, aggregateId);
            this.committerId = actor.id();
            this.command = command;
            this.expectedVersion = expectedVersion;
            this.padder = padder;
            this.events = new ArrayList<>(aggregate.getUncommittedEvents());
            this.snapshot = snapshots
                    ? new StoredSnapshot(getFinalVersion(), type.snapshotPayloadVersion(aggregate),
                        type.snapshot(aggregate))
                    : null;
        }

        public String getTenant() {
            return tenant;
        }

        public String getStreamName() {
            return streamName;
        }

        public String getAggregateType() {
            return aggregateType;
        }

        public String getAggregateId() {
            return aggregateId;
        }

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public long getExpectedVersion() {
            return expectedVersion;
        }

        /**
         * Every event of the aggregate whose padded version is greater than this one is a conflict.
         * @return padded expected version, or a bound below all versions for a new aggregate
         */
        public String getPaddedExpectedVersion() {
            return padder.after(expectedVersion);
        }

        public long getFinalVersion() {
            return expectedVersion + events.size();
        }

        public int size() {
            return events.size();
        }

        /**
         * Snapshot of the aggregate after the commit.
         * @return the snapshot or null when snapshots are disabled
         */
        public StoredSnapshot getSnapshot() {
            return snapshot;
        }

        /**
         * Assign versions and stream positions to the events.
         * @param streamPosition current position of the stream, -1 for an empty one
         * @return records to write
         */
        public List<EventRecord> toRecords(long streamPosition) {
            List<EventRecord> records = new ArrayList<>(events.size());
            for (int i = 0; i < events.size(); i++) {
                records.add(new EventRecord(committerId, command, aggregateType, aggregateId,
                        padder.pad(expectedVersion + 1 + i), streamPosition + 1 + i, events.get(i)));
            }
            return records;
        }
    }
}
