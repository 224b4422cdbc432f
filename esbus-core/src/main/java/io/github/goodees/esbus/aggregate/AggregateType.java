package io.github.goodees.esbus.aggregate;

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
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.JacksonSerialization;
import io.github.goodees.esbus.store.Serialization;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable descriptor of an aggregate class, registered with the bus once. Besides the name it fixes the stream the
 * aggregate's events go to, the storage path of its snapshots, and the maximum number of events an instance may ever
 * accumulate. {@code maxEvents} determines the width of the padded version strings in the store, therefore it must
 * not change after the first event is written.
 *
 * <p>The type is also the only party allowed to create instances and to move them through their lifecycle, event
 * stores use it for restoring snapshots, replaying events and marking commits.</p>
 *
 * @param <S> type of the aggregate state
 */
public final class AggregateType<S> {
    public static final String DEFAULT_STREAM = "main";
    public static final long DEFAULT_MAX_EVENTS = 1_000_000;

    private final String name;
    private final String streamName;
    private final String storagePath;
    private final long maxEvents;
    private final Supplier<? extends Aggregate<S>> factory;
    private final Serialization<S> serialization;
    private volatile Set<String> commands;

    private AggregateType(Builder<S> builder) {
        this.name = builder.name;
        this.streamName = builder.streamName;
        this.storagePath = builder.storagePath != null ? builder.storagePath : "/" + builder.name;
        this.maxEvents = builder.maxEvents;
        this.factory = builder.factory;
        this.serialization = builder.serialization;
    }

    /**
     * Start describing an aggregate type.
     * @param name unique name of the type
     * @param stateClass class of the state, serialized with Jackson unless specified otherwise
     * @param factory creates blank instances
     * @param <S> type of the state
     * @return a builder
     */
    public static <S> Builder<S> builder(String name, Class<S> stateClass, Supplier<? extends Aggregate<S>> factory) {
        return new Builder<>(name, JacksonSerialization.of(stateClass), factory);
    }

    public String getName() {
        return name;
    }

    public String getStreamName() {
        return streamName;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public long getMaxEvents() {
        return maxEvents;
    }

    public Serialization<S> getSerialization() {
        return serialization;
    }

    /**
     * Names of the commands this type handles, read from a prototype instance on first access.
     * @return command names
     * @throws CommandBusException with {@code PRECONDITION} fault when the factory does not provide a proper
     *         aggregate
     */
    public Set<String> commands() throws CommandBusException {
        Set<String> result = commands;
        if (result == null) {
            Aggregate<S> prototype = factory.get();
            if (prototype == null) {
                throw CommandBusException.precondition(name + " factory did not create an aggregate");
            }
            CommandHandlers handlers = prototype.commands();
            if (handlers == null || handlers.names().isEmpty()) {
                throw CommandBusException.precondition(name + " does not expose any commands");
            }
            result = Collections.unmodifiableSet(new LinkedHashSet<>(handlers.names()));
            commands = result;
        }
        return result;
    }

    /**
     * Create blank instance with version {@code -1}.
     * @param aggregateId identity of the instance
     * @return new aggregate
     */
    public Aggregate<S> newInstance(String aggregateId) {
        Aggregate<S> aggregate = Objects.requireNonNull(factory.get(), "Factory of " + name + " returned null");
        aggregate.bind(this, Objects.requireNonNull(aggregateId, "Aggregate id must be provided"));
        return aggregate;
    }

    /**
     * Recreate an instance from a stored snapshot.
     * @param aggregateId identity of the instance
     * @param version version the snapshot was taken at
     * @param payloadVersion version of the snapshot's serialized form
     * @param payload serialized state
     * @return aggregate in snapshotted state, or null if the payload version is not understood
     * @throws IllegalArgumentException when the payload cannot be deserialized
     */
    public Aggregate<S> restore(String aggregateId, long version, int payloadVersion, String payload) {
        S state = serialization.deserialize(payloadVersion, payload, name);
        if (state == null) {
            return null;
        }
        Aggregate<S> aggregate = newInstance(aggregateId);
        aggregate.restore(version, state);
        return aggregate;
    }

    /**
     * Serialize the state of an instance.
     * @param aggregate the instance
     * @return serialized state
     */
    public String snapshot(Aggregate<S> aggregate) {
        return serialization.serialize(aggregate.getState());
    }

    public int snapshotPayloadVersion(Aggregate<S> aggregate) {
        return serialization.payloadVersion(aggregate.getState());
    }

    /**
     * Apply persisted event to an instance being loaded.
     * @param aggregate the instance
     * @param event event read from the store
     */
    public void replay(Aggregate<S> aggregate, EventRecord event) {
        aggregate.loadEvent(event);
    }

    /**
     * Mark the buffered events of an instance committed.
     * @param aggregate the instance
     * @param version version after the commit
     */
    public void committed(Aggregate<S> aggregate, long version) {
        aggregate.committed(version);
    }

    Aggregate<S> copy(Aggregate<S> source) {
        int payloadVersion = serialization.payloadVersion(source.getState());
        S state = serialization.deserialize(payloadVersion, serialization.serialize(source.getState()), name);
        Aggregate<S> copy = newInstance(source.getAggregateId());
        copy.restore(source.getAggregateVersion(), state);
        copy.copyUncommitted(source);
        return copy;
    }

    @Override
    public String toString() {
        return "AggregateType{" + "name=" + name + ", stream=" + streamName + ", path=" + storagePath
                + ", maxEvents=" + maxEvents + '}';
    }

    public static class Builder<S> {
        private final String name;
        private final Supplier<? extends Aggregate<S>> factory;
        private Serialization<S> serialization;
        private String streamName = DEFAULT_STREAM;
        private String storagePath;
        private long maxEvents = DEFAULT_MAX_EVENTS;

        Builder(String name, Serialization<S> serialization, Supplier<? extends Aggregate<S>> factory) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
            this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
            this.factory = Objects.requireNonNull(factory, "Factory must be specified");
        }

        public Builder<S> stream(String streamName) {
            this.streamName = Objects.requireNonNull(streamName, "Stream name must be specified");
            return this;
        }

        public Builder<S> storagePath(String storagePath) {
            this.storagePath = Objects.requireNonNull(storagePath, "Storage path must be specified");
            return this;
        }

        public Builder<S> maxEvents(long maxEvents) {
            this.maxEvents = maxEvents;
            return this;
        }

        public Builder<S> serialization(Serialization<S> serialization) {
            this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
            return this;
        }

        public AggregateType<S> build() {
            return new AggregateType<>(this);
        }
    }
}
