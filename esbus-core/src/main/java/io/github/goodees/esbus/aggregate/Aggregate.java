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

import io.github.goodees.esbus.store.EventRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.lang.Math.max;

/**
 * A unit of consistency whose state is derived by replaying its events. Every aggregate class is described by an
 * {@link AggregateType}, which creates its instances, and keeps its state in a separate, serializable object of type
 * {@code S}, so that instances can be snapshotted and cloned by serialization.
 *
 * <p>The state <strong>only</strong> changes in {@link #applyEvent(Map)}. Command handlers declared in
 * {@link #commandHandlers()} validate the command against the state and call {@link #addEvent(String, Map)}, which
 * buffers the event for commit and applies it right away, so the handler and its caller see the resulting state.</p>
 *
 * <p>An instance belongs to the call stack of a single command until it is committed. Version starts at {@code -1}
 * and grows by exactly one per committed event.</p>
 *
 * @param <S> type of the state
 */
public abstract class Aggregate<S> {
    /**
     * Payload key carrying the name of an event.
     */
    public static final String EVENT_NAME = "_e";

    private AggregateType<S> type;
    private String aggregateId;
    private long aggregateVersion = -1;
    private S state;
    private final List<Map<String, Object>> uncommittedEvents = new ArrayList<>();
    private final List<Map<String, Object>> readOnlyUncommitted = Collections.unmodifiableList(uncommittedEvents);
    private CommandHandlers handlers;

    /**
     * Constructor for subclasses.
     * @param initialState state of an aggregate that has no events yet
     */
    protected Aggregate(S initialState) {
        this.state = Objects.requireNonNull(initialState, "Initial state must be provided");
    }

    /**
     * Declare the commands of this aggregate. Called once per instance.
     * @return the command table
     */
    protected abstract CommandHandlers commandHandlers();

    /**
     * Update the state with an event. Called for new events as they are added, and for persisted events during
     * replay. This method must be robust, throwing from it makes the aggregate impossible to load.
     * @param event event payload including {@link #EVENT_NAME}
     */
    protected abstract void applyEvent(Map<String, Object> event);

    /**
     * Record new event. The event is applied to the state immediately and committed after the command finishes.
     * @param name name of the event
     * @param payload event data
     */
    protected final void addEvent(String name, Map<String, Object> payload) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(EVENT_NAME, Objects.requireNonNull(name, "Event name must be provided"));
        event.putAll(payload);
        Map<String, Object> frozen = Collections.unmodifiableMap(event);
        uncommittedEvents.add(frozen);
        applyEvent(frozen);
    }

    public final AggregateType<S> getType() {
        return type;
    }

    public final String getAggregateId() {
        return aggregateId;
    }

    public final long getAggregateVersion() {
        return aggregateVersion;
    }

    public final S getState() {
        return state;
    }

    /**
     * Events added during current command, in order.
     * @return read only view of the buffer
     */
    public final List<Map<String, Object>> getUncommittedEvents() {
        return readOnlyUncommitted;
    }

    /**
     * The command table, created on first access.
     * @return command handlers of this instance
     */
    public final CommandHandlers commands() {
        if (handlers == null) {
            handlers = commandHandlers();
        }
        return handlers;
    }

    /**
     * Deep copy by serializing the state. The copy shares no mutable structure with this instance.
     * @return independent clone
     */
    public final Aggregate<S> copy() {
        return type.copy(this);
    }

    final void bind(AggregateType<S> type, String aggregateId) {
        this.type = type;
        this.aggregateId = aggregateId;
    }

    final void restore(long version, S restoredState) {
        this.aggregateVersion = version;
        this.state = restoredState;
    }

    final void loadEvent(EventRecord event) {
        applyEvent(event.getPayload());
        aggregateVersion = max(event.getAggregateVersion(), aggregateVersion + 1);
    }

    final void committed(long version) {
        this.aggregateVersion = version;
        this.uncommittedEvents.clear();
    }

    final void copyUncommitted(Aggregate<S> source) {
        this.uncommittedEvents.addAll(source.uncommittedEvents);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + aggregateId + ", version=" + aggregateVersion + ", state="
                + state + ", uncommitted=" + uncommittedEvents.size() + '}';
    }
}
