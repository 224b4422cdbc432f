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

import java.util.List;

/**
 * Durable storage of aggregates. Aggregates are loaded by replaying their events, optionally starting from a snapshot,
 * and their new events are committed atomically under optimistic concurrency.
 */
public interface EventStore {
    /**
     * Load an aggregate with all of its committed events applied.
     * @param tenant tenant the aggregate belongs to
     * @param type type of the aggregate
     * @param aggregateId id of the aggregate. When null or empty, a new aggregate with generated id is returned
     * @param <S> type of the aggregate's state
     * @return aggregate reflecting the durable state
     * @throws CommandBusException when the store cannot be read
     */
    <S> Aggregate<S> loadAggregate(String tenant, AggregateType<S> type, String aggregateId)
            throws CommandBusException;

    /**
     * Commit the uncommitted events of an aggregate. All the events, the new stream position, and the snapshot land
     * together or not at all. On success the aggregate's version is advanced and its buffer emptied.
     *
     * @param actor actor issuing the command, recorded as committer
     * @param command name of the command that produced the events
     * @param aggregate the aggregate
     * @param expectedVersion version the events were produced against
     * @return committed records in stream order
     * @throws CommandBusException with {@code CONCURRENCY} fault when another commit advanced the aggregate past
     *         expected version, {@code PRECONDITION} when the aggregate is not at expected version or would exceed
     *         its maximum number of events, {@code TX_ERROR} when the store fails
     */
    List<EventRecord> commitEvents(Actor actor, String command, Aggregate<?> aggregate, long expectedVersion)
            throws CommandBusException;
}
