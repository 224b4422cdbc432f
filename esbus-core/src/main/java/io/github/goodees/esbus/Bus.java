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
import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.aggregate.CommandHandlers;
import io.github.goodees.esbus.store.EventLog;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.EventStore;
import io.github.goodees.esbus.stream.EventHandler;
import io.github.goodees.esbus.stream.EventStream;
import io.github.goodees.esbus.stream.StoredEventStream;
import io.github.goodees.esbus.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point for commands. A command is routed to the aggregate type declaring it, the aggregate is taken from the
 * cache or loaded from the event store, the command handler runs against it, and the events it produced are committed,
 * cached and pushed to the subscribed stream of the actor's tenant.
 *
 * <p>Commands are executed in the caller's thread. Concurrency conflicts are reported, never retried: only the caller
 * knows whether the command still makes sense against the newer state.</p>
 */
public class Bus {
    private static final Logger logger = LoggerFactory.getLogger(Bus.class);

    /**
     * Expected version meaning "whatever version the aggregate is at".
     */
    public static final long UNSPECIFIED_VERSION = -1;

    private final EventStore store;
    private final CommandMapper mapper;
    private final AggregateCache cache;
    private final BusConfiguration configuration;
    private final Tracer tracer;
    private final ConcurrentMap<String, EventStream> streams = new ConcurrentHashMap<>();

    public Bus(EventStore store, Collection<? extends AggregateType<?>> types) throws CommandBusException {
        this(store, types, SimpleBusConfiguration.defaults());
    }

    public Bus(EventStore store, Collection<? extends AggregateType<?>> types, BusConfiguration configuration)
            throws CommandBusException {
        if (store == null) {
            throw CommandBusException.invalidArguments("event store must be provided");
        }
        if (configuration == null || configuration.tracer() == null) {
            throw CommandBusException.invalidArguments("configuration with a tracer must be provided");
        }
        this.store = store;
        this.configuration = configuration;
        this.tracer = configuration.tracer();
        this.mapper = new CommandMapper(types);
        this.cache = new AggregateCache(configuration.cacheSize());
    }

    public EventStore getStore() {
        return store;
    }

    AggregateCache getCache() {
        return cache;
    }

    /**
     * Execute a command against a new aggregate.
     * @see #command(Actor, String, String, long, Map)
     */
    public Aggregate<?> command(Actor actor, String command, Map<String, Object> payload)
            throws CommandBusException {
        return command(actor, command, null, UNSPECIFIED_VERSION, payload);
    }

    /**
     * Execute a command against the latest version of an aggregate.
     * @see #command(Actor, String, String, long, Map)
     */
    public Aggregate<?> command(Actor actor, String command, String aggregateId, Map<String, Object> payload)
            throws CommandBusException {
        return command(actor, command, aggregateId, UNSPECIFIED_VERSION, payload);
    }

    /**
     * Execute a command.
     * @param actor who issues the command
     * @param command name of the command
     * @param aggregateId target aggregate, null or empty for a new one
     * @param expectedVersion version the caller believes the aggregate is at, or {@link #UNSPECIFIED_VERSION}
     * @param payload command data
     * @return the aggregate after the command
     * @throws CommandBusException with {@code MISSING_ARGUMENTS} or {@code INVALID_ARGUMENTS} fault for malformed
     *         invocation, {@code CONCURRENCY} when the aggregate is not at expected version or was changed meanwhile,
     *         {@code PRECONDITION} when the aggregate would exceed its maximum of events, or anything the command
     *         handler throws
     */
    public Aggregate<?> command(Actor actor, String command, String aggregateId, long expectedVersion,
            Map<String, Object> payload) throws CommandBusException {
        validate(actor, command, aggregateId, expectedVersion);
        AggregateType<?> type = mapper.map(command);
        Map<String, Object> arguments = payload == null ? Collections.emptyMap() : payload;
        tracer.trace(() -> Tracer.record("command", "actor", actor, "command", command, "aggregateId", aggregateId,
            "expectedVersion", expectedVersion, "payload", arguments));
        return execute(actor, command, type, aggregateId, expectedVersion, arguments);
    }

    private static void validate(Actor actor, String command, String aggregateId, long expectedVersion)
            throws CommandBusException {
        if (actor == null) {
            throw CommandBusException.missingArguments("actor");
        }
        if (isEmpty(actor.id()) || isEmpty(actor.name()) || isEmpty(actor.tenant())) {
            throw CommandBusException.missingArguments("actor id, name and tenant");
        }
        if (isEmpty(command)) {
            throw CommandBusException.missingArguments("command");
        }
        if (expectedVersion < UNSPECIFIED_VERSION) {
            throw CommandBusException.invalidArguments("expected version " + expectedVersion);
        }
        if (expectedVersion >= 0 && isEmpty(aggregateId)) {
            throw CommandBusException.missingArguments("aggregateId is required when expectedVersion is given");
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    private <S> Aggregate<S> execute(Actor actor, String command, AggregateType<S> type, String aggregateId,
            long expectedVersion, Map<String, Object> payload) throws CommandBusException {
        Aggregate<S> aggregate = null;
        if (!isEmpty(aggregateId) && expectedVersion >= 0) {
            aggregate = cache.get(type, aggregateId);
            if (aggregate != null && aggregate.getAggregateVersion() != expectedVersion) {
                logger.debug("Cached {} {} is at version {}, expected {}", type.getName(), aggregateId,
                    aggregate.getAggregateVersion(), expectedVersion);
                aggregate = null;
            }
        }
        if (aggregate == null) {
            aggregate = store.loadAggregate(actor.tenant(), type, aggregateId);
            Aggregate<S> loaded = aggregate;
            tracer.trace(() -> Tracer.record("loadAggregate", "aggregate", loaded, "aggregateType", type.getName()));
        }

        CommandHandlers.Handler handler = aggregate.commands().handler(command);
        if (handler == null) {
            throw CommandBusException.invalidArguments("command " + command + " not handled by " + type.getName());
        }
        handler.handle(actor, payload, this);
        if (aggregate.getUncommittedEvents().isEmpty()) {
            return aggregate;
        }

        long version = expectedVersion;
        if (version == UNSPECIFIED_VERSION) {
            version = aggregate.getAggregateVersion();
        } else if (version != aggregate.getAggregateVersion()) {
            throw CommandBusException.concurrency(aggregate.getAggregateId(), version,
                aggregate.getAggregateVersion());
        }
        List<EventRecord> events = store.commitEvents(actor, command, aggregate, version);
        Aggregate<S> committed = aggregate;
        tracer.trace(() -> Tracer.record("commitEvents", "events", events, "actor", actor, "command", command,
            "aggregate", committed, "aggregateType", type.getName()));
        cache.put(aggregate);
        publish(actor.tenant(), type.getStreamName(), events);
        return aggregate;
    }

    private void publish(String tenant, String streamName, List<EventRecord> events) {
        EventStream stream = streams.get(streamKey(tenant, streamName));
        if (stream == null) {
            return;
        }
        for (EventRecord event : events) {
            stream.push(event, false);
        }
    }

    private static String streamKey(String tenant, String name) {
        return tenant + "/" + name;
    }

    /**
     * Register streams, subscribe the handlers consuming them, and start their catch-up.
     * @param eventStreams the streams
     * @param handlers handlers, each is subscribed to every given stream of the name it consumes
     * @return future completing when catch-up of all the streams is over
     */
    public CompletableFuture<Void> subscribe(Collection<? extends EventStream> eventStreams,
            Collection<? extends EventHandler> handlers) {
        List<CompletableFuture<Boolean>> catchups = new ArrayList<>();
        for (EventStream stream : eventStreams) {
            EventStream registered = register(stream);
            for (EventHandler handler : handlers) {
                if (handler.stream().equals(registered.getName())) {
                    registered.subscribe(handler);
                }
            }
            catchups.add(registered.catchup());
        }
        return CompletableFuture.allOf(catchups.toArray(new CompletableFuture<?>[0]));
    }

    private EventStream register(EventStream stream) {
        EventStream existing = streams.putIfAbsent(streamKey(stream.getTenant(), stream.getName()), stream);
        if (existing != null && existing != stream) {
            throw new IllegalArgumentException("Stream " + stream.getName() + " of tenant " + stream.getTenant()
                    + " is already registered");
        }
        return stream;
    }

    /**
     * Registered stream, or a new one reading from the event store, which must also be an {@link EventLog}.
     * @param tenant the tenant
     * @param name name of the stream
     * @return the stream
     * @throws CommandBusException with {@code INVALID_ARGUMENTS} fault when the store cannot be read as a log
     */
    public EventStream openStream(String tenant, String name) throws CommandBusException {
        EventStream existing = streams.get(streamKey(tenant, name));
        if (existing != null) {
            return existing;
        }
        if (!(store instanceof EventLog)) {
            throw CommandBusException.invalidArguments("store " + store.getClass().getName()
                    + " is not an event log");
        }
        EventStream created = new StoredEventStream(tenant, name, (EventLog) store, tracer,
                configuration.streamExecutor(), configuration.pollLimit(), configuration.windowSize());
        existing = streams.putIfAbsent(streamKey(tenant, name), created);
        return existing != null ? existing : created;
    }

    /**
     * Registered stream.
     * @param tenant the tenant
     * @param name name of the stream
     * @return the stream or null
     */
    public EventStream stream(String tenant, String name) {
        return streams.get(streamKey(tenant, name));
    }

    /**
     * Push an event to a registered stream.
     * @param tenant the tenant
     * @param name name of the stream
     * @param event the event, may be null
     * @param load whether to read from the log
     * @return future completing after delivery with true if some handler is still behind. Completes with false
     *         right away for a stream that is not registered
     */
    public CompletableFuture<Boolean> push(String tenant, String name, EventRecord event, boolean load) {
        EventStream stream = stream(tenant, name);
        if (stream == null) {
            return CompletableFuture.completedFuture(false);
        }
        return stream.push(event, load);
    }

    /**
     * Deliver the events of a registered stream that its handlers have not seen yet.
     * @param tenant the tenant
     * @param name name of the stream
     * @return see {@link #push(String, String, EventRecord, boolean)}
     */
    public CompletableFuture<Boolean> poll(String tenant, String name) {
        return push(tenant, name, null, true);
    }

    /**
     * Deliver at most {@code limit} events of a registered stream to given handlers.
     * @return true if some of the handlers are still behind
     * @throws CommandBusException with {@code INVALID_ARGUMENTS} when the stream is not registered
     */
    public boolean poll(String tenant, String name, Collection<EventHandler> handlers, int limit)
            throws CommandBusException {
        EventStream stream = stream(tenant, name);
        if (stream == null) {
            throw CommandBusException.invalidArguments("stream " + name + " of tenant " + tenant
                    + " is not registered");
        }
        return stream.poll(handlers, limit);
    }

    /**
     * Wait until all the deliveries queued so far in streams of a tenant are done.
     * @param tenant the tenant
     * @throws CommandBusException when waiting fails
     */
    public void flush(String tenant) throws CommandBusException {
        for (EventStream stream : streams.values()) {
            if (stream.getTenant().equals(tenant)) {
                stream.flush();
            }
        }
    }
}
