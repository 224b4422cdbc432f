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
import io.github.goodees.esbus.dispatch.Lane;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;

/**
 * Ordered sequence of committed events of one tenant and name, delivered to subscribed handlers. All delivery of
 * a stream, be it catch-up, live push or explicit poll, runs through a single {@link Lane}, therefore a handler never
 * sees two events of the stream at once, and always sees them in ascending position.
 *
 * <p>Blocking methods {@link #poll(Collection, int)} and {@link #flush()} must not be called from a handler of the
 * same stream.</p>
 */
public abstract class EventStream {
    private static final Logger logger = LoggerFactory.getLogger(EventStream.class);

    private final String tenant;
    private final String name;
    private final Tracer tracer;
    private final Lane lane;
    private final int batchSize;
    private final List<EventHandler> handlers = new CopyOnWriteArrayList<>();
    private final Map<String, HandlerFailure> failures = new ConcurrentHashMap<>();

    protected EventStream(String tenant, String name, Tracer tracer, Executor executor, int batchSize) {
        this.tenant = Objects.requireNonNull(tenant, "Tenant must be specified");
        this.name = Objects.requireNonNull(name, "Stream name must be specified");
        this.tracer = Objects.requireNonNull(tracer, "Tracer must be specified");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.batchSize = batchSize;
        this.lane = new Lane("stream." + tenant + "." + name, executor);
    }

    public String getTenant() {
        return tenant;
    }

    public String getName() {
        return name;
    }

    /**
     * Register a handler for live delivery. Its backlog is delivered by {@link #catchup()}.
     * @param handler the handler
     * @throws IllegalArgumentException if the handler consumes other stream, or a handler of the same name is
     *         subscribed already
     */
    public void subscribe(EventHandler handler) {
        if (!name.equals(handler.stream())) {
            throw new IllegalArgumentException("Handler " + handler.name() + " consumes stream " + handler.stream()
                    + ", not " + name);
        }
        for (EventHandler existing : handlers) {
            if (existing.name().equals(handler.name())) {
                throw new IllegalArgumentException("Handler " + handler.name() + " is already subscribed to "
                        + name);
            }
        }
        handlers.add(handler);
    }

    public void unsubscribe(EventHandler handler) {
        handlers.remove(handler);
        failures.remove(handler.name());
    }

    public List<EventHandler> getHandlers() {
        return Collections.unmodifiableList(handlers);
    }

    /**
     * Failures of handlers that did not recover yet.
     * @return handler name to its last failure
     */
    public Map<String, HandlerFailure> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    /**
     * Deliver the backlog of all subscribed handlers, in batches, until they are caught up or stop making progress.
     * @return future completing when catch-up is over, with false when every handler is caught up
     */
    public CompletableFuture<Boolean> catchup() {
        return lane.submit(() -> deliverAll(true));
    }

    /**
     * Offer newly committed event and deliver it to all subscribed handlers. Handlers that are behind receive their
     * backlog first.
     * @param event the event, or null when the stream should just be polled
     * @param load read from the log rather than from the events offered so far
     * @return future completing after delivery, with true when some handler is still behind
     */
    public CompletableFuture<Boolean> push(EventRecord event, boolean load) {
        if (event != null) {
            offer(event);
        }
        return lane.submit(() -> deliverAll(load));
    }

    /**
     * Deliver at most {@code limit} events to each of the handlers.
     * @param pollHandlers handlers to deliver to
     * @param limit maximum number of events
     * @return true when some of the handlers are still behind the stream
     * @throws CommandBusException when the log cannot be read
     */
    public boolean poll(Collection<EventHandler> pollHandlers, int limit) throws CommandBusException {
        List<EventHandler> copy = new ArrayList<>(pollHandlers);
        return await(lane.submit(() -> doPoll(copy, limit, true).isBehind()));
    }

    /**
     * Wait until all deliveries queued so far are done.
     * @throws CommandBusException when interrupted
     */
    public void flush() throws CommandBusException {
        await(lane.drain());
    }

    private boolean deliverAll(boolean load) throws CommandBusException {
        List<EventHandler> current = new ArrayList<>(handlers);
        Progress progress = doPoll(current, batchSize, load);
        while (progress.isBehind() && progress.getDelivered() > 0) {
            progress = doPoll(current, batchSize, load);
        }
        if (progress.isBehind()) {
            logger.debug("Stream {}/{} stopped delivery while behind, failing handlers: {}", tenant, name,
                failures.keySet());
        }
        return progress.isBehind();
    }

    private static <T> T await(Future<T> future) throws CommandBusException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CommandBusException.storeFailed("Waiting for stream", e);
        } catch (ExecutionException e) {
            throw CommandBusException.unwrap(e);
        }
    }

    /**
     * Invoke handler, recording a failure.
     * @return true if the handler succeeded
     */
    protected boolean dispatch(EventHandler handler, EventRecord event) {
        tracer.trace(() -> Tracer.record("handle", "tenant", tenant, "stream", name, "handler", handler.name(),
            "event", event));
        try {
            handler.handle(tenant, event);
            failures.remove(handler.name());
            return true;
        } catch (Exception e) {
            logger.warn("Handler {} failed on event {} of stream {}/{}", handler.name(), event.getStreamPosition(),
                tenant, name, e);
            failures.put(handler.name(), new HandlerFailure(handler.name(), event.getStreamPosition(), e));
            tracer.trace(() -> Tracer.record("handlerFailed", "tenant", tenant, "stream", name, "handler",
                handler.name(), "event", event, "error", e));
            return false;
        }
    }

    /**
     * Newly committed event, that might save a read of the log.
     * @param event the event
     */
    protected void offer(EventRecord event) {
    }

    /**
     * Deliver to each handler at most {@code limit} events past its cursor. Called one at a time.
     * @param pollHandlers handlers to deliver to
     * @param limit maximum number of events per handler
     * @param load whether events need to be read from the log
     * @return the progress made
     * @throws CommandBusException when the log cannot be read
     */
    protected abstract Progress doPoll(List<EventHandler> pollHandlers, int limit, boolean load)
            throws CommandBusException;

    /**
     * Outcome of single poll.
     */
    public static final class Progress {
        private final int delivered;
        private final boolean behind;

        public Progress(int delivered, boolean behind) {
            this.delivered = delivered;
            this.behind = behind;
        }

        public int getDelivered() {
            return delivered;
        }

        public boolean isBehind() {
            return behind;
        }
    }
}
