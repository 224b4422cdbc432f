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

import io.github.goodees.esbus.stream.StoredEventStream;
import io.github.goodees.esbus.trace.Tracer;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bus configuration with fixed values, created by a builder. Unless specified, the cache holds 10 aggregates,
 * nothing is traced, streams deliver in batches of 10 events in a shared pool of daemon threads.
 */
public class SimpleBusConfiguration implements BusConfiguration {
    public static final int DEFAULT_CACHE_SIZE = 10;
    public static final int DEFAULT_POLL_LIMIT = 10;

    private static final ExecutorService STREAM_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "esbus-streams");
        t.setDaemon(true);
        return t;
    });

    private final int cacheSize;
    private final Tracer tracer;
    private final Executor streamExecutor;
    private final int pollLimit;
    private final int windowSize;

    private SimpleBusConfiguration(Builder builder) {
        this.cacheSize = builder.cacheSize;
        this.tracer = builder.tracer;
        this.streamExecutor = builder.streamExecutor;
        this.pollLimit = builder.pollLimit;
        this.windowSize = builder.windowSize;
    }

    public static BusConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int cacheSize() {
        return cacheSize;
    }

    @Override
    public Tracer tracer() {
        return tracer;
    }

    @Override
    public Executor streamExecutor() {
        return streamExecutor;
    }

    @Override
    public int pollLimit() {
        return pollLimit;
    }

    @Override
    public int windowSize() {
        return windowSize;
    }

    public static class Builder {
        private int cacheSize = DEFAULT_CACHE_SIZE;
        private Tracer tracer = Tracer.NONE;
        private Executor streamExecutor = STREAM_EXECUTOR;
        private int pollLimit = DEFAULT_POLL_LIMIT;
        private int windowSize = StoredEventStream.DEFAULT_WINDOW_SIZE;

        public Builder cacheSize(int cacheSize) {
            if (cacheSize < 0) {
                throw new IllegalArgumentException("Cache size must not be negative");
            }
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "Tracer must be specified, use Tracer.NONE for no tracing");
            return this;
        }

        public Builder streamExecutor(Executor streamExecutor) {
            this.streamExecutor = Objects.requireNonNull(streamExecutor, "Executor must be specified");
            return this;
        }

        public Builder pollLimit(int pollLimit) {
            if (pollLimit < 1) {
                throw new IllegalArgumentException("Poll limit must be positive");
            }
            this.pollLimit = pollLimit;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public SimpleBusConfiguration build() {
            return new SimpleBusConfiguration(this);
        }
    }
}
