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

import io.github.goodees.esbus.trace.Tracer;

import java.util.concurrent.Executor;

/**
 * Settings of a {@link Bus}.
 */
public interface BusConfiguration {

    /**
     * Number of aggregates kept in the cache, zero disables caching.
     */
    int cacheSize();

    Tracer tracer();

    /**
     * Executor streams opened by the bus deliver their events in.
     */
    Executor streamExecutor();

    /**
     * Number of events delivered in one batch of catch-up and polling.
     */
    int pollLimit();

    /**
     * Number of recently pushed events a stream keeps in memory.
     */
    int windowSize();
}
