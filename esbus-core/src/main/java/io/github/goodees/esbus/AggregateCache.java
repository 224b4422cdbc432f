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

import io.github.goodees.esbus.aggregate.Aggregate;
import io.github.goodees.esbus.aggregate.AggregateType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Least recently used cache of aggregate copies. Both storing and reading copy the aggregate, so a command can never
 * change a cached instance. Capacity of zero disables the cache.
 */
public class AggregateCache {
    private final int capacity;
    private final LinkedHashMap<String, Aggregate<?>> entries = new LinkedHashMap<>();

    public AggregateCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative");
        }
        this.capacity = capacity;
    }

    public static String key(AggregateType<?> type, String aggregateId) {
        return type.getName() + "." + aggregateId;
    }

    /**
     * Copy of cached aggregate, marking it most recently used.
     * @param type type of the aggregate
     * @param aggregateId id of the aggregate
     * @param <S> type of the state
     * @return copy, or null when not cached
     */
    @SuppressWarnings("unchecked")
    public <S> Aggregate<S> get(AggregateType<S> type, String aggregateId) {
        if (capacity == 0) {
            return null;
        }
        String key = key(type, aggregateId);
        Aggregate<?> cached;
        synchronized (entries) {
            cached = entries.remove(key);
            if (cached != null) {
                entries.put(key, cached);
            }
        }
        return cached == null ? null : (Aggregate<S>) cached.copy();
    }

    /**
     * Store a copy of the aggregate, evicting the least recently used entries over capacity.
     * @param aggregate aggregate to cache
     */
    public void put(Aggregate<?> aggregate) {
        if (capacity == 0) {
            return;
        }
        String key = key(aggregate.getType(), aggregate.getAggregateId());
        Aggregate<?> copy = aggregate.copy();
        synchronized (entries) {
            entries.remove(key);
            entries.put(key, copy);
            Iterator<Map.Entry<String, Aggregate<?>>> eldest = entries.entrySet().iterator();
            while (entries.size() > capacity && eldest.hasNext()) {
                eldest.next();
                eldest.remove();
            }
        }
    }

    /**
     * Keys from least to most recently used.
     * @return the keys
     */
    public List<String> keys() {
        synchronized (entries) {
            return new ArrayList<>(entries.keySet());
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
