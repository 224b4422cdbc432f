package io.github.goodees.esbus.trace;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Diagnostic sink. Components hand over a thunk rather than a record, so that an implementation that is not interested
 * never pays for building it. Tracing must never change control flow: implementations must not throw.
 *
 * <p>Records are maps with at least the key {@code method}, the other keys depend on the point of tracing:
 * <ul>
 *     <li>{@code command} - actor, command, aggregateId, expectedVersion, payload</li>
 *     <li>{@code loadAggregate} - aggregate, aggregateType</li>
 *     <li>{@code loadEvent} - aggregateType, event</li>
 *     <li>{@code commitEvents} - events, actor, command, aggregate, aggregateType</li>
 *     <li>{@code handle} - tenant, stream, handler, event</li>
 *     <li>{@code handlerFailed} - tenant, stream, handler, event, error</li>
 * </ul>
 */
@FunctionalInterface
public interface Tracer {

    void trace(Supplier<Map<String, Object>> record);

    Tracer NONE = record -> {
    };

    /**
     * Build a record from alternating keys and values.
     * @param method the point of tracing
     * @param keyValues key, value, key, value...
     * @return new record
     */
    static Map<String, Object> record(String method, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Keys and values must come in pairs");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("method", method);
        for (int i = 0; i < keyValues.length; i += 2) {
            result.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return result;
    }
}
