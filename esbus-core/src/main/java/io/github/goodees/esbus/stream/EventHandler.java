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

import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.store.EventRecord;

/**
 * Consumer of committed events of a stream. Each handler's progress is tracked separately under its name, so the name
 * must be stable across restarts and unique within the stream.
 */
public interface EventHandler {

    String name();

    /**
     * Stream the handler consumes.
     * @return name of the stream
     */
    default String stream() {
        return AggregateType.DEFAULT_STREAM;
    }

    /**
     * Process an event. Throwing stops delivery to this handler, the same event is offered again on next poll.
     * @param tenant tenant the event belongs to
     * @param event the event
     * @throws Exception when the event could not be processed
     */
    void handle(String tenant, EventRecord event) throws Exception;
}
