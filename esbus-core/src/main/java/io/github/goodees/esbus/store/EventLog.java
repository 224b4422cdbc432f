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

import java.util.List;
import java.util.Map;

/**
 * Read side of a store: committed events of a tenant stream in position order, and the positions its handlers have
 * processed.
 */
public interface EventLog {
    /**
     * Last position appended to a stream.
     * @param tenant the tenant
     * @param stream name of the stream
     * @return last position, or -1 when nothing was committed yet
     * @throws CommandBusException when the store cannot be read
     */
    long streamPosition(String tenant, String stream) throws CommandBusException;

    /**
     * Read events past a position, in ascending position order.
     * @param tenant the tenant
     * @param stream name of the stream
     * @param afterPosition exclusive lower bound, -1 for the beginning of the stream
     * @param limit maximum number of events returned
     * @return the events
     * @throws CommandBusException when the store cannot be read
     */
    List<EventRecord> readStream(String tenant, String stream, long afterPosition, int limit)
            throws CommandBusException;

    /**
     * Positions handlers of a stream have processed.
     * @param tenant the tenant
     * @param stream name of the stream
     * @return handler name to last processed position. Handlers that did not process anything are absent
     * @throws CommandBusException when the store cannot be read
     */
    default Map<String, Long> readCursors(String tenant, String stream) throws CommandBusException {
        throw CommandBusException.notImplemented(getClass().getSimpleName() + ".readCursors");
    }

    /**
     * Move a handler's cursor forward, if it is still at the expected position.
     * @param tenant the tenant
     * @param stream name of the stream
     * @param handler name of the handler
     * @param expected position the caller read, -1 for none
     * @param position new position
     * @return false when the cursor was moved by someone else in the meantime
     * @throws CommandBusException when the store cannot be written
     */
    default boolean commitCursor(String tenant, String stream, String handler, long expected, long position)
            throws CommandBusException {
        throw CommandBusException.notImplemented(getClass().getSimpleName() + ".commitCursor");
    }
}
