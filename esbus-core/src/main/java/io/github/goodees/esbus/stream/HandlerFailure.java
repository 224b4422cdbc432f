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

import java.time.Instant;

/**
 * Last failure of a handler. Kept by the stream until the handler processes the event successfully.
 */
public final class HandlerFailure {
    private final String handler;
    private final long streamPosition;
    private final Exception error;
    private final Instant timestamp;

    public HandlerFailure(String handler, long streamPosition, Exception error) {
        this.handler = handler;
        this.streamPosition = streamPosition;
        this.error = error;
        this.timestamp = Instant.now();
    }

    public String getHandler() {
        return handler;
    }

    public long getStreamPosition() {
        return streamPosition;
    }

    public Exception getError() {
        return error;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "HandlerFailure{" + handler + " at " + streamPosition + ": " + error + '}';
    }
}
