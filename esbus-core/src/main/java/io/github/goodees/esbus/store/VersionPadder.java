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

/**
 * Zero padded decimal form of versions and stream positions. Document stores only offer range queries over string
 * keys, so every version is written with the same width, making string order equal to numeric order.
 * The width is the number of digits of {@code maxEvents - 1}.
 */
public final class VersionPadder {
    public static final long MAX_EVENTS_LIMIT = 1_000_000;

    /**
     * Lower bound sorting before any padded value.
     */
    public static final String BEFORE_FIRST = "";

    private static final VersionPadder STREAM = new VersionPadder(String.valueOf(MAX_EVENTS_LIMIT - 1).length());

    private final int width;

    private VersionPadder(int width) {
        this.width = width;
    }

    /**
     * Padder for aggregate versions of a type.
     * @param maxEvents maximum number of events of an aggregate
     * @return the padder
     * @throws CommandBusException with {@code PRECONDITION} fault when maxEvents is out of supported range
     */
    public static VersionPadder forMaxEvents(long maxEvents) throws CommandBusException {
        if (maxEvents > MAX_EVENTS_LIMIT) {
            throw CommandBusException.precondition("max events is higher than " + MAX_EVENTS_LIMIT);
        }
        if (maxEvents < 2) {
            throw CommandBusException.precondition("max events must allow at least one event, was " + maxEvents);
        }
        return new VersionPadder(String.valueOf(maxEvents - 1).length());
    }

    /**
     * Padder for stream positions.
     * @return the padder
     */
    public static VersionPadder forStreams() {
        return STREAM;
    }

    public int width() {
        return width;
    }

    public String pad(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("Cannot pad negative number " + number);
        }
        String s = Long.toString(number);
        if (s.length() >= width) {
            return s;
        }
        StringBuilder sb = new StringBuilder(width);
        for (int i = s.length(); i < width; i++) {
            sb.append('0');
        }
        return sb.append(s).toString();
    }

    /**
     * Exclusive lower bound for values greater than given one. Negative numbers stand for "nothing yet", and map to
     * a bound below every padded value.
     * @param number the bound
     * @return padded bound
     */
    public String after(long number) {
        return number < 0 ? BEFORE_FIRST : pad(number);
    }

    public static long parse(String padded) {
        return Long.parseLong(padded);
    }
}
