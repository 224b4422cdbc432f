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

import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.stream.EventHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test handler remembering positions of events it received. Can be told to fail once at a position.
 */
public class EventCounter implements EventHandler {
    private final String name;
    private final List<Long> positions = Collections.synchronizedList(new ArrayList<>());
    private volatile long failOnceAt = -1;

    public EventCounter(String name) {
        this.name = name;
    }

    public void failOnceAt(long position) {
        this.failOnceAt = position;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void handle(String tenant, EventRecord event) {
        if (event.getStreamPosition() == failOnceAt) {
            failOnceAt = -1;
            throw new IllegalStateException("Failing on purpose at " + event.getStreamPosition());
        }
        positions.add(event.getStreamPosition());
    }

    public int count() {
        return positions.size();
    }

    public List<Long> positions() {
        synchronized (positions) {
            return new ArrayList<>(positions);
        }
    }
}
