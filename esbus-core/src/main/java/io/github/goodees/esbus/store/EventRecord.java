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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A committed event as persisted in a stream. Besides the payload produced by the aggregate it carries who committed
 * it, by which command, the aggregate it belongs to with its padded post-commit version, and its position in the
 * stream.
 */
public final class EventRecord {
    public static final String COMMITTER = "_u";
    public static final String COMMAND = "_c";
    public static final String AGGREGATE_TYPE = "_t";
    public static final String AGGREGATE_ID = "_a";
    public static final String AGGREGATE_VERSION = "_v";
    public static final String STREAM_POSITION = "_version_";

    private final String committerId;
    private final String command;
    private final String aggregateType;
    private final String aggregateId;
    private final String paddedAggregateVersion;
    private final long streamPosition;
    private final Map<String, Object> payload;

    public EventRecord(String committerId, String command, String aggregateType, String aggregateId,
            String paddedAggregateVersion, long streamPosition, Map<String, Object> payload) {
        this.committerId = committerId;
        this.command = command;
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.paddedAggregateVersion = Objects.requireNonNull(paddedAggregateVersion, "Version must be specified");
        this.streamPosition = streamPosition;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Read a record from its document form.
     * @param document map with metadata keys merged with the payload
     * @return the record
     */
    public static EventRecord fromDocument(Map<String, Object> document) {
        Map<String, Object> payload = new LinkedHashMap<>(document);
        String committer = (String) payload.remove(COMMITTER);
        String command = (String) payload.remove(COMMAND);
        String type = (String) payload.remove(AGGREGATE_TYPE);
        String id = (String) payload.remove(AGGREGATE_ID);
        String version = (String) payload.remove(AGGREGATE_VERSION);
        Object position = payload.remove(STREAM_POSITION);
        if (position == null) {
            throw new IllegalArgumentException("Document does not carry a stream position: " + document);
        }
        return new EventRecord(committer, command, type, id, version, ((Number) position).longValue(), payload);
    }

    public String getCommitterId() {
        return committerId;
    }

    public String getCommand() {
        return command;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getPaddedAggregateVersion() {
        return paddedAggregateVersion;
    }

    public long getAggregateVersion() {
        return VersionPadder.parse(paddedAggregateVersion);
    }

    public long getStreamPosition() {
        return streamPosition;
    }

    /**
     * The event as produced by the aggregate, including its name.
     * @return unmodifiable payload
     */
    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Document form: metadata under the underscore keys merged with the payload.
     * @return new mutable map
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>(payload);
        document.put(COMMITTER, committerId);
        document.put(COMMAND, command);
        document.put(AGGREGATE_TYPE, aggregateType);
        document.put(AGGREGATE_ID, aggregateId);
        document.put(AGGREGATE_VERSION, paddedAggregateVersion);
        document.put(STREAM_POSITION, streamPosition);
        return document;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventRecord)) {
            return false;
        }
        EventRecord that = (EventRecord) o;
        return streamPosition == that.streamPosition && Objects.equals(committerId, that.committerId)
                && Objects.equals(command, that.command) && aggregateType.equals(that.aggregateType)
                && aggregateId.equals(that.aggregateId) && paddedAggregateVersion.equals(that.paddedAggregateVersion)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, aggregateId, paddedAggregateVersion, streamPosition);
    }

    @Override
    public String toString() {
        return "EventRecord{" + aggregateType + "/" + aggregateId + "@" + paddedAggregateVersion + ", position="
                + streamPosition + ", command=" + command + ", payload=" + payload + '}';
    }
}
