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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * JSON serialization with Jackson. State objects are read and written through their fields, so plain classes with
 * private fields and a no-arg constructor work without annotations.
 */
public class JacksonSerialization<T> implements Serialization<T> {
    public static final int PAYLOAD_VERSION = 1;

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private static final JacksonSerialization<Map<String, Object>> PAYLOADS = new JacksonSerialization<>(
            DEFAULT_MAPPER, DEFAULT_MAPPER.getTypeFactory().constructType(new TypeReference<Map<String, Object>>() {
            }));

    private final ObjectMapper mapper;
    private final JavaType type;

    public JacksonSerialization(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <T> JacksonSerialization<T> of(Class<T> type) {
        return new JacksonSerialization<>(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(type));
    }

    /**
     * Serialization of event payloads.
     * @return serialization of string keyed maps
     */
    public static JacksonSerialization<Map<String, Object>> payloads() {
        return PAYLOADS;
    }

    @Override
    public int payloadVersion(T object) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String typeName) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize " + typeName + " payload version "
                    + payloadVersion, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public T toSerializable(Object o) {
        return type.getRawClass().isInstance(o) ? (T) o : null;
    }
}
