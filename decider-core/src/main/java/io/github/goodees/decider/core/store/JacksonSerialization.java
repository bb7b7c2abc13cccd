package io.github.goodees.decider.core.store;

/*-
 * #%L
 * decider
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serialization into JSON. Polymorphic types need to declare their type information through Jackson annotations, the
 * stored type discriminator is informative only.
 *
 * @param <T> serialized type
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;
    private final int payloadVersion;

    public JacksonSerialization(Class<T> type) {
        this(createMapper(), type, 1);
    }

    public JacksonSerialization(ObjectMapper mapper, Class<T> type, int payloadVersion) {
        this.mapper = Objects.requireNonNull(mapper, "Mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
        this.payloadVersion = payloadVersion;
    }

    /**
     * Mapper supporting Optional and java.time types, writing dates as ISO strings.
     * @return new mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String typeOf(T object) {
        return object.getClass().getSimpleName();
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String type) {
        if (payloadVersion != this.payloadVersion) {
            return null;
        }
        try {
            return mapper.readValue(payload, this.type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
