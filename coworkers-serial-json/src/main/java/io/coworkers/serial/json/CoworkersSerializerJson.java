/*
 * Copyright 2015-2025 Endre Stølsvik
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.coworkers.serial.json;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.coworkers.serial.CoworkersSerializer;

/**
 * Implementation of {@link CoworkersSerializer} that employs <a href="https://github.com/FasterXML/jackson">Jackson
 * JSON library</a> for the structured conversion. The raw conversion is the interface's default.
 * <p />
 * The Jackson {@link ObjectMapper} is the one from {@link FieldBasedJacksonMapper}, i.e. it only handles fields (think
 * "data struct"), only includes non-null fields, ignores unknown properties upon deserialization, and uses string
 * serialization for dates.
 */
public class CoworkersSerializerJson implements CoworkersSerializer {

    private final ObjectMapper _objectMapper;

    /**
     * Constructs a CoworkersSerializer using the default, shared ObjectMapper.
     */
    public static CoworkersSerializerJson create() {
        return new CoworkersSerializerJson(FieldBasedJacksonMapper.getDefaultJacksonObjectMapper());
    }

    /**
     * Constructs a CoworkersSerializer using the supplied ObjectMapper.
     */
    public static CoworkersSerializerJson create(ObjectMapper objectMapper) {
        return new CoworkersSerializerJson(objectMapper);
    }

    protected CoworkersSerializerJson(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new NullPointerException("objectMapper");
        }
        _objectMapper = objectMapper;
    }

    @Override
    public byte[] serializeJson(Object content) {
        try {
            return _objectMapper.writeValueAsBytes(content);
        }
        catch (JsonProcessingException e) {
            throw new SerializationException("Couldn't serialize content of type ["
                    + (content == null ? "null" : content.getClass().getName()) + "] to JSON.", e);
        }
    }

    @Override
    public <T> T deserializeJson(byte[] json, Class<T> type) {
        if (json == null) {
            throw new NullPointerException("json");
        }
        try {
            return _objectMapper.readValue(json, type);
        }
        catch (IOException e) {
            throw new SerializationException("Couldn't deserialize JSON into [" + type.getName() + "].", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
