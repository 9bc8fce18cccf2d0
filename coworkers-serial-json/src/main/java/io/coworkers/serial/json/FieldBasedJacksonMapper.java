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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Configures a Jackson JSON field-based ObjectMapper for message content, ensuring a common standard configuration.
 * <p>
 * The ObjectMapper is configured to be as lenient and compact as possible:
 * <ul>
 * <li>Only read and write fields, ignore methods and constructors.</li>
 * <li>Read and write any access modifier fields (private, package, public)</li>
 * <li>If the JSON have a value that does not map to a field in the DTO, do not fail</li>
 * <li>Drop nulls from JSON</li>
 * <li>Write times and dates using Strings of ISO-8601, e.g "1975-03-11" instead of millis-since-epoch or array-of-ints
 * [1975, 3, 11]</li>
 * <li>Handle Optional, OptionalLong, OptionalDouble</li>
 * <li>Make the security constraints when reading JSON more lenient wrt. nesting level and number length, and
 * effectively remove the string length limit.</li>
 * </ul>
 * Thread-safety: The returned ObjectMappers are thread-safe, meant for sharing.
 */
public class FieldBasedJacksonMapper {
    private static final Logger log = LoggerFactory.getLogger(FieldBasedJacksonMapper.class);

    // "Initialization-on-demand holder idiom", using a static inner class to hold the singleton instance.
    private static class SingletonObjectMapperHolder {
        private static final ObjectMapper INSTANCE = internalJacksonObjectMapper(
                "Creating default Coworkers singleton");
    }

    /**
     * Returns the singleton ObjectMapper shared by all Coworkers components - <b>You must not further configure this
     * ObjectMapper instance.</b>
     *
     * @return the default ObjectMapper - <b>do not mess with this!</b>
     */
    public static ObjectMapper getDefaultJacksonObjectMapper() {
        return SingletonObjectMapperHolder.INSTANCE;
    }

    /**
     * Creates a new Jackson ObjectMapper configured exactly the same as the default ObjectMapper. Do not create one per
     * serialization, as this is an expensive operation.
     *
     * @return a new Jackson ObjectMapper configured as the default one.
     */
    public static ObjectMapper createJacksonObjectMapper() {
        return internalJacksonObjectMapper("Instantiating new");
    }

    private static ObjectMapper internalJacksonObjectMapper(String sayWhat) {
        // Much larger constraints, and make max string length effectively infinite.
        StreamReadConstraints streamReadConstraints = StreamReadConstraints
                .builder()
                .maxNestingDepth(10_000) // default 1000
                .maxNumberLength(100_000) // default 1000
                .maxStringLength(Integer.MAX_VALUE)
                .build();
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(streamReadConstraints)
                .build();

        log.info(sayWhat + " Jackson JsonMapper (Java: " + System.getProperty("java.version") + ")");

        return JsonMapper.builder(factory)
                // Drop null values from JSON
                .serializationInclusion(Include.NON_NULL)
                // Read and write any access modifier fields (e.g. private), and nothing else
                .visibility(PropertyAccessor.ALL, Visibility.NONE)
                .visibility(PropertyAccessor.FIELD, Visibility.ANY)
                // Allow final fields to be written to.
                .enable(MapperFeature.ALLOW_FINAL_FIELDS_AS_MUTATORS)
                // If props are in JSON that aren't in Java DTO, do not fail.
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // :: Dates: handle java.time, and write them as ISO-8601 Strings.
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // Handle JDK8 Optionals as normal fields.
                .addModule(new Jdk8Module())
                .build();
    }
}
