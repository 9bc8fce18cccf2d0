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

package io.coworkers.serial;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Converts outgoing content to the bytes put on the wire, and incoming bytes back to objects. Two outgoing flavors
 * exist: {@link #serializeContent(Object) raw}, used for publish, reply and request, where byte-like content passes
 * through and anything else is treated as text; and {@link #serializeJson(Object) JSON}, used for sendToQueue, where
 * the content is always JSON-encoded, strings included.
 * <p />
 * Thread-safety: Implementations must be thread-safe, as one instance is shared by the application.
 */
public interface CoworkersSerializer {

    /**
     * Raw conversion: <code>byte[]</code> is passed through as is, a {@link ByteBuffer} yields its remaining bytes, a
     * {@link CharSequence} is encoded as UTF-8, and any other object is converted with {@link String#valueOf(Object)}
     * and encoded as UTF-8.
     *
     * @param content
     *            the content, not <code>null</code>.
     * @return the bytes to send.
     */
    default byte[] serializeContent(Object content) {
        if (content == null) {
            throw new NullPointerException("content");
        }
        if (content instanceof byte[]) {
            return (byte[]) content;
        }
        if (content instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) content).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        }
        return String.valueOf(content).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Structured conversion: the content is serialized to JSON text, then encoded as UTF-8 - also if it already is a
     * String, which thus ends up quoted.
     *
     * @throws SerializationException
     *             if the content cannot be serialized.
     */
    byte[] serializeJson(Object content);

    /**
     * Reads JSON bytes into an instance of the given type.
     *
     * @throws SerializationException
     *             if the bytes cannot be deserialized into the type.
     */
    <T> T deserializeJson(byte[] json, Class<T> type);

    class SerializationException extends RuntimeException {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
