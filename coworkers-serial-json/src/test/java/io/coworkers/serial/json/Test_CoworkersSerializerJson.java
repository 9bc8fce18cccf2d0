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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import io.coworkers.serial.CoworkersSerializer.SerializationException;

/**
 * Tests the raw and the JSON conversions of {@link CoworkersSerializerJson}.
 */
public class Test_CoworkersSerializerJson {

    private final CoworkersSerializerJson _serializer = CoworkersSerializerJson.create();

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    public void rawStringIsUtf8Bytes() {
        Assert.assertArrayEquals("content".getBytes(StandardCharsets.UTF_8), _serializer.serializeContent("content"));
        Assert.assertEquals("blåbærsyltetøy", utf8(_serializer.serializeContent("blåbærsyltetøy")));
    }

    @Test
    public void rawBytesPassThrough() {
        byte[] bytes = new byte[] { 1, 2, 3 };
        Assert.assertSame(bytes, _serializer.serializeContent(bytes));
    }

    @Test
    public void rawByteBufferYieldsRemainingBytes() {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] { 1, 2, 3, 4 });
        buffer.position(1);
        Assert.assertArrayEquals(new byte[] { 2, 3, 4 }, _serializer.serializeContent(buffer));
        // The buffer itself is not consumed
        Assert.assertEquals(1, buffer.position());
    }

    @Test
    public void rawOtherObjectIsTreatedAsText() {
        Assert.assertEquals("42", utf8(_serializer.serializeContent(42)));
        Assert.assertEquals("[a, b]", utf8(_serializer.serializeContent(List.of("a", "b"))));
    }

    @Test(expected = NullPointerException.class)
    public void rawNullIsRejected() {
        _serializer.serializeContent(null);
    }

    @Test
    public void jsonOfMap() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("foo", 1);
        Assert.assertEquals("{\"foo\":1}", utf8(_serializer.serializeJson(content)));
    }

    @Test
    public void jsonOfStringIsQuoted() {
        Assert.assertEquals("\"content\"", utf8(_serializer.serializeJson("content")));
    }

    @Test
    public void jsonOfDtoUsesFieldsDropsNullsAndWritesIsoDates() {
        OrderDto dto = new OrderDto("abc", 3, null, LocalDate.of(1975, 3, 11));
        Assert.assertEquals("{\"orderId\":\"abc\",\"quantity\":3,\"date\":\"1975-03-11\"}",
                utf8(_serializer.serializeJson(dto)));
    }

    @Test
    public void jsonRoundTripIgnoresUnknownProperties() {
        byte[] json = "{\"orderId\":\"abc\",\"quantity\":3,\"unknown\":true,\"date\":\"1975-03-11\"}"
                .getBytes(StandardCharsets.UTF_8);
        OrderDto dto = _serializer.deserializeJson(json, OrderDto.class);
        Assert.assertEquals("abc", dto.orderId);
        Assert.assertEquals(3, dto.quantity);
        Assert.assertNull(dto.comment);
        Assert.assertEquals(LocalDate.of(1975, 3, 11), dto.date);
    }

    @Test(expected = SerializationException.class)
    public void invalidJsonThrowsSerializationException() {
        _serializer.deserializeJson("{not json".getBytes(StandardCharsets.UTF_8), OrderDto.class);
    }

    static class OrderDto {
        private String orderId;
        private int quantity;
        private String comment;
        private LocalDate date;

        // Jackson
        OrderDto() {
        }

        OrderDto(String orderId, int quantity, String comment, LocalDate date) {
            this.orderId = orderId;
            this.quantity = quantity;
            this.comment = comment;
            this.date = date;
        }
    }
}
