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

package io.coworkers;

import java.nio.charset.StandardCharsets;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

/**
 * An inbound message as handed to the middleware chain: the AMQP {@link Envelope} ("fields"), the
 * {@link BasicProperties} ("properties") and the raw body ("content").
 * <p />
 * The message is owned by the transport. The one mutable part is the back-reference to the {@link CoworkersContext}
 * which was created for it, so that code holding only the message can find its context again.
 */
public class CoworkersMessage {
    private final Envelope _fields;
    private final BasicProperties _properties;
    private final byte[] _content;

    private CoworkersContext _context;

    public CoworkersMessage(Envelope fields, BasicProperties properties, byte[] content) {
        _fields = fields;
        _properties = properties;
        _content = content;
    }

    /**
     * Creates a message from what the RabbitMQ client delivers to a {@link com.rabbitmq.client.DeliverCallback}.
     */
    public static CoworkersMessage of(Delivery delivery) {
        return new CoworkersMessage(delivery.getEnvelope(), delivery.getProperties(), delivery.getBody());
    }

    /**
     * @return the delivery fields, i.e. deliveryTag, redeliver, exchange and routingKey. May be <code>null</code> for
     *         a message that was not received from a broker.
     */
    public Envelope getFields() {
        return _fields;
    }

    public BasicProperties getProperties() {
        return _properties;
    }

    public byte[] getContent() {
        return _content;
    }

    /**
     * @return the content decoded as UTF-8, or <code>null</code> if there is no content.
     */
    public String getContentAsString() {
        return _content == null ? null : new String(_content, StandardCharsets.UTF_8);
    }

    /**
     * @return the context which was created for this message, or <code>null</code> if none yet.
     */
    public CoworkersContext getContext() {
        return _context;
    }

    public void setContext(CoworkersContext context) {
        _context = context;
    }

    @Override
    public String toString() {
        return "CoworkersMessage{"
                + (_fields == null ? "fields:none" : "deliveryTag:" + _fields.getDeliveryTag()
                        + ", exchange:'" + _fields.getExchange() + "', routingKey:'" + _fields.getRoutingKey() + "'")
                + ", contentLength:" + (_content == null ? 0 : _content.length) + "}";
    }
}
