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

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * Per-message state passed through the middleware chain, the analogue of the request/response context of an HTTP
 * middleware framework. One instance is created for each incoming message, and lives until the outer driver has
 * consumed the acknowledgement decision.
 * <p />
 * <h3>Acknowledgement intent</h3> At most one of <i>ack</i>, <i>nack</i>, <i>ackAll</i> and <i>nackAll</i> is present
 * at any time: setting one clears the other three, and setting one to <code>null</code> (or <code>false</code> for
 * the boolean variants) clears the intent altogether. Reading a kind that is not the active one yields
 * {@link Optional#empty()}.
 * <p />
 * When the message has gone down the error path, the driver has already decided its disposition, and the ack intent is
 * <i>poisoned</i>: every subsequent read or write of it throws {@link AckNotAvailableException}.
 * <p />
 * Thread-safety: None. A context is handled by one middleware chain invocation at a time.
 */
public interface CoworkersContext {

    // ===== Shared references, copied from the application

    CoworkersApplication getApp();

    Connection getConnection();

    Channel getConsumerChannel();

    Channel getPublisherChannel();

    // ===== Message

    String getQueueName();

    CoworkersMessage getMessage();

    long getDeliveryTag();

    /**
     * @return the queue options in effect for the source queue: the registered defaults merged with any overrides.
     */
    QueueOptions getQueueOpts();

    /**
     * @return the consume options in effect for the source queue: the registered defaults merged with any overrides.
     */
    ConsumeOptions getConsumeOpts();

    // ===== Properties and state

    /**
     * @return the value of the given property, copied from the {@link CoworkersApplication#getContextProperties()
     *         application's context properties} at construction, or set later with
     *         {@link #setProperty(String, Object)}; <code>null</code> if not present. The property
     *         {@link CoworkersApplication#RESERVED_APP_KEY "app"} is the application. Uses the generics hack to avoid
     *         explicit casting - you should know the type.
     */
    <T> T getProperty(String key);

    /**
     * @return the property wrapped in an Optional, empty if not present.
     * @throws ClassCastException
     *             if the property is present but not of the requested type.
     */
    <T> Optional<T> getProperty(String key, Class<T> type);

    /**
     * @return an unmodifiable view of the properties of this context.
     */
    Map<String, Object> getProperties();

    /**
     * Sets a property on this context only. A <code>null</code> value removes the property.
     *
     * @throws IllegalArgumentException
     *             if the key is the reserved <code>"app"</code>.
     */
    CoworkersContext setProperty(String key, Object value);

    /**
     * @return the mutable per-message scratch map for the middlewares, empty at construction.
     */
    Map<String, Object> getState();

    // ===== Acknowledgement intent

    void setAck(AckOptions options);

    Optional<AckOptions> getAck();

    void setNack(NackOptions options);

    Optional<NackOptions> getNack();

    void setAckAll(AckOptions options);

    /**
     * <code>true</code> is the same as {@link #setAckAll(AckOptions) setAckAll(AckOptions.empty())}, <code>false</code>
     * clears the intent.
     */
    void setAckAll(boolean ackAll);

    Optional<AckOptions> getAckAll();

    void setNackAll(NackOptions options);

    /**
     * <code>true</code> is the same as {@link #setNackAll(NackOptions) setNackAll(NackOptions.empty())},
     * <code>false</code> clears the intent.
     */
    void setNackAll(boolean nackAll);

    Optional<NackOptions> getNackAll();

    /**
     * @return the current intent, whichever kind it is.
     */
    Optional<AckIntent> getAckIntent();

    // ===== Messaging helpers

    /**
     * Publishes the content to an exchange on the publisher channel. Content is converted raw, see
     * {@link io.coworkers.serial.CoworkersSerializer#serializeContent(Object)}.
     */
    void publish(String exchange, String routingKey, Object content, BasicProperties options) throws IOException;

    /**
     * Sends the content directly to a queue on the publisher channel. Content is always JSON-encoded, see
     * {@link io.coworkers.serial.CoworkersSerializer#serializeJson(Object)}.
     */
    void sendToQueue(String queueName, Object content, BasicProperties options) throws IOException;

    /**
     * Replies to the RPC request carried by this context's message, on the publisher channel.
     */
    void reply(Object content, BasicProperties options) throws IOException;

    /**
     * Makes an RPC request to the given queue over the application's connection. The returned future completes with
     * the reply message, or exceptionally with whatever the RPC collaborator failed with.
     */
    CompletableFuture<CoworkersMessage> request(String queueName, Object content, BasicProperties sendOpts,
            QueueOptions queueOpts, ConsumeOptions consumeOpts);

    /**
     * @return the message's content decoded as UTF-8.
     */
    String getContentAsString();

    /**
     * @return the message's content read as JSON into the given type.
     */
    <T> T getContentAsJson(Class<T> type);

    /**
     * Thrown on any access to the acknowledgement intent after the context has gone down the error path.
     */
    class AckNotAvailableException extends IllegalStateException {
        public AckNotAvailableException(String message) {
            super(message);
        }
    }
}
