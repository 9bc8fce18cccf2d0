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

package io.coworkers.impl.rabbit;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import io.coworkers.AckIntent;
import io.coworkers.AckIntent.Kind;
import io.coworkers.AckOptions;
import io.coworkers.AmqpRpc;
import io.coworkers.AmqpRpc.RpcRequestOptions;
import io.coworkers.ConsumeOptions;
import io.coworkers.CoworkersApplication;
import io.coworkers.CoworkersApplication.QueueRegistration;
import io.coworkers.CoworkersContext;
import io.coworkers.CoworkersMessage;
import io.coworkers.NackOptions;
import io.coworkers.QueueOptions;
import io.coworkers.serial.CoworkersSerializer;

/**
 * The RabbitMQ implementation of {@link CoworkersContext}. Instantiated for each incoming message, given to the
 * middleware chain.
 * <p />
 * Construction copies the application's context properties, the reserved "app" property always being the application
 * itself. It then takes the connection and channels from the application, reads the delivery tag off the message's
 * fields, merges the queue's registered options with any overrides, and finally sets itself as the message's context.
 */
public class RabbitCoworkersContext implements CoworkersContext, RabbitCoworkersStatics {

    private static final Logger log = LoggerFactory.getLogger(RabbitCoworkersContext.class);

    private final LinkedHashMap<String, Object> _properties = new LinkedHashMap<>();

    private final CoworkersApplication _app;
    private final Connection _connection;
    private final Channel _consumerChannel;
    private final Channel _publisherChannel;
    private final CoworkersSerializer _serializer;
    private final AmqpRpc _rpc;

    private final String _queueName;
    private final CoworkersMessage _message;
    private final long _deliveryTag;
    private final QueueOptions _queueOpts;
    private final ConsumeOptions _consumeOpts;

    private final LinkedHashMap<String, Object> _state = new LinkedHashMap<>();

    // :: The single slot backing ack, nack, ackAll and nackAll. null means unset.
    private AckIntent _ackIntent;
    // Set when the error path has decided the disposition; the slot then holds that disposition.
    private boolean _ackIntentPoisoned;

    public RabbitCoworkersContext(CoworkersApplication app, String queueName, CoworkersMessage message) {
        this(app, queueName, message, null, null);
    }

    /**
     * @param queueOptsOverride
     *            options winning over the queue's registered queue options, may be <code>null</code>.
     * @param consumeOptsOverride
     *            options winning over the queue's registered consume options, may be <code>null</code>.
     */
    public RabbitCoworkersContext(CoworkersApplication app, String queueName, CoworkersMessage message,
            QueueOptions queueOptsOverride, ConsumeOptions consumeOptsOverride) {
        if (app == null) {
            throw new NullPointerException("app");
        }
        if (queueName == null) {
            throw new NullPointerException("queueName");
        }
        if (message == null) {
            throw new NullPointerException("message");
        }

        // :: Copy the application's context properties, except the reserved key.
        for (Entry<String, Object> entry : app.getContextProperties().entrySet()) {
            if (CoworkersApplication.RESERVED_APP_KEY.equals(entry.getKey())) {
                continue;
            }
            _properties.put(entry.getKey(), entry.getValue());
        }
        _properties.put(CoworkersApplication.RESERVED_APP_KEY, app);

        _app = app;
        _connection = app.getConnection();
        _consumerChannel = app.getConsumerChannel();
        _publisherChannel = app.getPublisherChannel();
        _serializer = app.getSerializer();
        _rpc = app.getRpc();

        _queueName = queueName;
        _message = message;
        // NOTE: A message without fields is a precondition violation, and fails here with NullPointerException.
        _deliveryTag = message.getFields().getDeliveryTag();

        Optional<QueueRegistration> registration = app.getQueueRegistration(queueName);
        QueueOptions queueOptsDefaults = registration.map(QueueRegistration::getQueueOpts)
                .orElse(QueueOptions.empty());
        ConsumeOptions consumeOptsDefaults = registration.map(QueueRegistration::getConsumeOpts)
                .orElse(ConsumeOptions.empty());
        _queueOpts = queueOptsDefaults.mergedWith(queueOptsOverride);
        _consumeOpts = consumeOptsDefaults.mergedWith(consumeOptsOverride);

        message.setContext(this);
    }

    @Override
    public CoworkersApplication getApp() {
        return _app;
    }

    @Override
    public Connection getConnection() {
        return _connection;
    }

    @Override
    public Channel getConsumerChannel() {
        return _consumerChannel;
    }

    @Override
    public Channel getPublisherChannel() {
        return _publisherChannel;
    }

    @Override
    public String getQueueName() {
        return _queueName;
    }

    @Override
    public CoworkersMessage getMessage() {
        return _message;
    }

    @Override
    public long getDeliveryTag() {
        return _deliveryTag;
    }

    @Override
    public QueueOptions getQueueOpts() {
        return _queueOpts;
    }

    @Override
    public ConsumeOptions getConsumeOpts() {
        return _consumeOpts;
    }

    // ===== Properties and state

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getProperty(String key) {
        return (T) _properties.get(key);
    }

    @Override
    public <T> Optional<T> getProperty(String key, Class<T> type) {
        Object value = _properties.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException("Property with key '" + key + "' is not of type " + type.getName()
                    + ", but " + value.getClass().getName());
        }
        return Optional.of(type.cast(value));
    }

    @Override
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(_properties);
    }

    @Override
    public CoworkersContext setProperty(String key, Object value) {
        if (key == null) {
            throw new NullPointerException("key");
        }
        if (CoworkersApplication.RESERVED_APP_KEY.equals(key)) {
            throw new IllegalArgumentException("The property key '" + key + "' is reserved for the application.");
        }
        if (value == null) {
            _properties.remove(key);
        }
        else {
            _properties.put(key, value);
        }
        return this;
    }

    @Override
    public Map<String, Object> getState() {
        return _state;
    }

    // ===== Acknowledgement intent

    @Override
    public void setAck(AckOptions options) {
        setAckIntent(options == null ? null : AckIntent.ack(options));
    }

    @Override
    public Optional<AckOptions> getAck() {
        return getAckIntentOfKind(Kind.ACK).map(AckIntent::getAckOptions);
    }

    @Override
    public void setNack(NackOptions options) {
        setAckIntent(options == null ? null : AckIntent.nack(options));
    }

    @Override
    public Optional<NackOptions> getNack() {
        return getAckIntentOfKind(Kind.NACK).map(AckIntent::getNackOptions);
    }

    @Override
    public void setAckAll(AckOptions options) {
        setAckIntent(options == null ? null : AckIntent.ackAll(options));
    }

    @Override
    public void setAckAll(boolean ackAll) {
        setAckAll(ackAll ? AckOptions.empty() : null);
    }

    @Override
    public Optional<AckOptions> getAckAll() {
        return getAckIntentOfKind(Kind.ACK_ALL).map(AckIntent::getAckOptions);
    }

    @Override
    public void setNackAll(NackOptions options) {
        setAckIntent(options == null ? null : AckIntent.nackAll(options));
    }

    @Override
    public void setNackAll(boolean nackAll) {
        setNackAll(nackAll ? NackOptions.empty() : null);
    }

    @Override
    public Optional<NackOptions> getNackAll() {
        return getAckIntentOfKind(Kind.NACK_ALL).map(AckIntent::getNackOptions);
    }

    @Override
    public Optional<AckIntent> getAckIntent() {
        assertAckIntentAvailable();
        return Optional.ofNullable(_ackIntent);
    }

    private void setAckIntent(AckIntent ackIntent) {
        assertAckIntentAvailable();
        if (log.isTraceEnabled()) log.trace(LOG_PREFIX + "Ack intent for deliveryTag [" + _deliveryTag + "] on queue ["
                + _queueName + "] set to [" + ackIntent + "], was [" + _ackIntent + "].");
        _ackIntent = ackIntent;
    }

    private Optional<AckIntent> getAckIntentOfKind(Kind kind) {
        assertAckIntentAvailable();
        return (_ackIntent != null) && _ackIntent.is(kind)
                ? Optional.of(_ackIntent)
                : Optional.empty();
    }

    private void assertAckIntentAvailable() {
        if (_ackIntentPoisoned) {
            throw new AckNotAvailableException("Ack, nack, ackAll and nackAll are not available for the message with"
                    + " deliveryTag [" + _deliveryTag + "] from queue [" + _queueName + "], since it has gone down"
                    + " the error path, which decided on [" + _ackIntent + "].");
        }
    }

    /**
     * Marks this context as having gone down the error path, recording the disposition the driver will apply. After
     * this, every read or write of ack, nack, ackAll and nackAll throws {@link AckNotAvailableException}. Irreversible.
     *
     * @param errorDisposition
     *            the acknowledgement the driver will perform for this message.
     * @throws IllegalStateException
     *             if already poisoned.
     */
    public void poisonAckIntent(AckIntent errorDisposition) {
        if (errorDisposition == null) {
            throw new NullPointerException("errorDisposition");
        }
        if (_ackIntentPoisoned) {
            throw new IllegalStateException("The ack intent of [" + this + "] is already poisoned.");
        }
        _ackIntent = errorDisposition;
        _ackIntentPoisoned = true;
    }

    public boolean isAckIntentPoisoned() {
        return _ackIntentPoisoned;
    }

    /**
     * For the driver: the decision to apply, whether set by the middlewares or by the error path. Not affected by
     * poisoning.
     */
    public Optional<AckIntent> resolveAckIntent() {
        return Optional.ofNullable(_ackIntent);
    }

    // ===== Messaging helpers

    @Override
    public void publish(String exchange, String routingKey, Object content, BasicProperties options)
            throws IOException {
        byte[] bytes = _serializer.serializeContent(content);
        _publisherChannel.basicPublish(exchange, routingKey, options, bytes);
    }

    @Override
    public void sendToQueue(String queueName, Object content, BasicProperties options) throws IOException {
        byte[] bytes = _serializer.serializeJson(content);
        // Sending to a queue is publishing on the default exchange, with the queue name as routing key.
        _publisherChannel.basicPublish("", queueName, options, bytes);
    }

    @Override
    public void reply(Object content, BasicProperties options) throws IOException {
        _rpc.reply(_publisherChannel, _message, content, options);
    }

    @Override
    public CompletableFuture<CoworkersMessage> request(String queueName, Object content, BasicProperties sendOpts,
            QueueOptions queueOpts, ConsumeOptions consumeOpts) {
        try {
            byte[] bytes = _serializer.serializeContent(content);
            return _rpc.request(_connection, queueName, bytes,
                    new RpcRequestOptions(sendOpts, queueOpts, consumeOpts));
        }
        catch (RuntimeException e) {
            CompletableFuture<CoworkersMessage> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    @Override
    public String getContentAsString() {
        return _message.getContentAsString();
    }

    @Override
    public <T> T getContentAsJson(Class<T> type) {
        return _serializer.deserializeJson(_message.getContent(), type);
    }

    @Override
    public String toString() {
        return id("RabbitCoworkersContext", this) + "{queue:'" + _queueName + "', deliveryTag:" + _deliveryTag
                + (_ackIntentPoisoned ? ", poisoned:" : ", ackIntent:") + _ackIntent + "}";
    }
}
