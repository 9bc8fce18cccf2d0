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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;

import io.coworkers.AckIntent;
import io.coworkers.AmqpRpc;
import io.coworkers.ConsumeOptions;
import io.coworkers.CoworkersApplication;
import io.coworkers.CoworkersMessage;
import io.coworkers.Middleware;
import io.coworkers.Middleware.ErrorListener;
import io.coworkers.NackOptions;
import io.coworkers.QueueOptions;
import io.coworkers.serial.CoworkersSerializer;

/**
 * The RabbitMQ implementation of {@link CoworkersApplication}, using the RabbitMQ Java client. Holds one
 * {@link Connection}, with one channel for consuming and one for publishing.
 * <p />
 * For every delivery, a {@link RabbitCoworkersContext} is created and run through the application middlewares
 * followed by the queue's middlewares. Then the acknowledgement intent the middlewares left on the context is
 * performed on the consumer channel, unless the queue consumes with <code>noAck</code>. A middleware throwing, or the
 * chain finishing without any acknowledgement decision, sends the message down the error path: logged, given to the
 * {@link ErrorListener}s, and nacked - requeued only if {@link ApplicationConfig#isRequeueOnError()}.
 */
public class RabbitCoworkersApplication implements CoworkersApplication, RabbitCoworkersStatics {

    private static final Logger log = LoggerFactory.getLogger(RabbitCoworkersApplication.class);

    private final ConnectionFactory _connectionFactory;
    private final CoworkersSerializer _serializer;
    private final AmqpRpc _rpc;
    private final RabbitCoworkersApplicationConfig _config;

    private final ConcurrentHashMap<String, Object> _contextProperties = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Middleware> _middlewares = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ErrorListener> _errorListeners = new CopyOnWriteArrayList<>();

    private final Object _stateLockObject = new Object();
    // :: Fields below SYNCHED on _stateLockObject.
    private final LinkedHashMap<String, QueueRegistration> _queues = new LinkedHashMap<>();
    private final LinkedHashMap<String, String> _consumerTags = new LinkedHashMap<>();
    private volatile Connection _connection;
    private volatile Channel _consumerChannel;
    private volatile Channel _publisherChannel;
    private volatile boolean _running;

    private volatile String _name;
    private volatile int _prefetch;
    private volatile boolean _requeueOnError;

    public static RabbitCoworkersApplication create(String appName, ConnectionFactory connectionFactory,
            CoworkersSerializer serializer) {
        return create(appName, connectionFactory, serializer, RabbitAmqpRpc.create(serializer));
    }

    public static RabbitCoworkersApplication create(String appName, ConnectionFactory connectionFactory,
            CoworkersSerializer serializer, AmqpRpc amqpRpc) {
        return new RabbitCoworkersApplication(appName, connectionFactory, serializer, amqpRpc);
    }

    protected RabbitCoworkersApplication(String appName, ConnectionFactory connectionFactory,
            CoworkersSerializer serializer, AmqpRpc amqpRpc) {
        if (appName == null) {
            throw new NullPointerException("appName");
        }
        if (connectionFactory == null) {
            throw new NullPointerException("connectionFactory");
        }
        if (serializer == null) {
            throw new NullPointerException("serializer");
        }
        if (amqpRpc == null) {
            throw new NullPointerException("amqpRpc");
        }
        _name = appName;
        _connectionFactory = connectionFactory;
        _serializer = serializer;
        _rpc = amqpRpc;
        _config = new RabbitCoworkersApplicationConfig();
        log.info(LOG_PREFIX + "Created [" + idThis() + "], serializer [" + serializer + "], rpc [" + amqpRpc + "].");
    }

    @Override
    public ApplicationConfig getConfig() {
        return _config;
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
    public AmqpRpc getRpc() {
        return _rpc;
    }

    @Override
    public CoworkersSerializer getSerializer() {
        return _serializer;
    }

    // ===== Context properties

    @Override
    public CoworkersApplication setContextProperty(String key, Object value) {
        if (key == null) {
            throw new NullPointerException("key");
        }
        if (RESERVED_APP_KEY.equals(key)) {
            throw new IllegalArgumentException("The context property key '" + key + "' is reserved.");
        }
        if (value == null) {
            _contextProperties.remove(key);
        }
        else {
            _contextProperties.put(key, value);
        }
        return this;
    }

    @Override
    public Map<String, Object> getContextProperties() {
        return Map.copyOf(_contextProperties);
    }

    // ===== Middlewares and queues

    @Override
    public CoworkersApplication use(Middleware middleware) {
        if (middleware == null) {
            throw new NullPointerException("middleware");
        }
        _middlewares.add(middleware);
        return this;
    }

    @Override
    public CoworkersApplication queue(String queueName, QueueOptions queueOpts, ConsumeOptions consumeOpts,
            Middleware... middlewares) {
        if (queueName == null) {
            throw new NullPointerException("queueName");
        }
        if ((middlewares == null) || (middlewares.length == 0)) {
            throw new IllegalArgumentException("Queue [" + queueName + "] must have at least one middleware.");
        }
        for (Middleware middleware : middlewares) {
            if (middleware == null) {
                throw new NullPointerException("middleware for queue [" + queueName + "]");
            }
        }
        synchronized (_stateLockObject) {
            if (_running) {
                throw new IllegalStateException("Cannot register queue [" + queueName + "] on [" + idThis()
                        + "], since it is already started.");
            }
            if (_queues.containsKey(queueName)) {
                throw new IllegalStateException("Queue [" + queueName + "] is already registered on ["
                        + idThis() + "].");
            }
            QueueRegistration registration = new QueueRegistration(queueName, queueOpts, consumeOpts,
                    Arrays.asList(middlewares));
            _queues.put(queueName, registration);
            log.info(LOG_PREFIX + "Registered " + registration + " on [" + idThis() + "].");
        }
        return this;
    }

    @Override
    public Optional<QueueRegistration> getQueueRegistration(String queueName) {
        synchronized (_stateLockObject) {
            return Optional.ofNullable(_queues.get(queueName));
        }
    }

    @Override
    public List<String> getQueueNames() {
        synchronized (_stateLockObject) {
            return new ArrayList<>(_queues.keySet());
        }
    }

    @Override
    public List<Middleware> getMiddlewares() {
        return Collections.unmodifiableList(_middlewares);
    }

    @Override
    public CoworkersApplication addErrorListener(ErrorListener listener) {
        if (listener == null) {
            throw new NullPointerException("listener");
        }
        _errorListeners.add(listener);
        return this;
    }

    // ===== Lifecycle

    @Override
    public void start() throws IOException {
        log.info(LOG_PREFIX + "Starting [" + idThis() + "], with queues " + getQueueNames() + ".");
        synchronized (_stateLockObject) {
            if (_running) {
                log.info(LOG_PREFIX + ".. [" + idThis() + "] is already started, ignoring.");
                return;
            }
            try {
                _connection = _connectionFactory.newConnection(_name);
            }
            catch (TimeoutException e) {
                throw new IOException("Timed out creating Connection for [" + idThis() + "].", e);
            }
            try {
                _consumerChannel = _connection.createChannel();
                _publisherChannel = _connection.createChannel();
                if (_prefetch > 0) {
                    _consumerChannel.basicQos(_prefetch);
                }
                for (QueueRegistration registration : _queues.values()) {
                    startConsuming(registration);
                }
            }
            catch (IOException | RuntimeException e) {
                log.error(LOG_PREFIX + "Got [" + e.getClass().getSimpleName() + "] when starting [" + idThis()
                        + "], releasing what was set up.", e);
                releaseResources();
                throw e;
            }
            _running = true;
        }
        log.info(LOG_PREFIX + "Done. Started [" + idThis() + "].");
    }

    private void startConsuming(QueueRegistration registration) throws IOException {
        if (!Thread.holdsLock(_stateLockObject)) {
            throw new AssertionError("Should have held lock on '_stateLockObject'.");
        }
        String queueName = registration.getQueueName();
        QueueOptions queueOpts = registration.getQueueOpts();
        ConsumeOptions consumeOpts = registration.getConsumeOpts();

        _consumerChannel.queueDeclare(queueName, queueOpts.isDurable(), queueOpts.isExclusive(),
                queueOpts.isAutoDelete(), queueOpts.getArguments());

        // ?: Does this queue have its own prefetch?
        if (consumeOpts.getPrefetch() != null) {
            // -> Yes, so it applies to the consumer created next.
            _consumerChannel.basicQos(consumeOpts.getPrefetch());
        }
        String consumerTag = _consumerChannel.basicConsume(queueName, consumeOpts.isNoAck(),
                consumeOpts.getConsumerTag() == null ? "" : consumeOpts.getConsumerTag(), false,
                consumeOpts.isExclusive(), consumeOpts.getArguments(),
                (tag, delivery) -> handleDelivery(queueName, delivery),
                tag -> log.warn(LOG_PREFIX + "Consumer [" + tag + "] for queue [" + queueName + "] on [" + idThis()
                        + "] was cancelled by the broker."));
        // ?: Did the queue have its own prefetch?
        if (consumeOpts.getPrefetch() != null) {
            // -> Yes, so restore the application's prefetch for the subsequent consumers.
            _consumerChannel.basicQos(_prefetch);
        }
        _consumerTags.put(queueName, consumerTag);
        log.info(LOG_PREFIX + ".. consuming from queue [" + queueName + "], consumerTag [" + consumerTag + "], "
                + queueOpts + ", " + consumeOpts + ".");
    }

    /**
     * Processes one delivery from the given queue: runs the middlewares, then performs the acknowledgement. Invoked
     * by the consumer callback, and can be invoked directly with a delivery from elsewhere.
     *
     * @throws IOException
     *             if the acknowledgement could not be sent to the broker.
     */
    public void handleDelivery(String queueName, Delivery delivery) throws IOException {
        CoworkersMessage message = CoworkersMessage.of(delivery);
        RabbitCoworkersContext context = new RabbitCoworkersContext(this, queueName, message);

        List<Middleware> chainMiddlewares = new ArrayList<>(_middlewares);
        getQueueRegistration(queueName).ifPresent(reg -> chainMiddlewares.addAll(reg.getMiddlewares()));

        try {
            new MiddlewareChain(chainMiddlewares).run(context);
        }
        catch (Throwable t) {
            onError(context, t);
        }

        // ?: Is this queue consumed without acknowledgements?
        if (context.getConsumeOpts().isNoAck()) {
            // -> Yes, so the broker considers it done already.
            return;
        }

        Optional<AckIntent> ackIntent = context.resolveAckIntent();
        // ?: Did the middlewares decide on anything?
        if (ackIntent.isEmpty()) {
            // -> No, which is an error.
            onError(context, new NoAckDecisionException("No middleware decided whether to ack or nack the message"
                    + " with deliveryTag [" + context.getDeliveryTag() + "] from queue [" + queueName + "]."));
            ackIntent = context.resolveAckIntent();
        }

        try {
            applyAckIntent(_consumerChannel, context.getDeliveryTag(), ackIntent.get());
        }
        catch (IOException | RuntimeException e) {
            log.error(LOG_PREFIX + "Got [" + e.getClass().getSimpleName() + "] when performing [" + ackIntent.get()
                    + "] for " + context + ".", e);
            throw e;
        }
    }

    /**
     * The error path: logs, notifies the {@link ErrorListener}s, and decides the disposition of the message, after
     * which the context's ack, nack, ackAll and nackAll are no longer available.
     */
    public void onError(RabbitCoworkersContext context, Throwable throwable) {
        log.error(LOG_PREFIX + "Error when processing message on queue [" + context.getQueueName()
                + "], deliveryTag [" + context.getDeliveryTag() + "], in [" + idThis() + "].", throwable);
        for (ErrorListener listener : _errorListeners) {
            try {
                listener.onError(throwable, context);
            }
            catch (RuntimeException e) {
                log.error(LOG_PREFIX + "ErrorListener [" + listener + "] raised [" + e.getClass().getSimpleName()
                        + "], ignoring.", e);
            }
        }
        // ?: Has the error path already been run for this message?
        if (context.isAckIntentPoisoned()) {
            // -> Yes, so the disposition is already decided.
            return;
        }
        context.poisonAckIntent(AckIntent.nack(NackOptions.requeue(_requeueOnError)));
    }

    @Override
    public boolean isRunning() {
        return _running;
    }

    @Override
    public void close() throws IOException {
        log.info(LOG_PREFIX + getClass().getSimpleName() + ".close() invoked on [" + idThis() + "].");
        synchronized (_stateLockObject) {
            releaseResources();
        }
        try {
            _rpc.close();
        }
        catch (Exception e) {
            log.warn(LOG_PREFIX + "Got problems closing AmqpRpc [" + _rpc + "].", e);
        }
        log.info(LOG_PREFIX + "Done. Closed [" + idThis() + "].");
    }

    /**
     * Cancels the consumers, closes the channels and the connection, and clears the fields. Problems are logged.
     */
    private void releaseResources() {
        if (!Thread.holdsLock(_stateLockObject)) {
            throw new AssertionError("Should have held lock on '_stateLockObject'.");
        }
        if (_consumerChannel != null) {
            for (Map.Entry<String, String> entry : _consumerTags.entrySet()) {
                try {
                    _consumerChannel.basicCancel(entry.getValue());
                }
                catch (IOException | RuntimeException e) {
                    log.warn(LOG_PREFIX + "Got problems cancelling consumer [" + entry.getValue()
                            + "] for queue [" + entry.getKey() + "].", e);
                }
            }
        }
        _consumerTags.clear();
        closeChannel(_consumerChannel, "consumer");
        closeChannel(_publisherChannel, "publisher");
        if (_connection != null) {
            try {
                _connection.close();
            }
            catch (IOException | RuntimeException e) {
                log.warn(LOG_PREFIX + "Got problems closing Connection of [" + idThis() + "].", e);
            }
        }
        _consumerChannel = null;
        _publisherChannel = null;
        _connection = null;
        _running = false;
    }

    private void closeChannel(Channel channel, String which) {
        if ((channel == null) || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        }
        catch (IOException | TimeoutException | RuntimeException e) {
            log.warn(LOG_PREFIX + "Got problems closing " + which + " Channel of [" + idThis() + "].", e);
        }
    }

    private String idThis() {
        return id("CoworkersApplication", this) + "[" + _name + "]";
    }

    @Override
    public String toString() {
        return idThis();
    }

    private class RabbitCoworkersApplicationConfig implements ApplicationConfig {
        private final ConcurrentHashMap<String, Object> _attributes = new ConcurrentHashMap<>();

        @Override
        public String getName() {
            return _name;
        }

        @Override
        public ApplicationConfig setName(String name) {
            if (name == null) {
                throw new NullPointerException("name");
            }
            String idBefore = idThis();
            _name = name;
            log.info(LOG_PREFIX + "Set application name to [" + name + "]. Previous id: [" + idBefore + "]"
                    + " - new id: [" + idThis() + "].");
            return this;
        }

        @Override
        public int getPrefetch() {
            return _prefetch;
        }

        @Override
        public ApplicationConfig setPrefetch(int prefetch) {
            if (prefetch < 0) {
                throw new IllegalArgumentException("prefetch must be >= 0, was [" + prefetch + "].");
            }
            _prefetch = prefetch;
            return this;
        }

        @Override
        public boolean isRequeueOnError() {
            return _requeueOnError;
        }

        @Override
        public ApplicationConfig setRequeueOnError(boolean requeueOnError) {
            _requeueOnError = requeueOnError;
            return this;
        }

        @Override
        public ApplicationConfig setAttribute(String key, Object value) {
            if (key == null) {
                throw new NullPointerException("key");
            }
            if (value == null) {
                _attributes.remove(key);
            }
            else {
                _attributes.put(key, value);
            }
            return this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T getAttribute(String key) {
            return (T) _attributes.get(key);
        }
    }
}
