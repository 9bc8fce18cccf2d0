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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import io.coworkers.Middleware.ErrorListener;
import io.coworkers.serial.CoworkersSerializer;

/**
 * The application: owns the connection and the two channels (one consuming, one publishing), holds the registered
 * queues with their middlewares, and the context properties which are copied into every {@link CoworkersContext}.
 * <p />
 * Usage: create, {@link #use(Middleware) add application-wide middlewares}, {@link #queue(String, QueueOptions,
 * ConsumeOptions, Middleware...) register queues}, then {@link #start()}. Each delivery on a registered queue gets a
 * fresh context which is run through the application-wide middlewares followed by the queue's middlewares, after which
 * the recorded acknowledgement intent is applied to the consumer channel.
 */
public interface CoworkersApplication extends AutoCloseable {

    /**
     * The context property key which is never copied into a context, as the context's own "app" is the application.
     */
    String RESERVED_APP_KEY = "app";

    ApplicationConfig getConfig();

    /**
     * @return the connection, <code>null</code> if not started.
     */
    Connection getConnection();

    /**
     * @return the channel which consumes from the registered queues and acknowledges, <code>null</code> if not started.
     */
    Channel getConsumerChannel();

    /**
     * @return the channel used by the publish helpers, <code>null</code> if not started.
     */
    Channel getPublisherChannel();

    AmqpRpc getRpc();

    CoworkersSerializer getSerializer();

    // ===== Context properties

    /**
     * Sets a property which is copied into every context created after this call. A <code>null</code> value removes the
     * property.
     *
     * @throws IllegalArgumentException
     *             if the key is the reserved {@link #RESERVED_APP_KEY "app"}, which on a context always refers to the
     *             application itself.
     */
    CoworkersApplication setContextProperty(String key, Object value);

    /**
     * @return an unmodifiable snapshot of the context properties.
     */
    Map<String, Object> getContextProperties();

    // ===== Middlewares and queues

    /**
     * Adds an application-wide middleware, which runs before the queue-specific middlewares for every queue.
     */
    CoworkersApplication use(Middleware middleware);

    /**
     * Registers a queue with its default options and its middlewares.
     *
     * @throws IllegalArgumentException
     *             if no middleware is given.
     * @throws IllegalStateException
     *             if the queue is already registered, or the application is started.
     */
    CoworkersApplication queue(String queueName, QueueOptions queueOpts, ConsumeOptions consumeOpts,
            Middleware... middlewares);

    Optional<QueueRegistration> getQueueRegistration(String queueName);

    List<String> getQueueNames();

    List<Middleware> getMiddlewares();

    CoworkersApplication addErrorListener(ErrorListener listener);

    // ===== Lifecycle

    /**
     * Connects, creates the channels, declares every registered queue and starts consuming.
     */
    void start() throws IOException;

    boolean isRunning();

    /**
     * Stops consuming and closes channels, connection and the RPC collaborator. Idempotent.
     */
    @Override
    void close() throws IOException;

    /**
     * Configuration of the application. Like the rest of the application, it should be set up before start.
     */
    interface ApplicationConfig {
        String getName();

        ApplicationConfig setName(String name);

        /**
         * @return the prefetch applied to the consumer channel with <code>basicQos</code>; 0 means unlimited, which is
         *         the default.
         */
        int getPrefetch();

        ApplicationConfig setPrefetch(int prefetch);

        /**
         * @return whether the default nack on the error path requeues the message. Default <code>false</code>.
         */
        boolean isRequeueOnError();

        ApplicationConfig setRequeueOnError(boolean requeueOnError);

        /**
         * Sets an attribute, e.g. for use by middlewares. A <code>null</code> value clears it.
         */
        ApplicationConfig setAttribute(String key, Object value);

        <T> T getAttribute(String key);

        default <T> Optional<T> getAttribute(String key, Class<T> type) {
            Object value = getAttribute(key);
            if (value == null) {
                return Optional.empty();
            }
            if (!type.isInstance(value)) {
                throw new ClassCastException("Attribute with key '" + key + "' is not of type " + type.getName()
                        + ", but " + value.getClass().getName());
            }
            return Optional.of(type.cast(value));
        }
    }

    /**
     * A queue as registered with {@link #queue(String, QueueOptions, ConsumeOptions, Middleware...)}.
     */
    final class QueueRegistration {
        private final String _queueName;
        private final QueueOptions _queueOpts;
        private final ConsumeOptions _consumeOpts;
        private final List<Middleware> _middlewares;

        public QueueRegistration(String queueName, QueueOptions queueOpts, ConsumeOptions consumeOpts,
                List<Middleware> middlewares) {
            _queueName = queueName;
            _queueOpts = queueOpts == null ? QueueOptions.empty() : queueOpts;
            _consumeOpts = consumeOpts == null ? ConsumeOptions.empty() : consumeOpts;
            _middlewares = List.copyOf(middlewares);
        }

        public String getQueueName() {
            return _queueName;
        }

        public QueueOptions getQueueOpts() {
            return _queueOpts;
        }

        public ConsumeOptions getConsumeOpts() {
            return _consumeOpts;
        }

        public List<Middleware> getMiddlewares() {
            return _middlewares;
        }

        @Override
        public String toString() {
            return "QueueRegistration{'" + _queueName + "', " + _queueOpts + ", " + _consumeOpts
                    + ", middlewares:" + _middlewares.size() + "}";
        }
    }

    /**
     * The error raised when the middleware chain completes for a message that requires acknowledgement, but no
     * middleware recorded an acknowledgement intent.
     */
    class NoAckDecisionException extends RuntimeException {
        public NoAckDecisionException(String message) {
            super(message);
        }
    }
}
