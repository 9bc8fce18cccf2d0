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
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * The request/reply collaborator: correlates requests sent to a queue with their replies, and answers requests that
 * arrived carrying a <code>replyTo</code>. The context only forwards to this.
 */
public interface AmqpRpc extends AutoCloseable {

    /**
     * Replies to an RPC request message.
     *
     * @param channel
     *            the channel to publish the reply on.
     * @param requestMessage
     *            the incoming request, whose <code>replyTo</code> and <code>correlationId</code> properties address the
     *            reply.
     * @param content
     *            the reply content, converted with {@link io.coworkers.serial.CoworkersSerializer#serializeContent(Object)}.
     * @param options
     *            properties for the reply message, may be <code>null</code>.
     * @throws IOException
     *             if the publish fails.
     */
    void reply(Channel channel, CoworkersMessage requestMessage, Object content, BasicProperties options)
            throws IOException;

    /**
     * Sends an RPC request to the given queue, and returns a future which completes with the reply message. Any
     * failure, including timeout, completes the future exceptionally.
     */
    CompletableFuture<CoworkersMessage> request(Connection connection, String queueName, byte[] content,
            RpcRequestOptions options);

    /**
     * Releases any resources, e.g. threads. Outstanding requests are not waited for.
     */
    @Override
    default void close() {
        /* no-op */
    }

    /**
     * The options bundle of a request: properties of the request message, options for the reply queue and for
     * consuming from it, and how long to wait for the reply. The timeout must be between zero and
     * {@link Integer#MAX_VALUE} milliseconds, otherwise construction throws {@link IllegalArgumentException}.
     */
    final class RpcRequestOptions {
        static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

        private final BasicProperties _sendOpts;
        private final QueueOptions _queueOpts;
        private final ConsumeOptions _consumeOpts;
        private final Duration _timeout;

        public RpcRequestOptions(BasicProperties sendOpts, QueueOptions queueOpts, ConsumeOptions consumeOpts) {
            this(sendOpts, queueOpts, consumeOpts, null);
        }

        public RpcRequestOptions(BasicProperties sendOpts, QueueOptions queueOpts, ConsumeOptions consumeOpts,
                Duration timeout) {
            // ?: Does the timeout fit in the int milliseconds the RabbitMQ client takes?
            if ((timeout != null) && (timeout.isNegative() || (timeout.compareTo(MAX_TIMEOUT) > 0))) {
                // -> No, so reject it.
                throw new IllegalArgumentException("timeout must be between 0 and " + Integer.MAX_VALUE
                        + " ms, was [" + timeout + "].");
            }
            _sendOpts = sendOpts;
            _queueOpts = queueOpts;
            _consumeOpts = consumeOpts;
            _timeout = timeout;
        }

        public BasicProperties getSendOpts() {
            return _sendOpts;
        }

        public QueueOptions getQueueOpts() {
            return _queueOpts;
        }

        public ConsumeOptions getConsumeOpts() {
            return _consumeOpts;
        }

        /**
         * @return the timeout, or <code>null</code> for the collaborator's default.
         */
        public Duration getTimeout() {
            return _timeout;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RpcRequestOptions)) {
                return false;
            }
            RpcRequestOptions that = (RpcRequestOptions) o;
            return Objects.equals(_sendOpts, that._sendOpts)
                    && Objects.equals(_queueOpts, that._queueOpts)
                    && Objects.equals(_consumeOpts, that._consumeOpts)
                    && Objects.equals(_timeout, that._timeout);
        }

        @Override
        public int hashCode() {
            return Objects.hash(_sendOpts, _queueOpts, _consumeOpts, _timeout);
        }

        @Override
        public String toString() {
            return "RpcRequestOptions{sendOpts:" + _sendOpts + ", queueOpts:" + _queueOpts
                    + ", consumeOpts:" + _consumeOpts + ", timeout:" + _timeout + "}";
        }
    }
}
