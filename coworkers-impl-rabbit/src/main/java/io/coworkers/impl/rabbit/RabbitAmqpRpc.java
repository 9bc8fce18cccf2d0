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
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.RpcClient;
import com.rabbitmq.client.RpcClient.Response;
import com.rabbitmq.client.RpcClientParams;

import io.coworkers.AmqpRpc;
import io.coworkers.CoworkersMessage;
import io.coworkers.QueueOptions;
import io.coworkers.serial.CoworkersSerializer;

/**
 * {@link AmqpRpc} on top of the RabbitMQ Java client's {@link RpcClient}, which handles the correlation of requests
 * and replies.
 * <p />
 * A request gets its own channel, closed when the reply has arrived or the request has failed. Replies are consumed
 * using RabbitMQ's direct reply-to pseudo queue, unless queue options are supplied with the request, in which case a
 * server-named reply queue is declared using them (over the defaults non-durable, exclusive, auto-delete). The
 * blocking call runs on an executor, the result being delivered through the returned {@link CompletableFuture}.
 */
public class RabbitAmqpRpc implements AmqpRpc, RabbitCoworkersStatics {

    private static final Logger log = LoggerFactory.getLogger(RabbitAmqpRpc.class);

    static final String DIRECT_REPLY_TO_QUEUE = "amq.rabbitmq.reply-to";

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final QueueOptions DEFAULT_REPLY_QUEUE_OPTIONS = QueueOptions.empty()
            .durable(false)
            .exclusive(true)
            .autoDelete(true);

    private final CoworkersSerializer _serializer;
    private final ExecutorService _executor;
    private final boolean _ownsExecutor;

    /**
     * Creates a {@link RabbitAmqpRpc} running requests on its own pool of daemon threads, shut down by
     * {@link #close()}.
     */
    public static RabbitAmqpRpc create(CoworkersSerializer serializer) {
        return new RabbitAmqpRpc(serializer, createDefaultExecutor(), true);
    }

    /**
     * Creates a {@link RabbitAmqpRpc} running requests on the given executor, which the caller owns: {@link #close()}
     * does not shut it down.
     */
    public static RabbitAmqpRpc create(CoworkersSerializer serializer, ExecutorService executor) {
        return new RabbitAmqpRpc(serializer, executor, false);
    }

    protected RabbitAmqpRpc(CoworkersSerializer serializer, ExecutorService executor, boolean ownsExecutor) {
        if (serializer == null) {
            throw new NullPointerException("serializer");
        }
        if (executor == null) {
            throw new NullPointerException("executor");
        }
        _serializer = serializer;
        _executor = executor;
        _ownsExecutor = ownsExecutor;
    }

    private static ExecutorService createDefaultExecutor() {
        AtomicInteger threadNumber = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, THREAD_PREFIX + "rpc-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void reply(Channel channel, CoworkersMessage requestMessage, Object content, BasicProperties options)
            throws IOException {
        BasicProperties requestProperties = requestMessage.getProperties();
        String replyTo = requestProperties == null ? null : requestProperties.getReplyTo();
        if (replyTo == null) {
            throw new IllegalArgumentException("Cannot reply to message [" + requestMessage
                    + "], since it has no replyTo property.");
        }
        AMQP.BasicProperties.Builder builder = options == null
                ? new AMQP.BasicProperties.Builder()
                : options.builder();
        BasicProperties replyProperties = builder.correlationId(requestProperties.getCorrelationId()).build();
        byte[] bytes = _serializer.serializeContent(content);
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Replying to [" + replyTo + "], correlationId ["
                + replyProperties.getCorrelationId() + "], [" + bytes.length + "] bytes.");
        channel.basicPublish("", replyTo, replyProperties, bytes);
    }

    @Override
    public CompletableFuture<CoworkersMessage> request(Connection connection, String queueName, byte[] content,
            RpcRequestOptions options) {
        if (connection == null) {
            throw new NullPointerException("connection");
        }
        if (queueName == null) {
            throw new NullPointerException("queueName");
        }
        if (content == null) {
            throw new NullPointerException("content");
        }
        RpcRequestOptions effectiveOptions = options == null
                ? new RpcRequestOptions(null, null, null)
                : options;
        return CompletableFuture.supplyAsync(() -> {
            try {
                return doRequest(connection, queueName, content, effectiveOptions);
            }
            catch (IOException | TimeoutException e) {
                throw new CompletionException(e);
            }
        }, _executor);
    }

    private CoworkersMessage doRequest(Connection connection, String queueName, byte[] content,
            RpcRequestOptions options) throws IOException, TimeoutException {
        Duration timeout = options.getTimeout() == null ? DEFAULT_TIMEOUT : options.getTimeout();
        Channel channel = connection.createChannel();
        try {
            String replyTo = DIRECT_REPLY_TO_QUEUE;
            // ?: Were queue options given for the reply queue?
            if (options.getQueueOpts() != null) {
                // -> Yes, so declare a server-named reply queue with them.
                QueueOptions replyQueueOpts = DEFAULT_REPLY_QUEUE_OPTIONS.mergedWith(options.getQueueOpts());
                replyTo = channel.queueDeclare("", replyQueueOpts.isDurable(), replyQueueOpts.isExclusive(),
                        replyQueueOpts.isAutoDelete(), replyQueueOpts.getArguments()).getQueue();
            }
            RpcClientParams params = new RpcClientParams()
                    .channel(channel)
                    .exchange("")
                    .routingKey(queueName)
                    .replyTo(replyTo)
                    .timeout((int) timeout.toMillis());
            RpcClient rpcClient = createRpcClient(params);
            try {
                if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Requesting on queue [" + queueName
                        + "], replyTo [" + replyTo + "], timeout [" + timeout + "].");
                Response response = rpcClient.doCall(options.getSendOpts(), content);
                return new CoworkersMessage(response.getEnvelope(), response.getProperties(), response.getBody());
            }
            finally {
                rpcClient.close();
            }
        }
        finally {
            closeQuietly(channel);
        }
    }

    /**
     * Creates the {@link RpcClient} for one request. Overridable for tests.
     */
    protected RpcClient createRpcClient(RpcClientParams params) throws IOException {
        return new RpcClient(params);
    }

    private void closeQuietly(Channel channel) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        }
        catch (IOException | TimeoutException | RuntimeException e) {
            log.warn(LOG_PREFIX + "Got problems closing RPC request Channel [" + channel + "].", e);
        }
    }

    @Override
    public void close() {
        // ?: Did we create the executor?
        if (!_ownsExecutor) {
            // -> No, so it is the caller's to shut down.
            log.info(LOG_PREFIX + "Closing [" + this + "], leaving the provided executor running.");
            return;
        }
        log.info(LOG_PREFIX + "Closing [" + this + "], shutting down executor.");
        _executor.shutdown();
    }

    @Override
    public String toString() {
        return id("RabbitAmqpRpc", this);
    }
}
