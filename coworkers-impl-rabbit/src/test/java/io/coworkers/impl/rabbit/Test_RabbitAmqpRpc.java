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

import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.RpcClient;
import com.rabbitmq.client.RpcClient.Response;
import com.rabbitmq.client.RpcClientParams;

import io.coworkers.AmqpRpc.RpcRequestOptions;
import io.coworkers.CoworkersMessage;
import io.coworkers.QueueOptions;
import io.coworkers.serial.json.CoworkersSerializerJson;

/**
 * Tests {@link RabbitAmqpRpc}, with the {@link RpcClient} replaced by a mock.
 */
public class Test_RabbitAmqpRpc {

    private final Connection _connection = Mockito.mock(Connection.class);
    private final Channel _channel = Mockito.mock(Channel.class);
    private final RpcClient _rpcClient = Mockito.mock(RpcClient.class);
    private final List<RpcClientParams> _createdWith = new CopyOnWriteArrayList<>();

    private ExecutorService _executor;
    private RabbitAmqpRpc _rpc;

    @Before
    public void setup() throws Exception {
        Mockito.when(_connection.createChannel()).thenReturn(_channel);
        Mockito.when(_channel.isOpen()).thenReturn(true);
        _executor = Executors.newSingleThreadExecutor();
        _rpc = new RabbitAmqpRpc(CoworkersSerializerJson.create(), _executor, true) {
            @Override
            protected RpcClient createRpcClient(RpcClientParams params) {
                _createdWith.add(params);
                return _rpcClient;
            }
        };
    }

    @After
    public void shutdown() {
        _rpc.close();
        _executor.shutdownNow();
    }

    // ===== reply

    @Test
    public void replyPublishesToReplyToWithCorrelationId() throws Exception {
        CoworkersMessage request = new CoworkersMessage(new Envelope(1L, false, "", "rpc-queue"),
                new BasicProperties.Builder().replyTo("reply-queue").correlationId("correlation-1").build(),
                new byte[0]);
        BasicProperties options = new BasicProperties.Builder().contentType("text/plain").build();

        _rpc.reply(_channel, request, "the answer", options);

        ArgumentCaptor<BasicProperties> props = ArgumentCaptor.forClass(BasicProperties.class);
        Mockito.verify(_channel).basicPublish(eq(""), eq("reply-queue"), props.capture(),
                aryEq("the answer".getBytes(StandardCharsets.UTF_8)));
        Assert.assertEquals("correlation-1", props.getValue().getCorrelationId());
        Assert.assertEquals("text/plain", props.getValue().getContentType());
    }

    @Test
    public void replyWithoutOptions() throws Exception {
        CoworkersMessage request = new CoworkersMessage(new Envelope(1L, false, "", "rpc-queue"),
                new BasicProperties.Builder().replyTo("reply-queue").build(), new byte[0]);

        _rpc.reply(_channel, request, "the answer", null);

        Mockito.verify(_channel).basicPublish(eq(""), eq("reply-queue"), any(BasicProperties.class),
                aryEq("the answer".getBytes(StandardCharsets.UTF_8)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void replyWithoutReplyToIsRejected() throws Exception {
        CoworkersMessage request = new CoworkersMessage(new Envelope(1L, false, "", "rpc-queue"),
                new BasicProperties.Builder().build(), new byte[0]);
        _rpc.reply(_channel, request, "the answer", null);
    }

    // ===== request

    @Test
    public void requestUsesDirectReplyToByDefault() throws Exception {
        byte[] content = "question".getBytes(StandardCharsets.UTF_8);
        BasicProperties sendOpts = new BasicProperties.Builder().build();
        Envelope replyEnvelope = new Envelope(9L, false, "", "amq.rabbitmq.reply-to.xyz");
        BasicProperties replyProps = new BasicProperties.Builder().correlationId("1").build();
        Mockito.when(_rpcClient.doCall(same(sendOpts), aryEq(content)))
                .thenReturn(new Response("consumer-tag", replyEnvelope, replyProps,
                        "answer".getBytes(StandardCharsets.UTF_8)));

        CoworkersMessage reply = _rpc.request(_connection, "rpc-queue", content,
                new RpcRequestOptions(sendOpts, null, null)).get(5, TimeUnit.SECONDS);

        Assert.assertEquals("answer", reply.getContentAsString());
        Assert.assertSame(replyEnvelope, reply.getFields());
        Assert.assertSame(replyProps, reply.getProperties());

        RpcClientParams params = _createdWith.get(0);
        Assert.assertSame(_channel, params.getChannel());
        Assert.assertEquals("", params.getExchange());
        Assert.assertEquals("rpc-queue", params.getRoutingKey());
        Assert.assertEquals(RabbitAmqpRpc.DIRECT_REPLY_TO_QUEUE, params.getReplyTo());
        Assert.assertEquals(RabbitAmqpRpc.DEFAULT_TIMEOUT.toMillis(), params.getTimeout());
        Mockito.verify(_channel, Mockito.never()).queueDeclare(any(), Mockito.anyBoolean(), Mockito.anyBoolean(),
                Mockito.anyBoolean(), any());
        Mockito.verify(_rpcClient).close();
        Mockito.verify(_channel).close();
    }

    @Test
    public void requestWithQueueOptionsDeclaresReplyQueue() throws Exception {
        AMQP.Queue.DeclareOk declareOk = Mockito.mock(AMQP.Queue.DeclareOk.class);
        Mockito.when(declareOk.getQueue()).thenReturn("amq.gen-reply");
        Mockito.when(_channel.queueDeclare(eq(""), eq(false), eq(false), eq(true), any())).thenReturn(declareOk);
        Mockito.when(_rpcClient.doCall(any(), any())).thenReturn(new Response("consumer-tag",
                new Envelope(1L, false, "", "amq.gen-reply"), new BasicProperties.Builder().build(), new byte[0]));

        _rpc.request(_connection, "rpc-queue", new byte[0],
                new RpcRequestOptions(null, QueueOptions.empty().exclusive(false), null, Duration.ofSeconds(2)))
                .get(5, TimeUnit.SECONDS);

        RpcClientParams params = _createdWith.get(0);
        Assert.assertEquals("amq.gen-reply", params.getReplyTo());
        Assert.assertEquals(2000, params.getTimeout());
    }

    @Test
    public void requestTimeoutFailsFuture() throws Exception {
        TimeoutException timeout = new TimeoutException("no reply");
        Mockito.when(_rpcClient.doCall(any(), any())).thenThrow(timeout);

        CompletableFuture<CoworkersMessage> future = _rpc.request(_connection, "rpc-queue", new byte[0], null);

        try {
            future.get(5, TimeUnit.SECONDS);
            Assert.fail("Expected ExecutionException");
        }
        catch (ExecutionException e) {
            Assert.assertSame(timeout, e.getCause());
        }
        Mockito.verify(_channel).close();
    }

    @Test(expected = NullPointerException.class)
    public void requestRequiresContent() {
        _rpc.request(_connection, "rpc-queue", null, null);
    }

    @Test
    public void closeShutsDownExecutor() {
        _rpc.close();
        Assert.assertTrue(_executor.isShutdown());
    }

    @Test
    public void closeLeavesProvidedExecutorRunning() {
        ExecutorService provided = Executors.newSingleThreadExecutor();
        try {
            RabbitAmqpRpc.create(CoworkersSerializerJson.create(), provided).close();
            Assert.assertFalse(provided.isShutdown());
        }
        finally {
            provided.shutdownNow();
        }
    }
}
