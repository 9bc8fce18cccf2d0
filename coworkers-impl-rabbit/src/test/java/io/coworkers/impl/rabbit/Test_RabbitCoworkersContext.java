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
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Envelope;

import io.coworkers.AckIntent;
import io.coworkers.AckOptions;
import io.coworkers.AmqpRpc;
import io.coworkers.AmqpRpc.RpcRequestOptions;
import io.coworkers.ConsumeOptions;
import io.coworkers.CoworkersApplication;
import io.coworkers.CoworkersApplication.QueueRegistration;
import io.coworkers.CoworkersContext;
import io.coworkers.CoworkersContext.AckNotAvailableException;
import io.coworkers.CoworkersMessage;
import io.coworkers.Middleware;
import io.coworkers.NackOptions;
import io.coworkers.QueueOptions;
import io.coworkers.serial.json.CoworkersSerializerJson;

/**
 * Tests {@link RabbitCoworkersContext} against a mocked application, channels and rpc.
 */
public class Test_RabbitCoworkersContext {

    private static final String QUEUE = "orders";

    private final CoworkersApplication _app = Mockito.mock(CoworkersApplication.class);
    private final Connection _connection = Mockito.mock(Connection.class);
    private final Channel _consumerChannel = Mockito.mock(Channel.class);
    private final Channel _publisherChannel = Mockito.mock(Channel.class);
    private final AmqpRpc _rpc = Mockito.mock(AmqpRpc.class);

    private final BasicProperties _properties = new BasicProperties.Builder()
            .replyTo("reply-queue")
            .correlationId("correlation")
            .build();

    private CoworkersMessage _message;

    @Before
    public void setupApplication() {
        Map<String, Object> appProperties = new LinkedHashMap<>();
        appProperties.put("foo", "bar");
        appProperties.put("count", 42);
        // Cannot get here through a real application, but must never be copied in any case.
        appProperties.put(CoworkersApplication.RESERVED_APP_KEY, "not the app");

        Mockito.when(_app.getContextProperties()).thenReturn(appProperties);
        Mockito.when(_app.getConnection()).thenReturn(_connection);
        Mockito.when(_app.getConsumerChannel()).thenReturn(_consumerChannel);
        Mockito.when(_app.getPublisherChannel()).thenReturn(_publisherChannel);
        Mockito.when(_app.getRpc()).thenReturn(_rpc);
        Mockito.when(_app.getSerializer()).thenReturn(CoworkersSerializerJson.create());
        Middleware middleware = (context, next) -> next.proceed();
        Mockito.when(_app.getQueueRegistration(QUEUE)).thenReturn(Optional.of(new QueueRegistration(QUEUE,
                QueueOptions.empty().durable(false), ConsumeOptions.empty().prefetch(10), List.of(middleware))));

        _message = new CoworkersMessage(new Envelope(7L, false, "exchange", "routing.key"), _properties,
                "{\"orderId\":\"abc\"}".getBytes(StandardCharsets.UTF_8));
    }

    private RabbitCoworkersContext createContext() {
        return new RabbitCoworkersContext(_app, QUEUE, _message);
    }

    // ===== Construction

    @Test
    public void constructionCopiesPropertiesButKeepsAppReference() {
        RabbitCoworkersContext context = createContext();

        Assert.assertEquals("bar", context.getProperty("foo"));
        Assert.assertEquals(Integer.valueOf(42), context.getProperty("count", Integer.class).get());
        Assert.assertSame(_app, context.getProperty(CoworkersApplication.RESERVED_APP_KEY));
        Assert.assertSame(_app, context.getApp());
        Assert.assertEquals(3, context.getProperties().size());
    }

    @Test
    public void propertiesAreCopiedNotShared() {
        RabbitCoworkersContext first = createContext();
        RabbitCoworkersContext second = createContext();

        first.setProperty("foo", "changed");
        Assert.assertEquals("changed", first.getProperty("foo"));
        Assert.assertEquals("bar", second.getProperty("foo"));
        Assert.assertEquals("bar", _app.getContextProperties().get("foo"));
    }

    @Test
    public void constructionTakesResourcesFromApplication() {
        RabbitCoworkersContext context = createContext();

        Assert.assertSame(_connection, context.getConnection());
        Assert.assertSame(_consumerChannel, context.getConsumerChannel());
        Assert.assertSame(_publisherChannel, context.getPublisherChannel());
        Assert.assertEquals(QUEUE, context.getQueueName());
        Assert.assertSame(_message, context.getMessage());
        Assert.assertEquals(7L, context.getDeliveryTag());
        Assert.assertTrue(context.getState().isEmpty());
    }

    @Test
    public void messageReferencesItsContext() {
        RabbitCoworkersContext context = createContext();
        Assert.assertSame(context, _message.getContext());
    }

    @Test
    public void optionsAreMergedWithOverrides() {
        RabbitCoworkersContext context = new RabbitCoworkersContext(_app, QUEUE, _message,
                QueueOptions.empty().exclusive(true), ConsumeOptions.empty().noAck(true));

        Assert.assertFalse(context.getQueueOpts().isDurable());
        Assert.assertTrue(context.getQueueOpts().isExclusive());
        Assert.assertEquals(Integer.valueOf(10), context.getConsumeOpts().getPrefetch());
        Assert.assertTrue(context.getConsumeOpts().isNoAck());
    }

    @Test
    public void unregisteredQueueGetsEmptyOptions() {
        RabbitCoworkersContext context = new RabbitCoworkersContext(_app, "unknown", _message);

        Assert.assertEquals(QueueOptions.empty(), context.getQueueOpts());
        Assert.assertEquals(ConsumeOptions.empty(), context.getConsumeOpts());
    }

    @Test(expected = NullPointerException.class)
    public void messageWithoutFieldsIsRejected() {
        new RabbitCoworkersContext(_app, QUEUE, new CoworkersMessage(null, _properties, new byte[0]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void appPropertyKeyIsReserved() {
        createContext().setProperty(CoworkersApplication.RESERVED_APP_KEY, "something");
    }

    @Test
    public void stateIsMutableAndPerContext() {
        RabbitCoworkersContext first = createContext();
        first.getState().put("user", "endre");

        Assert.assertEquals("endre", first.getState().get("user"));
        Assert.assertTrue(createContext().getState().isEmpty());
    }

    // ===== Acknowledgement intent

    @Test
    public void freshContextHasNoAckIntent() {
        RabbitCoworkersContext context = createContext();

        assertOnlyKind(context, null);
        Assert.assertFalse(context.getAckIntent().isPresent());
        Assert.assertFalse(context.resolveAckIntent().isPresent());
    }

    @Test
    public void ackIsTheOnlyReadableKindAfterSetAck() {
        RabbitCoworkersContext context = createContext();
        context.setAck(AckOptions.allUpTo(true));

        assertOnlyKind(context, AckIntent.Kind.ACK);
        Assert.assertEquals(AckOptions.allUpTo(true), context.getAck().get());
    }

    @Test
    public void nackIsTheOnlyReadableKindAfterSetNack() {
        RabbitCoworkersContext context = createContext();
        context.setNack(NackOptions.requeue(false));

        assertOnlyKind(context, AckIntent.Kind.NACK);
        Assert.assertEquals(NackOptions.requeue(false), context.getNack().get());
    }

    @Test
    public void ackAllIsTheOnlyReadableKindAfterSetAckAll() {
        RabbitCoworkersContext context = createContext();
        context.setAckAll(true);

        assertOnlyKind(context, AckIntent.Kind.ACK_ALL);
        Assert.assertEquals(AckOptions.empty(), context.getAckAll().get());
    }

    @Test
    public void nackAllIsTheOnlyReadableKindAfterSetNackAll() {
        RabbitCoworkersContext context = createContext();
        context.setNackAll(NackOptions.requeue(true));

        assertOnlyKind(context, AckIntent.Kind.NACK_ALL);
        Assert.assertEquals(NackOptions.requeue(true), context.getNackAll().get());
    }

    @Test
    public void lastSetterWins() {
        RabbitCoworkersContext context = createContext();
        context.setAck(AckOptions.empty());
        context.setNackAll(true);
        context.setNack(NackOptions.empty());

        assertOnlyKind(context, AckIntent.Kind.NACK);
        Assert.assertEquals(AckIntent.nack(NackOptions.empty()), context.resolveAckIntent().get());
    }

    @Test
    public void falsySetterClearsWhateverKindIsSet() {
        RabbitCoworkersContext context = createContext();

        context.setAck(AckOptions.empty());
        context.setNack(null);
        assertOnlyKind(context, null);

        context.setNackAll(true);
        context.setAckAll(false);
        assertOnlyKind(context, null);

        context.setAckAll(true);
        context.setNackAll(false);
        assertOnlyKind(context, null);
    }

    @Test
    public void poisonedContextRefusesAllAckAccess() {
        RabbitCoworkersContext context = createContext();
        context.setAck(AckOptions.empty());
        AckIntent disposition = AckIntent.nack(NackOptions.requeue(false));
        context.poisonAckIntent(disposition);

        Assert.assertTrue(context.isAckIntentPoisoned());
        Assert.assertEquals(disposition, context.resolveAckIntent().get());

        assertNotAvailable(() -> context.getAck());
        assertNotAvailable(() -> context.getNack());
        assertNotAvailable(() -> context.getAckAll());
        assertNotAvailable(() -> context.getNackAll());
        assertNotAvailable(() -> context.getAckIntent());
        assertNotAvailable(() -> context.setAck(AckOptions.empty()));
        assertNotAvailable(() -> context.setNack(NackOptions.empty()));
        assertNotAvailable(() -> context.setAckAll(true));
        assertNotAvailable(() -> context.setNackAll(false));

        // Nothing changed by the attempts
        Assert.assertEquals(disposition, context.resolveAckIntent().get());
    }

    @Test(expected = IllegalStateException.class)
    public void poisoningTwiceIsRejected() {
        RabbitCoworkersContext context = createContext();
        context.poisonAckIntent(AckIntent.nack(NackOptions.empty()));
        context.poisonAckIntent(AckIntent.ack(AckOptions.empty()));
    }

    private void assertOnlyKind(CoworkersContext context, AckIntent.Kind kind) {
        Assert.assertEquals(kind == AckIntent.Kind.ACK, context.getAck().isPresent());
        Assert.assertEquals(kind == AckIntent.Kind.NACK, context.getNack().isPresent());
        Assert.assertEquals(kind == AckIntent.Kind.ACK_ALL, context.getAckAll().isPresent());
        Assert.assertEquals(kind == AckIntent.Kind.NACK_ALL, context.getNackAll().isPresent());
    }

    private void assertNotAvailable(Runnable access) {
        try {
            access.run();
            Assert.fail("Expected AckNotAvailableException");
        }
        catch (AckNotAvailableException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().matches("(?s)Ack.*not available.*"));
        }
    }

    // ===== Messaging helpers

    @Test
    public void publishSerializesRawAndUsesPublisherChannel() throws Exception {
        RabbitCoworkersContext context = createContext();
        BasicProperties props = new BasicProperties.Builder().contentType("text/plain").build();

        context.publish("exchange", "routing.key", "content", props);

        Mockito.verify(_publisherChannel).basicPublish(eq("exchange"), eq("routing.key"), same(props),
                aryEq("content".getBytes(StandardCharsets.UTF_8)));
        Mockito.verifyNoInteractions(_consumerChannel);
    }

    @Test
    public void sendToQueueSerializesJsonOnDefaultExchange() throws Exception {
        RabbitCoworkersContext context = createContext();
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("foo", 1);

        context.sendToQueue("other-queue", content, null);

        Mockito.verify(_publisherChannel).basicPublish(eq(""), eq("other-queue"), Mockito.isNull(),
                aryEq("{\"foo\":1}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void replyDelegatesToRpcWithPublisherChannel() throws Exception {
        RabbitCoworkersContext context = createContext();
        BasicProperties props = new BasicProperties.Builder().build();

        context.reply("the reply", props);

        Mockito.verify(_rpc).reply(same(_publisherChannel), same(_message), eq("the reply"), same(props));
    }

    @Test
    public void requestDelegatesToRpcWithConnection() {
        RabbitCoworkersContext context = createContext();
        BasicProperties sendOpts = new BasicProperties.Builder().build();
        QueueOptions queueOpts = QueueOptions.empty().durable(false);
        ConsumeOptions consumeOpts = ConsumeOptions.empty();
        CompletableFuture<CoworkersMessage> future = new CompletableFuture<>();
        Mockito.when(_rpc.request(Mockito.any(), Mockito.anyString(), Mockito.any(), Mockito.any()))
                .thenReturn(future);

        CompletableFuture<CoworkersMessage> result = context.request("rpc-queue", "question", sendOpts, queueOpts,
                consumeOpts);

        Assert.assertSame(future, result);
        Mockito.verify(_rpc).request(same(_connection), eq("rpc-queue"),
                aryEq("question".getBytes(StandardCharsets.UTF_8)),
                eq(new RpcRequestOptions(sendOpts, queueOpts, consumeOpts)));
    }

    @Test
    public void requestFailureIsDeliveredThroughFuture() {
        RabbitCoworkersContext context = createContext();

        CompletableFuture<CoworkersMessage> result = context.request("rpc-queue", null, null, null, null);

        Assert.assertTrue(result.isCompletedExceptionally());
        Mockito.verifyNoInteractions(_rpc);
    }

    @Test
    public void publishAndSendToQueuePropagateChannelFailure() throws Exception {
        RabbitCoworkersContext context = createContext();
        IOException channelFailure = new IOException("channel closed");
        Mockito.doThrow(channelFailure).when(_publisherChannel).basicPublish(Mockito.anyString(),
                Mockito.anyString(), Mockito.any(), Mockito.any());

        try {
            context.publish("exchange", "routing.key", "content", null);
            Assert.fail("Expected publish to throw");
        }
        catch (IOException e) {
            Assert.assertSame(channelFailure, e);
        }
        try {
            context.sendToQueue("other-queue", "content", null);
            Assert.fail("Expected sendToQueue to throw");
        }
        catch (IOException e) {
            Assert.assertSame(channelFailure, e);
        }
    }

    @Test
    public void replyPropagatesRpcFailure() throws Exception {
        RabbitCoworkersContext context = createContext();
        IOException rpcFailure = new IOException("reply failed");
        Mockito.doThrow(rpcFailure).when(_rpc).reply(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any());

        try {
            context.reply("the reply", null);
            Assert.fail("Expected reply to throw");
        }
        catch (IOException e) {
            Assert.assertSame(rpcFailure, e);
        }
    }

    @Test
    public void requestPropagatesRpcFailureThroughFuture() throws Exception {
        RabbitCoworkersContext context = createContext();
        IOException rpcFailure = new IOException("request timed out");
        CompletableFuture<CoworkersMessage> failed = new CompletableFuture<>();
        failed.completeExceptionally(rpcFailure);
        Mockito.when(_rpc.request(Mockito.any(), Mockito.anyString(), Mockito.any(), Mockito.any()))
                .thenReturn(failed);

        CompletableFuture<CoworkersMessage> result = context.request("rpc-queue", "question", null, null, null);

        try {
            result.get();
            Assert.fail("Expected the future to fail");
        }
        catch (ExecutionException e) {
            Assert.assertSame(rpcFailure, e.getCause());
        }
    }

    @Test
    public void contentAccessors() {
        RabbitCoworkersContext context = createContext();

        Assert.assertEquals("{\"orderId\":\"abc\"}", context.getContentAsString());
        OrderDto dto = context.getContentAsJson(OrderDto.class);
        Assert.assertEquals("abc", dto.orderId);
    }

    static class OrderDto {
        private String orderId;
    }
}
