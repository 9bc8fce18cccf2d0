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

package io.coworkers.intercept.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Envelope;

import io.coworkers.AckIntent;
import io.coworkers.CoworkersContext;
import io.coworkers.CoworkersMessage;
import io.coworkers.Middleware;

/**
 * A logging middleware that writes two loglines per message to the SLF4J logger {@link #LOG_NAME
 * "io.coworkers.log.message"}, with the message's metadata on the MDC, so that it is easy to follow the processing of
 * each message, and to use the logging system (e.g. Kibana over ElasticSearch) to create statistics. Install it first,
 * using <code>app.use(LoggingMiddleware.INSTANCE)</code>, so that every logline emitted by the downstream middlewares
 * carries the MDC properties.
 * <p />
 * MDC properties set for the entire downstream processing:
 * <ul>
 * <li><b>{@link #MDC_QUEUE "coworkers.Queue"}</b>: The queue the message was consumed from.</li>
 * <li><b>{@link #MDC_DELIVERY_TAG "coworkers.DeliveryTag"}</b>: The delivery tag on the consumer channel.</li>
 * <li><b>{@link #MDC_CORRELATION_ID "coworkers.CorrelationId"}</b>: The correlationId property of the message, if
 * any.</li>
 * <li><b>{@link #MDC_REDELIVERED "coworkers.Redelivered"}</b>: Whether the broker flagged the message as
 * redelivered.</li>
 * </ul>
 * Present on a single logline per message each, thus usable to count messages:
 * <ul>
 * <li><b>{@link #MDC_MESSAGE_RECEIVED "coworkers.MessageReceived"}</b>: On the "received" line, value is the content
 * size in bytes.</li>
 * <li><b>{@link #MDC_MESSAGE_COMPLETED "coworkers.MessageCompleted"}</b>: On the "completed" line, value is the total
 * processing time of the downstream chain in milliseconds, also available as {@link #MDC_TOTAL_TIME
 * "coworkers.exec.Total.ms"}. Along with it, {@link #MDC_PROCESS_RESULT "coworkers.ProcessResult"} is set to the
 * acknowledgement decision the downstream middlewares left on the context ("ack", "nack", "ackAll", "nackAll"),
 * "none" if they left none, or "error" if the chain threw. The application's error path runs after the whole chain
 * has returned, so a "none" message is then nacked as an error by the application, and "error" is logged here before
 * the application logs and nacks it.</li>
 * </ul>
 * Upon exit, the MDC keys are restored to their values from before the middleware was entered.
 */
public class LoggingMiddleware implements Middleware {

    public static final String LOG_NAME = "io.coworkers.log.message";

    protected static final Logger log_message = LoggerFactory.getLogger(LOG_NAME);

    public static final String LOG_PREFIX = "#COWORKERSLOG# ";

    public static final String MDC_QUEUE = "coworkers.Queue";
    public static final String MDC_DELIVERY_TAG = "coworkers.DeliveryTag";
    public static final String MDC_CORRELATION_ID = "coworkers.CorrelationId";
    public static final String MDC_REDELIVERED = "coworkers.Redelivered";

    public static final String MDC_MESSAGE_RECEIVED = "coworkers.MessageReceived";
    public static final String MDC_MESSAGE_COMPLETED = "coworkers.MessageCompleted";
    public static final String MDC_TOTAL_TIME = "coworkers.exec.Total.ms";
    public static final String MDC_PROCESS_RESULT = "coworkers.ProcessResult";

    static final String RESULT_NONE = "none";
    static final String RESULT_ERROR = "error";

    private static final String[] MDC_MESSAGE_KEYS = { MDC_QUEUE, MDC_DELIVERY_TAG, MDC_CORRELATION_ID,
            MDC_REDELIVERED };

    public static final LoggingMiddleware INSTANCE = new LoggingMiddleware();

    protected LoggingMiddleware() {
    }

    @Override
    public void invoke(CoworkersContext context, Next next) throws Exception {
        Map<String, String> previousMdc = new LinkedHashMap<>();
        for (String key : MDC_MESSAGE_KEYS) {
            previousMdc.put(key, MDC.get(key));
        }
        long nanosAtStart = System.nanoTime();
        try {
            CoworkersMessage message = context.getMessage();
            Envelope fields = message.getFields();
            BasicProperties properties = message.getProperties();
            MDC.put(MDC_QUEUE, context.getQueueName());
            MDC.put(MDC_DELIVERY_TAG, Long.toString(context.getDeliveryTag()));
            if ((properties != null) && (properties.getCorrelationId() != null)) {
                MDC.put(MDC_CORRELATION_ID, properties.getCorrelationId());
            }
            else {
                MDC.remove(MDC_CORRELATION_ID);
            }
            MDC.put(MDC_REDELIVERED, Boolean.toString(fields != null && fields.isRedeliver()));

            int size = message.getContent() == null ? 0 : message.getContent().length;
            logWithSingleMdc(MDC_MESSAGE_RECEIVED, Integer.toString(size), () -> log_message.info(LOG_PREFIX
                    + "RECEIVED message from queue [" + context.getQueueName() + "], deliveryTag ["
                    + context.getDeliveryTag() + "], [" + size + "] bytes."));

            try {
                next.proceed();
            }
            catch (Exception e) {
                double millis = millisSince(nanosAtStart);
                logCompleted(millis, RESULT_ERROR, () -> log_message.error(LOG_PREFIX + "FAILED processing message"
                        + " from queue [" + context.getQueueName() + "] after [" + millis + " ms], got ["
                        + e.getClass().getSimpleName() + "].", e));
                throw e;
            }

            double millis = millisSince(nanosAtStart);
            String result = resultOf(context);
            logCompleted(millis, result, () -> log_message.info(LOG_PREFIX + "COMPLETED message from queue ["
                    + context.getQueueName() + "] in [" + millis + " ms], result [" + result + "]."));
        }
        finally {
            for (Entry<String, String> entry : previousMdc.entrySet()) {
                if (entry.getValue() == null) {
                    MDC.remove(entry.getKey());
                }
                else {
                    MDC.put(entry.getKey(), entry.getValue());
                }
            }
        }
    }

    static String resultOf(CoworkersContext context) {
        return context.getAckIntent()
                .map(AckIntent::getKind)
                .map(AckIntent.Kind::getName)
                .orElse(RESULT_NONE);
    }

    private void logCompleted(double millis, String result, Runnable logStatement) {
        String millisString = Double.toString(millis);
        MDC.put(MDC_TOTAL_TIME, millisString);
        MDC.put(MDC_PROCESS_RESULT, result);
        try {
            logWithSingleMdc(MDC_MESSAGE_COMPLETED, millisString, logStatement);
        }
        finally {
            MDC.remove(MDC_TOTAL_TIME);
            MDC.remove(MDC_PROCESS_RESULT);
        }
    }

    private void logWithSingleMdc(String key, String value, Runnable logStatement) {
        MDC.put(key, value);
        try {
            logStatement.run();
        }
        finally {
            MDC.remove(key);
        }
    }

    private static double millisSince(long nanosAtStart) {
        // Three decimals
        return Math.round((System.nanoTime() - nanosAtStart) / 1000d) / 1000d;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
