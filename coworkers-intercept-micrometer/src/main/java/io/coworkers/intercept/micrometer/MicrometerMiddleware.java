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

package io.coworkers.intercept.micrometer;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.coworkers.AckIntent;
import io.coworkers.CoworkersContext;
import io.coworkers.Middleware;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

/**
 * A middleware recording Micrometer metrics for each message passing through it. If created with a
 * {@link MeterRegistry}, it creates the meters on it, otherwise it employs the {@link Metrics#globalRegistry}.
 * <p />
 * Meters:
 * <ul>
 * <li>{@link Timer} {@link #TIMER_PROCESS_NAME "coworkers.message.process"}: time taken by the downstream chain,
 * tagged with {@link #TAG_APP_NAME "appName"}, {@link #TAG_QUEUE "queue"} and {@link #TAG_OUTCOME "outcome"}, the
 * latter being the acknowledgement decision the downstream middlewares left on the context ("ack", "nack", "ackAll",
 * "nackAll"), "none" if they left none, or "error" if the chain threw. The application's error path runs after the
 * whole chain has returned, so messages recorded as "none" are subsequently nacked by the application.</li>
 * <li>{@link DistributionSummary} {@link #SIZE_CONTENT_NAME "coworkers.message.size"}: the content size of incoming
 * messages, tagged with appName and queue.</li>
 * </ul>
 * The meters are tagged with queue names, which are not supposed to be dynamic.
 */
public class MicrometerMiddleware implements Middleware {
    private static final Logger log = LoggerFactory.getLogger(MicrometerMiddleware.class);

    public static final String LOG_PREFIX = "#COWORKERSMETRICS# ";

    public static final String TIMER_PROCESS_NAME = "coworkers.message.process";
    public static final String TIMER_PROCESS_DESC = "Time taken by the middlewares to process a message.";

    public static final String SIZE_CONTENT_NAME = "coworkers.message.size";
    public static final String SIZE_CONTENT_DESC = "Content size of incoming messages.";

    public static final String TAG_APP_NAME = "appName";
    public static final String TAG_QUEUE = "queue";
    public static final String TAG_OUTCOME = "outcome";
    public static final String UNIT_BYTES = "bytes";

    public static final String OUTCOME_NONE = "none";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry _meterRegistry;

    private MicrometerMiddleware(MeterRegistry meterRegistry) {
        _meterRegistry = meterRegistry;
    }

    /**
     * Creates a {@link MicrometerMiddleware} employing the provided {@link MeterRegistry}.
     */
    public static MicrometerMiddleware create(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new NullPointerException("meterRegistry");
        }
        log.info(LOG_PREFIX + "Creating " + MicrometerMiddleware.class.getSimpleName() + " on MeterRegistry ["
                + meterRegistry + "].");
        return new MicrometerMiddleware(meterRegistry);
    }

    /**
     * Creates a {@link MicrometerMiddleware} employing the {@link Metrics#globalRegistry globalRegistry}.
     */
    public static MicrometerMiddleware create() {
        return create(Metrics.globalRegistry);
    }

    @Override
    public void invoke(CoworkersContext context, Next next) throws Exception {
        String appName = context.getApp().getConfig().getName();
        String queueName = context.getQueueName();
        byte[] content = context.getMessage().getContent();

        DistributionSummary.builder(SIZE_CONTENT_NAME)
                .tag(TAG_APP_NAME, appName)
                .tag(TAG_QUEUE, queueName)
                .baseUnit(UNIT_BYTES)
                .description(SIZE_CONTENT_DESC)
                .register(_meterRegistry)
                .record(content == null ? 0 : content.length);

        long nanosAtStart = System.nanoTime();
        String outcome = OUTCOME_ERROR;
        try {
            next.proceed();
            outcome = outcomeOf(context);
        }
        finally {
            Timer.builder(TIMER_PROCESS_NAME)
                    .tag(TAG_APP_NAME, appName)
                    .tag(TAG_QUEUE, queueName)
                    .tag(TAG_OUTCOME, outcome)
                    .description(TIMER_PROCESS_DESC)
                    .register(_meterRegistry)
                    .record(System.nanoTime() - nanosAtStart, TimeUnit.NANOSECONDS);
        }
    }

    static String outcomeOf(CoworkersContext context) {
        return context.getAckIntent()
                .map(AckIntent::getKind)
                .map(AckIntent.Kind::getName)
                .orElse(OUTCOME_NONE);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + _meterRegistry.getClass().getSimpleName() + "]";
    }
}
