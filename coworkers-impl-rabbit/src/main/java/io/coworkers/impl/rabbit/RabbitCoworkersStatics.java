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

import com.rabbitmq.client.Channel;

import io.coworkers.AckIntent;
import io.coworkers.AckOptions;
import io.coworkers.NackOptions;

/**
 * Common constants and helpers of the RabbitMQ implementation.
 */
public interface RabbitCoworkersStatics {

    String LOG_PREFIX = "#COWORKERS# ";

    String THREAD_PREFIX = "COWORKERS:";

    /**
     * The delivery tag which together with <code>multiple = true</code> addresses every outstanding message on a
     * channel, which is how ackAll and nackAll are expressed in AMQP 0-9-1.
     */
    long ALL_OUTSTANDING_DELIVERY_TAG = 0L;

    /**
     * Invokes the acknowledgement primitive corresponding to the intent on the given channel.
     */
    default void applyAckIntent(Channel channel, long deliveryTag, AckIntent intent) throws IOException {
        switch (intent.getKind()) {
            case ACK: {
                AckOptions options = intent.getAckOptions();
                channel.basicAck(deliveryTag, options.isAllUpTo());
                break;
            }
            case NACK: {
                NackOptions options = intent.getNackOptions();
                channel.basicNack(deliveryTag, options.isAllUpTo(), options.isRequeue());
                break;
            }
            case ACK_ALL:
                channel.basicAck(ALL_OUTSTANDING_DELIVERY_TAG, true);
                break;
            case NACK_ALL:
                channel.basicNack(ALL_OUTSTANDING_DELIVERY_TAG, true, intent.getNackOptions().isRequeue());
                break;
            default:
                throw new AssertionError("Unknown AckIntent kind [" + intent.getKind() + "].");
        }
    }

    default String id(String type, Object thisObject) {
        return type + '@' + Integer.toHexString(System.identityHashCode(thisObject));
    }
}
