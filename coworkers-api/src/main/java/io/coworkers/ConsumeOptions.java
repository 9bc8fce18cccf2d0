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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options used when starting to consume from a queue, i.e. the arguments of {@link com.rabbitmq.client.Channel#basicConsume(String,
 * boolean, String, boolean, boolean, Map, com.rabbitmq.client.DeliverCallback, com.rabbitmq.client.CancelCallback)
 * Channel.basicConsume(..)}. Unset values are <code>null</code>. Immutable, merged the same way as
 * {@link QueueOptions#mergedWith(QueueOptions)}.
 */
public final class ConsumeOptions {
    private static final ConsumeOptions EMPTY = new ConsumeOptions(null, null, null, null, Collections.emptyMap());

    private final Boolean _noAck;
    private final Boolean _exclusive;
    private final String _consumerTag;
    private final Integer _prefetch;
    private final Map<String, Object> _arguments;

    private ConsumeOptions(Boolean noAck, Boolean exclusive, String consumerTag, Integer prefetch,
            Map<String, Object> arguments) {
        _noAck = noAck;
        _exclusive = exclusive;
        _consumerTag = consumerTag;
        _prefetch = prefetch;
        _arguments = arguments;
    }

    public static ConsumeOptions empty() {
        return EMPTY;
    }

    /**
     * If <code>true</code>, the broker considers the message acknowledged on delivery, and the ack intent set on the
     * context is ignored.
     */
    public ConsumeOptions noAck(boolean noAck) {
        return new ConsumeOptions(noAck, _exclusive, _consumerTag, _prefetch, _arguments);
    }

    public ConsumeOptions exclusive(boolean exclusive) {
        return new ConsumeOptions(_noAck, exclusive, _consumerTag, _prefetch, _arguments);
    }

    public ConsumeOptions consumerTag(String consumerTag) {
        return new ConsumeOptions(_noAck, _exclusive, consumerTag, _prefetch, _arguments);
    }

    /**
     * Per-consumer prefetch, overriding the application-wide prefetch for this queue's consumer.
     */
    public ConsumeOptions prefetch(int prefetch) {
        return new ConsumeOptions(_noAck, _exclusive, _consumerTag, prefetch, _arguments);
    }

    public ConsumeOptions argument(String key, Object value) {
        Map<String, Object> arguments = new LinkedHashMap<>(_arguments);
        arguments.put(key, value);
        return new ConsumeOptions(_noAck, _exclusive, _consumerTag, _prefetch, Collections.unmodifiableMap(arguments));
    }

    public Boolean getNoAck() {
        return _noAck;
    }

    public Boolean getExclusive() {
        return _exclusive;
    }

    public String getConsumerTag() {
        return _consumerTag;
    }

    public Integer getPrefetch() {
        return _prefetch;
    }

    public Map<String, Object> getArguments() {
        return _arguments;
    }

    public boolean isNoAck() {
        return _noAck != null && _noAck;
    }

    public boolean isExclusive() {
        return _exclusive != null && _exclusive;
    }

    public ConsumeOptions mergedWith(ConsumeOptions override) {
        if (override == null) {
            return this;
        }
        Map<String, Object> arguments = new LinkedHashMap<>(_arguments);
        arguments.putAll(override._arguments);
        return new ConsumeOptions(
                override._noAck != null ? override._noAck : _noAck,
                override._exclusive != null ? override._exclusive : _exclusive,
                override._consumerTag != null ? override._consumerTag : _consumerTag,
                override._prefetch != null ? override._prefetch : _prefetch,
                Collections.unmodifiableMap(arguments));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConsumeOptions)) {
            return false;
        }
        ConsumeOptions that = (ConsumeOptions) o;
        return Objects.equals(_noAck, that._noAck)
                && Objects.equals(_exclusive, that._exclusive)
                && Objects.equals(_consumerTag, that._consumerTag)
                && Objects.equals(_prefetch, that._prefetch)
                && _arguments.equals(that._arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_noAck, _exclusive, _consumerTag, _prefetch, _arguments);
    }

    @Override
    public String toString() {
        return "ConsumeOptions{noAck:" + _noAck + ", exclusive:" + _exclusive + ", consumerTag:" + _consumerTag
                + ", prefetch:" + _prefetch + ", arguments:" + _arguments + "}";
    }
}
