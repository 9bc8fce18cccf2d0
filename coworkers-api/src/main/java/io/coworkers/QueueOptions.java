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
 * Options used when declaring a queue, i.e. the arguments of {@link com.rabbitmq.client.Channel#queueDeclare(String,
 * boolean, boolean, boolean, Map) Channel.queueDeclare(..)}. Every value may be unset (<code>null</code>), in which
 * case the default applies, or a less specific set of options is consulted, see {@link #mergedWith(QueueOptions)}.
 * <p />
 * Instances are immutable; the "setters" return a new instance.
 */
public final class QueueOptions {
    private static final QueueOptions EMPTY = new QueueOptions(null, null, null, Collections.emptyMap());

    private final Boolean _durable;
    private final Boolean _exclusive;
    private final Boolean _autoDelete;
    private final Map<String, Object> _arguments;

    private QueueOptions(Boolean durable, Boolean exclusive, Boolean autoDelete, Map<String, Object> arguments) {
        _durable = durable;
        _exclusive = exclusive;
        _autoDelete = autoDelete;
        _arguments = arguments;
    }

    public static QueueOptions empty() {
        return EMPTY;
    }

    public QueueOptions durable(boolean durable) {
        return new QueueOptions(durable, _exclusive, _autoDelete, _arguments);
    }

    public QueueOptions exclusive(boolean exclusive) {
        return new QueueOptions(_durable, exclusive, _autoDelete, _arguments);
    }

    public QueueOptions autoDelete(boolean autoDelete) {
        return new QueueOptions(_durable, _exclusive, autoDelete, _arguments);
    }

    public QueueOptions argument(String key, Object value) {
        Map<String, Object> arguments = new LinkedHashMap<>(_arguments);
        arguments.put(key, value);
        return new QueueOptions(_durable, _exclusive, _autoDelete, Collections.unmodifiableMap(arguments));
    }

    public Boolean getDurable() {
        return _durable;
    }

    public Boolean getExclusive() {
        return _exclusive;
    }

    public Boolean getAutoDelete() {
        return _autoDelete;
    }

    public Map<String, Object> getArguments() {
        return _arguments;
    }

    public boolean isDurable() {
        return _durable == null || _durable;
    }

    public boolean isExclusive() {
        return _exclusive != null && _exclusive;
    }

    public boolean isAutoDelete() {
        return _autoDelete != null && _autoDelete;
    }

    /**
     * Returns the combination of these options (the defaults) and the given override: every value set in the override
     * wins, unset values fall back to this instance. The arguments are merged key by key, override winning.
     *
     * @param override
     *            the more specific options, may be <code>null</code>, which returns <code>this</code>.
     * @return the merged options.
     */
    public QueueOptions mergedWith(QueueOptions override) {
        if (override == null) {
            return this;
        }
        Map<String, Object> arguments = new LinkedHashMap<>(_arguments);
        arguments.putAll(override._arguments);
        return new QueueOptions(
                override._durable != null ? override._durable : _durable,
                override._exclusive != null ? override._exclusive : _exclusive,
                override._autoDelete != null ? override._autoDelete : _autoDelete,
                Collections.unmodifiableMap(arguments));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueueOptions)) {
            return false;
        }
        QueueOptions that = (QueueOptions) o;
        return Objects.equals(_durable, that._durable)
                && Objects.equals(_exclusive, that._exclusive)
                && Objects.equals(_autoDelete, that._autoDelete)
                && _arguments.equals(that._arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_durable, _exclusive, _autoDelete, _arguments);
    }

    @Override
    public String toString() {
        return "QueueOptions{durable:" + _durable + ", exclusive:" + _exclusive + ", autoDelete:" + _autoDelete
                + ", arguments:" + _arguments + "}";
    }
}
