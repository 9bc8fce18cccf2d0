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

import java.util.Objects;

/**
 * The acknowledgement decision recorded on a {@link CoworkersContext}: one of four mutually exclusive kinds, with its
 * options. The outer driver reads the decision after the middleware chain has completed, and invokes the
 * corresponding primitive on the consumer channel.
 */
public final class AckIntent {

    public enum Kind {
        /**
         * <code>basicAck(deliveryTag, allUpTo)</code>, options are {@link AckOptions}.
         */
        ACK("ack"),

        /**
         * <code>basicNack(deliveryTag, allUpTo, requeue)</code>, options are {@link NackOptions}.
         */
        NACK("nack"),

        /**
         * Acknowledge every outstanding message on the channel, options are {@link AckOptions}.
         */
        ACK_ALL("ackAll"),

        /**
         * Reject every outstanding message on the channel, options are {@link NackOptions}.
         */
        NACK_ALL("nackAll");

        private final String _name;

        Kind(String name) {
            _name = name;
        }

        /**
         * @return the name of the corresponding context property, i.e. "ack", "nack", "ackAll" or "nackAll".
         */
        public String getName() {
            return _name;
        }
    }

    private final Kind _kind;
    private final Object _options;

    private AckIntent(Kind kind, Object options) {
        _kind = kind;
        _options = options;
    }

    public static AckIntent ack(AckOptions options) {
        return new AckIntent(Kind.ACK, Objects.requireNonNull(options, "options"));
    }

    public static AckIntent nack(NackOptions options) {
        return new AckIntent(Kind.NACK, Objects.requireNonNull(options, "options"));
    }

    public static AckIntent ackAll(AckOptions options) {
        return new AckIntent(Kind.ACK_ALL, Objects.requireNonNull(options, "options"));
    }

    public static AckIntent nackAll(NackOptions options) {
        return new AckIntent(Kind.NACK_ALL, Objects.requireNonNull(options, "options"));
    }

    public Kind getKind() {
        return _kind;
    }

    /**
     * @return the options for {@link Kind#ACK} and {@link Kind#ACK_ALL}.
     * @throws IllegalStateException
     *             if this is a NACK or NACK_ALL intent.
     */
    public AckOptions getAckOptions() {
        if (!(_options instanceof AckOptions)) {
            throw new IllegalStateException("AckIntent of kind [" + _kind + "] does not carry AckOptions.");
        }
        return (AckOptions) _options;
    }

    /**
     * @return the options for {@link Kind#NACK} and {@link Kind#NACK_ALL}.
     * @throws IllegalStateException
     *             if this is an ACK or ACK_ALL intent.
     */
    public NackOptions getNackOptions() {
        if (!(_options instanceof NackOptions)) {
            throw new IllegalStateException("AckIntent of kind [" + _kind + "] does not carry NackOptions.");
        }
        return (NackOptions) _options;
    }

    public boolean is(Kind kind) {
        return _kind == kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AckIntent)) {
            return false;
        }
        AckIntent that = (AckIntent) o;
        return _kind == that._kind && _options.equals(that._options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_kind, _options);
    }

    @Override
    public String toString() {
        return _kind + _options.toString();
    }
}
