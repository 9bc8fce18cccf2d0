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
 * Options for a positive acknowledgement. {@link #empty()} is the "no options" instance, which is what
 * {@link CoworkersContext#setAckAll(boolean) setAckAll(true)} records.
 */
public final class AckOptions {
    private static final AckOptions EMPTY = new AckOptions(null);

    private final Boolean _allUpTo;

    private AckOptions(Boolean allUpTo) {
        _allUpTo = allUpTo;
    }

    public static AckOptions empty() {
        return EMPTY;
    }

    /**
     * @param allUpTo
     *            if <code>true</code>, acknowledge this and all earlier unacknowledged messages on the channel.
     */
    public static AckOptions allUpTo(boolean allUpTo) {
        return new AckOptions(allUpTo);
    }

    public Boolean getAllUpTo() {
        return _allUpTo;
    }

    public boolean isAllUpTo() {
        return _allUpTo != null && _allUpTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AckOptions)) {
            return false;
        }
        return Objects.equals(_allUpTo, ((AckOptions) o)._allUpTo);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_allUpTo);
    }

    @Override
    public String toString() {
        return _allUpTo == null ? "{}" : "{allUpTo:" + _allUpTo + "}";
    }
}
