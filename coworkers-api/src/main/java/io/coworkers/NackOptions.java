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
 * Options for a negative acknowledgement. Unset values mean the broker defaults: <code>allUpTo = false</code>,
 * <code>requeue = true</code>.
 */
public final class NackOptions {
    private static final NackOptions EMPTY = new NackOptions(null, null);

    private final Boolean _allUpTo;
    private final Boolean _requeue;

    private NackOptions(Boolean allUpTo, Boolean requeue) {
        _allUpTo = allUpTo;
        _requeue = requeue;
    }

    public static NackOptions empty() {
        return EMPTY;
    }

    public static NackOptions requeue(boolean requeue) {
        return new NackOptions(null, requeue);
    }

    public static NackOptions of(boolean allUpTo, boolean requeue) {
        return new NackOptions(allUpTo, requeue);
    }

    public Boolean getAllUpTo() {
        return _allUpTo;
    }

    public Boolean getRequeue() {
        return _requeue;
    }

    public boolean isAllUpTo() {
        return _allUpTo != null && _allUpTo;
    }

    public boolean isRequeue() {
        return _requeue == null || _requeue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NackOptions)) {
            return false;
        }
        NackOptions that = (NackOptions) o;
        return Objects.equals(_allUpTo, that._allUpTo) && Objects.equals(_requeue, that._requeue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_allUpTo, _requeue);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("{");
        if (_allUpTo != null) {
            buf.append("allUpTo:").append(_allUpTo);
        }
        if (_requeue != null) {
            buf.append(_allUpTo != null ? ", " : "").append("requeue:").append(_requeue);
        }
        return buf.append('}').toString();
    }
}
