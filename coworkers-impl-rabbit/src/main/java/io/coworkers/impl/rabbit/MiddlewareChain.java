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

import java.util.List;

import io.coworkers.CoworkersContext;
import io.coworkers.Middleware;
import io.coworkers.Middleware.Next;

/**
 * Runs a list of {@link Middleware}s in order, each getting a {@link Next} which invokes the rest of the chain. Code a
 * middleware runs after {@link Next#proceed()} returns thus runs in reverse order, "onion style". A middleware not
 * invoking <code>proceed()</code> ends the chain at that point.
 */
public class MiddlewareChain {

    private final List<Middleware> _middlewares;

    public MiddlewareChain(List<Middleware> middlewares) {
        if (middlewares == null) {
            throw new NullPointerException("middlewares");
        }
        _middlewares = List.copyOf(middlewares);
    }

    public List<Middleware> getMiddlewares() {
        return _middlewares;
    }

    /**
     * Runs the chain for the given context. Any exception raised by a middleware propagates out, through the
     * <code>proceed()</code> calls of the middlewares before it.
     */
    public void run(CoworkersContext context) throws Exception {
        dispatch(context, 0);
    }

    private void dispatch(CoworkersContext context, int index) throws Exception {
        if (index >= _middlewares.size()) {
            return;
        }
        Middleware middleware = _middlewares.get(index);
        middleware.invoke(context, new ChainNext(context, index));
    }

    private class ChainNext implements Next {
        private final CoworkersContext _context;
        private final int _index;
        private boolean _proceeded;

        ChainNext(CoworkersContext context, int index) {
            _context = context;
            _index = index;
        }

        @Override
        public void proceed() throws Exception {
            // ?: Has this middleware already proceeded?
            if (_proceeded) {
                // -> Yes, so that would run the downstream middlewares twice.
                throw new IllegalStateException("Middleware #" + _index + " [" + _middlewares.get(_index)
                        + "] invoked proceed() more than once.");
            }
            _proceeded = true;
            dispatch(_context, _index + 1);
        }
    }
}
