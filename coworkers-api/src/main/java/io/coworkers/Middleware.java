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

/**
 * One step of the middleware chain which every incoming message is run through. A middleware receives the message's
 * {@link CoworkersContext}, may inspect and modify it, and invokes {@link Next#proceed()} to run the rest of the chain
 * (the code after <code>proceed()</code> runs when the downstream middlewares have completed). The terminal middleware
 * typically records the acknowledgement decision, e.g. {@link CoworkersContext#setAck(AckOptions)}.
 * <p />
 * Any exception thrown out of a middleware sends the message down the error path: the application's
 * {@link CoworkersApplication#addErrorListener(ErrorListener) error listeners} are notified, the context's ack intent
 * is poisoned, and the message is nacked.
 */
@FunctionalInterface
public interface Middleware {

    void invoke(CoworkersContext context, Next next) throws Exception;

    /**
     * Handle for running the remainder of the chain. May only be invoked once per middleware invocation.
     */
    @FunctionalInterface
    interface Next {
        void proceed() throws Exception;
    }

    /**
     * Notified when a message goes down the error path.
     */
    @FunctionalInterface
    interface ErrorListener {
        /**
         * @param throwable
         *            what was thrown from the chain, or a {@link CoworkersApplication.NoAckDecisionException} if the chain
         *            completed without any acknowledgement decision.
         * @param context
         *            the context of the failing message - its ack intent is not yet poisoned when this is invoked.
         */
        void onError(Throwable throwable, CoworkersContext context);
    }
}
