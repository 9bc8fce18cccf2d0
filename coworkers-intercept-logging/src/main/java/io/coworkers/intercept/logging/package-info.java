/**
 * Coworkers middleware for structured logging over SLF4J, putting the message's metadata on the MDC - consists of a
 * single class {@link io.coworkers.intercept.logging.LoggingMiddleware LoggingMiddleware}.
 */
package io.coworkers.intercept.logging;
