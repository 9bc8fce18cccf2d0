/**
 * The RabbitMQ implementation of the Coworkers API, based on the RabbitMQ Java client: the application holding the
 * connection and consuming the queues, the per-message context, the middleware chain, and the request/reply support.
 */
package io.coworkers.impl.rabbit;
