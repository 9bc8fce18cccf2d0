/**
 * Coworkers API: the {@link io.coworkers.CoworkersApplication application}, the per-message
 * {@link io.coworkers.CoworkersContext context} which is threaded through a chain of
 * {@link io.coworkers.Middleware middlewares}, and the acknowledgement intent recorded on it. The AMQP transport is the
 * RabbitMQ Java client; request/reply is delegated to an {@link io.coworkers.AmqpRpc AmqpRpc} collaborator.
 */
package io.coworkers;
