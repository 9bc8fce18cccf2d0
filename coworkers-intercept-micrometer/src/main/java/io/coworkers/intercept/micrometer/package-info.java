/**
 * Coworkers middleware recording Micrometer metrics of message processing - consists of a single class
 * {@link io.coworkers.intercept.micrometer.MicrometerMiddleware MicrometerMiddleware}.
 */
package io.coworkers.intercept.micrometer;
