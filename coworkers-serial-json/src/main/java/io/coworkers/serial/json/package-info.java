/**
 * Jackson JSON implementation of {@link io.coworkers.serial.CoworkersSerializer CoworkersSerializer}.
 */
package io.coworkers.serial.json;
