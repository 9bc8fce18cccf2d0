/**
 * Conversion between message content objects and the bytes put on the wire, defined by the interface
 * {@link io.coworkers.serial.CoworkersSerializer CoworkersSerializer}. A Jackson-based implementation resides in the
 * module <code>coworkers-serial-json</code>.
 */
package io.coworkers.serial;
