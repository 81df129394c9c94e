/**
 * <strong>Purpose:</strong> Ports between the logger facade and the outside world: log outputs, the
 * console facility, and the clock.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.port;
