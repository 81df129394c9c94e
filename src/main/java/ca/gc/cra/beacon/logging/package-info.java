/**
 * <strong>Purpose:</strong> Runtime tuning of the SLF4J/Logback backend that hosts the console sink.
 * <p><strong>Concurrency:</strong> Call during logger bootstrap.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.logging;
