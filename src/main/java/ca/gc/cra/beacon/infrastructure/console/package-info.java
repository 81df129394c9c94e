/**
 * <strong>Purpose:</strong> Console log output with its short and JSON formatters and the SLF4J-backed console
 * sink.
 * <p><strong>Concurrency:</strong> Formatters and outputs are immutable after construction.</p>
 * <p><strong>Observability:</strong> Console text is routed through SLF4J/Logback under
 * {@code beacon.console} by default.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.infrastructure.console;
