/**
 * <strong>Purpose:</strong> Immutable log record model shared by loggers, builders, and outputs.
 * <p><strong>Concurrency:</strong> Records and enums are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Attribute values are carried verbatim; callers own redaction.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.domain.log;
