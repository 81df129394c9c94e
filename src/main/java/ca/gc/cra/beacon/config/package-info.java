/**
 * Logger configuration and the composition root that wires loggers from it.
 * <p><strong>Role:</strong> Bootstrap layer reading YAML (SnakeYAML) into immutable {@link
 * ca.gc.cra.beacon.config.LoggerConfig} instances.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.beacon.config;
