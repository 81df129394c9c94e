/**
 * Application-facing logging API.
 * <p><strong>Role:</strong> Driving side; host code logs through {@link ca.gc.cra.beacon.api.Logger}.</p>
 * <p><strong>Concurrency:</strong> Loggers are safe to share across threads.</p>
 */
package ca.gc.cra.beacon.api;
