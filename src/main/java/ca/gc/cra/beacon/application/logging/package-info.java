/**
 * Console format selection and the builder that turns call-site arguments into log records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.logging;
