/**
 * Input validation helpers used while parsing logger configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.validation;
