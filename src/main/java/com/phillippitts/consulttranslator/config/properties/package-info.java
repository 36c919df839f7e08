/**
 * Immutable {@code @ConfigurationProperties} classes bound from {@code translator.*}.
 *
 * <p>Each class applies its defaults in the binding constructor so that a missing property
 * never produces a null, and validates with Jakarta Bean Validation.
 */
package com.phillippitts.consulttranslator.config.properties;
