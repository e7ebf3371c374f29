/**
 * Configuration loading and validation for the detection engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.flightsentinel.core.config.DetectorConfigLoader} into a
 * {@link com.flightsentinel.core.config.DetectorConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.flightsentinel.core.config;
