/**
 * Typed configuration for the scoring engine, loaded from YAML.
 *
 * <p>
 * {@link com.signalsentinel.core.config.SignalDetectionConfig} groups one
 * settings object per engine component;
 * {@link com.signalsentinel.core.config.SignalConfigLoader} reads it from the
 * environment, the file system or the classpath and validates it.
 * </p>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.config;
