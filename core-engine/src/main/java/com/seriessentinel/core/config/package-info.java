/**
 * Configuration loading and validation for the detection pipeline.
 *
 * <p>
 * Defaults are defined in YAML and loaded by
 * {@link com.seriessentinel.core.config.SettingsLoader} into a
 * {@link com.seriessentinel.core.config.DetectionSettings} instance.
 * </p>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.config;
