/**
 * Configuration loading and validation for Trend Sentinel.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.trendsentinel.core.config.AnalysisConfigLoader} into an immutable
 * {@link com.trendsentinel.core.config.AnalysisConfig}. Validation runs
 * before any analysis and reports problems through
 * {@link com.trendsentinel.core.config.ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.config;
