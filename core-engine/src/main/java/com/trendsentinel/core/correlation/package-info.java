/**
 * Matching of confirmed anomalies against the event calendar.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.correlation;
