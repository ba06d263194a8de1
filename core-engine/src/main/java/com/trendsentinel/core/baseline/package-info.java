/**
 * Pre-period versus during-period level comparison.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.baseline;
