/**
 * Agreement voting across detectors.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.consensus;
