/**
 * Domain model classes for Trend Sentinel.
 *
 * <p>
 * This package contains the input and output types of the consensus engine:
 * </p>
 * <ul>
 * <li>{@link com.trendsentinel.core.model.Series} and
 * {@link com.trendsentinel.core.model.SeriesDataset}: per-term daily
 * observations</li>
 * <li>{@link com.trendsentinel.core.model.EventCalendar}: labeled external
 * events</li>
 * <li>{@link com.trendsentinel.core.model.AnomalyReport}: the assembled,
 * immutable result</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.model;
