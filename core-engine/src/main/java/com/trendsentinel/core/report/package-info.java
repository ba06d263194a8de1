/**
 * Orchestration of the detection, consensus, baseline and correlation steps
 * into one {@link com.trendsentinel.core.model.AnomalyReport}.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.trendsentinel.core.report.ReportAssembler}: per-term fan-out
 * and report assembly</li>
 * <li>{@link com.trendsentinel.core.report.ReportWriter}: JSON
 * serialization</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.report;
