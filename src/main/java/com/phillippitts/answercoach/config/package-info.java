/**
 * Application-wide configuration beans and properties.
 *
 * <p>This package contains Spring configuration classes that define beans and load
 * externalized configuration from {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.answercoach.config.ThreadPoolConfig} - Bounded executors for oracle
 *       calls and transcript pumps</li>
 *   <li>{@link com.phillippitts.answercoach.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for both pools</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.coverage} - Engine timing and strategy selection ({@code coverage.*})</li>
 *   <li>{@code config.oracle} - Oracle provider, deadline and Gemini settings</li>
 *   <li>{@code config.report} - Report sink selection</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.answercoach.config;
