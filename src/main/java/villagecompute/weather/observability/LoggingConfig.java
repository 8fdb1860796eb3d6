/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.observability;

import org.jboss.logging.MDC;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Standard MDC field names and helpers for structured logging across HTTP requests and pipeline jobs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP request path or job type identifier (e.g., "JobType.CACHE_REFRESH")</li>
 * <li>{@code job_id} - Dispatcher-assigned job sequence number (only for job execution)</li>
 * <li>{@code city} - City the request or job operates on</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * LoggingConfig.setRequestOrigin("JobType." + jobType.name());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each request or job must
 * call {@link #clearMDC()} when it finishes so worker threads do not carry stale context.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_CITY = "city";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings are written when no span
     * is active so the JSON log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the request origin (HTTP path or job type identifier).
     *
     * @param requestOrigin
     *            path like "/api/monthly" or "JobType.WAREHOUSE_LOAD"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Sets the job ID for job execution logs.
     *
     * @param jobId
     *            dispatcher-assigned job number
     */
    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    /**
     * Sets the city the current unit of work operates on.
     *
     * @param city
     *            city name as requested
     */
    public static void setCity(String city) {
        if (city != null) {
            MDC.put(MDC_CITY, city);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_CITY);
    }
}
