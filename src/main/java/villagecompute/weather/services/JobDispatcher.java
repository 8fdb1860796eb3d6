/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.weather.exceptions.JobFailedException;
import villagecompute.weather.jobs.JobHandler;
import villagecompute.weather.jobs.JobType;
import villagecompute.weather.observability.LoggingConfig;

/**
 * Routes pipeline jobs to their registered {@link JobHandler}.
 *
 * <p>
 * Jobs run synchronously on the calling thread. Each execution gets:
 * <ul>
 * <li>A sequence number used as {@code job_id} in logs</li>
 * <li>An OpenTelemetry span with {@code job.id} and {@code job.type}</li>
 * <li>MDC fields for trace context, job id and request origin</li>
 * <li>{@code weather.jobs.total} and {@code weather.jobs.duration} metrics tagged by type</li>
 * </ul>
 *
 * <p>
 * <b>Overlap:</b> one permit per job type. A trigger that arrives while the same type is still running is skipped and
 * logged, so a slow warehouse load never stacks up behind the scheduler.
 *
 * @see JobHandler for handler contract
 * @see JobType for job types
 */
@ApplicationScoped
public class JobDispatcher {

    private static final Logger LOG = Logger.getLogger(JobDispatcher.class);

    /**
     * Returned by {@link #dispatch} when the job was skipped because the same type is already running.
     */
    public static final long SKIPPED = -1L;

    private final Map<JobType, JobHandler> handlerRegistry;

    private final Map<JobType, Semaphore> running = new EnumMap<>(JobType.class);

    private final AtomicLong sequence = new AtomicLong();

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    public JobDispatcher(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        for (JobType type : JobType.values()) {
            running.put(type, new Semaphore(1));
        }
        LOG.infof("Initialized JobDispatcher with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a type → handler map.
     *
     * @param handlers
     *            CDI Instance providing all JobHandler implementations
     * @return EnumMap for O(1) handler lookups
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Runs a job now and returns once it finished.
     *
     * @param jobType
     *            the type of job to run
     * @param payload
     *            job parameters
     * @return assigned job id, or {@link #SKIPPED} if the same type was already running
     * @throws IllegalStateException
     *             if no handler is registered for jobType
     * @throws JobFailedException
     *             if the handler threw
     */
    public long dispatch(JobType jobType, Map<String, Object> payload) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Semaphore permit = running.get(jobType);
        if (!permit.tryAcquire()) {
            LOG.warnf("JobType.%s is already running, skipping trigger", jobType);
            incrementCounter(jobType, "skipped");
            return SKIPPED;
        }

        long jobId = sequence.incrementAndGet();
        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            LoggingConfig.setRequestOrigin("JobType." + jobType.name());

            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            incrementCounter(jobType, "success");
            LOG.infof("Job %d (type: %s) completed successfully", jobId, jobType);
            return jobId;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            incrementCounter(jobType, "failure");
            throw new JobFailedException(jobType, jobId, e);

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            incrementCounter(jobType, "failure");
            LOG.errorf(e, "Job %d (type: %s) failed", jobId, jobType);
            throw new JobFailedException(jobType, jobId, e);

        } finally {
            sample.stop(Timer.builder("weather.jobs.duration").tag("type", jobType.name()).register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
            permit.release();
        }
    }

    private void incrementCounter(JobType jobType, String status) {
        Counter.builder("weather.jobs.total").tag("type", jobType.name()).tag("status", status)
                .register(meterRegistry).increment();
    }
}
