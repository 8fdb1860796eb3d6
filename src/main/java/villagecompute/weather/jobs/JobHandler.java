/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

import java.util.Map;

/**
 * Contract for pipeline job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link villagecompute.weather.services.JobDispatcher} discovers handlers at startup and routes jobs based on their
 * {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers execute on the Quarkus scheduler thread that triggered them, or on the request thread for manual
 * triggers</li>
 * <li>At most one execution per job type runs at a time; overlapping triggers are skipped</li>
 * <li>The dispatcher wraps each execution in an OpenTelemetry span and MDC context</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>
 * {@code
 * @ApplicationScoped
 * public class CacheRefreshJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.CACHE_REFRESH;
 *     }
 *
 *     @Override
 *     public void execute(Long jobId, Map<String, Object> payload) {
 *         String city = (String) payload.get("city");
 *         // Refresh snapshot...
 *     }
 * }
 * }
 * </pre>
 *
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Error Handling:</b> Thrown exceptions are recorded on the job span, counted as failures and logged. The next
     * scheduled trigger runs the job again.
     *
     * @param jobId
     *            dispatcher-assigned sequence number
     * @param payload
     *            job parameters, empty for scheduled runs
     * @throws Exception
     *             any error during execution
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
