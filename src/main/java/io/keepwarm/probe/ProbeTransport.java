package io.keepwarm.probe;

import io.keepwarm.models.ScheduleDefinition;

import java.io.IOException;

/**
 * Performs one probe request against a model endpoint.
 * Implementations report the raw response; classification and retries belong to {@link ProbeDispatcher}.
 */
public interface ProbeTransport {
    
    /**
     * Execute a single attempt.
     *
     * @param definition schedule of the model to probe
     * @return status code, body and latency of the response
     * @throws IOException on connection errors and request timeouts
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    ProbeResponse execute(ScheduleDefinition definition) throws IOException, InterruptedException;
}
