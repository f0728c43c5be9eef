package io.keepwarm.probe;

import lombok.Value;

/**
 * Raw response of a single probe attempt.
 */
@Value
public class ProbeResponse {
    int statusCode;
    String body;
    long latencyMillis;
    
    public boolean is2xx() {
        return statusCode >= 200 && statusCode < 300;
    }
}
