package io.keepwarm.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keepwarm.enums.FailureKind;
import lombok.extern.slf4j.Slf4j;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static io.keepwarm.config.Constants.JOB_STATUS_IN_PROGRESS;
import static io.keepwarm.config.Constants.JOB_STATUS_IN_QUEUE;

/**
 * Maps raw probe results onto {@link FailureKind}s.
 * 
 * Responses:
 * - 2xx: success (null), unless the JSON body has a top-level {@code status} of IN_QUEUE or IN_PROGRESS
 * - 202, or a 2xx body with a pending job status: COLD_START
 * - 503 whose body carries one of the configured initializing markers: COLD_START
 * - 401, 403: AUTH_FAILURE
 * - 429: RATE_LIMITED
 * - other 4xx: REJECTED
 * - 5xx and anything else: TRANSIENT
 * 
 * Generated text of a successful completion is never searched for markers.
 * 
 * Exceptions:
 * - request timeout: TIMEOUT, or COLD_START if an earlier attempt of the same probe saw the endpoint initializing
 * - connect timeout, refused connection, other I/O: TRANSIENT
 * - unknown host, malformed request, missing credential: MISCONFIGURED
 */
@Slf4j
public class OutcomeClassifier {
    
    private static final Set<String> PENDING_JOB_STATUSES = Set.of(JOB_STATUS_IN_QUEUE, JOB_STATUS_IN_PROGRESS);
    
    private final List<String> coldStartMarkers;
    private final ObjectMapper objectMapper;
    
    public OutcomeClassifier(List<String> coldStartMarkers) {
        this(coldStartMarkers, new ObjectMapper());
    }
    
    public OutcomeClassifier(List<String> coldStartMarkers, ObjectMapper objectMapper) {
        this.coldStartMarkers = coldStartMarkers.stream()
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        this.objectMapper = objectMapper;
    }
    
    /**
     * @return the failure kind, or null when the response is a success
     */
    public FailureKind classify(ProbeResponse response) {
        int status = response.getStatusCode();
        if (status == 202) {
            return FailureKind.COLD_START;
        }
        if (response.is2xx()) {
            return hasPendingJobStatus(response.getBody()) ? FailureKind.COLD_START : null;
        }
        if (status == 503 && hasMarker(response.getBody())) {
            return FailureKind.COLD_START;
        }
        if (status == 401 || status == 403) {
            return FailureKind.AUTH_FAILURE;
        }
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status >= 400 && status < 500) {
            return FailureKind.REJECTED;
        }
        return FailureKind.TRANSIENT;
    }
    
    public FailureKind classify(Throwable error, boolean coldStartSeen) {
        if (error instanceof HttpConnectTimeoutException || error instanceof ConnectException) {
            return FailureKind.TRANSIENT;
        }
        if (error instanceof HttpTimeoutException) {
            return coldStartSeen ? FailureKind.COLD_START : FailureKind.TIMEOUT;
        }
        if (error instanceof UnknownHostException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException) {
            return FailureKind.MISCONFIGURED;
        }
        // remaining IOExceptions (reset, EOF) and anything unexpected are worth another attempt
        return FailureKind.TRANSIENT;
    }
    
    private boolean hasPendingJobStatus(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode status = objectMapper.readTree(body).path("status");
            return status.isTextual() && PENDING_JOB_STATUSES.contains(status.asText().toUpperCase(Locale.ROOT));
        } catch (JsonProcessingException e) {
            log.debug("2xx probe body is not JSON, treating as success: {}", e.getOriginalMessage());
            return false;
        }
    }
    
    private boolean hasMarker(String body) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return coldStartMarkers.stream().anyMatch(lower::contains);
    }
}
