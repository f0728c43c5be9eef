package io.keepwarm.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.keepwarm.models.ScheduleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.Supplier;

import static io.keepwarm.config.Constants.*;

/**
 * Sends keep-warm probes over HTTP as OpenAI-style chat completion requests.
 * 
 * POST {targetUrl}
 * Authorization: Bearer {api key}
 * {"model": modelId, "messages": [{"role": "user", "content": probeMessage}], "temperature": 0.9}
 */
@Slf4j
public class HttpProbeTransport implements ProbeTransport {
    
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Supplier<String> apiKeySupplier;
    private final ObjectMapper objectMapper;
    private final String probeMessage;
    
    public HttpProbeTransport(Duration connectTimeout, Duration requestTimeout, Supplier<String> apiKeySupplier,
                              ObjectMapper objectMapper, String probeMessage) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            requestTimeout, apiKeySupplier, objectMapper, probeMessage);
    }
    
    HttpProbeTransport(HttpClient httpClient, Duration requestTimeout, Supplier<String> apiKeySupplier,
                       ObjectMapper objectMapper, String probeMessage) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.apiKeySupplier = apiKeySupplier;
        this.objectMapper = objectMapper;
        this.probeMessage = probeMessage;
    }
    
    @Override
    public ProbeResponse execute(ScheduleDefinition definition) throws IOException, InterruptedException {
        String targetUrl = definition.getTargetUrl();
        if (targetUrl == null || targetUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Target URL cannot be null or empty");
        }
        
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(targetUrl.trim()))
            .timeout(requestTimeout)
            .header(HEADER_CONTENT_TYPE, CONTENT_TYPE_JSON)
            .header(HEADER_AUTHORIZATION, BEARER_PREFIX + stripBearer(apiKeySupplier.get()))
            .POST(HttpRequest.BodyPublishers.ofString(buildBody(definition.getModelId())))
            .build();
        
        log.debug("[Model: {}] Sending probe to {}", definition.getModelId(), targetUrl);
        long startTime = System.nanoTime();
        
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        
        long duration = Duration.ofNanos(System.nanoTime() - startTime).toMillis();
        log.debug("[Model: {}] Probe response received: status={}, duration={}ms, body size={} bytes",
            definition.getModelId(), response.statusCode(), duration,
            response.body() != null ? response.body().length() : 0);
        
        return new ProbeResponse(response.statusCode(), response.body(), duration);
    }
    
    String buildBody(String modelId) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", modelId);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", probeMessage);
        body.put("temperature", PROBE_TEMPERATURE);
        return objectMapper.writeValueAsString(body);
    }
    
    /**
     * Keys are sometimes configured with the scheme already in front.
     */
    static String stripBearer(String apiKey) {
        if (apiKey == null) {
            throw new IllegalStateException("API key is not configured");
        }
        String trimmed = apiKey.trim();
        if (trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            trimmed = trimmed.substring(BEARER_PREFIX.length()).trim();
        }
        if (trimmed.isEmpty()) {
            throw new IllegalStateException("API key is empty");
        }
        return trimmed;
    }
}
