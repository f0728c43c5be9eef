package io.keepwarm.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.keepwarm.metrics.MetricsConstants.INSTANCE_TAG;

/*
 * MetricsProvider creates counters, gauges and timers tagged with the keep-warm instance id.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final String instanceId;
    private final Map<String, AtomicDouble> gaugeCache = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String instanceId) {
        this.registry = registry;
        this.instanceId = instanceId;
        log.info("MetricsProvider initialized for keep-warm instance: {}", instanceId);
    }

    /**
     * Creates or retrieves a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values, not modified
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(withInstance(tags))).register(registry);
    }

    /**
     * Gets or creates a gauge and sets it to {@code value}.
     * Identical name+tags combinations share one AtomicDouble.
     */
    public AtomicDouble gauge(String name, double value, Map<String, String> tags) {
        Map<String, String> allTags = withInstance(tags);
        String cacheKey = buildCacheKey(name, allTags);
        AtomicDouble gauge = gaugeCache.computeIfAbsent(cacheKey, k -> {
            AtomicDouble gaugeValue = new AtomicDouble(value);
            Gauge.builder(name, gaugeValue::get)
                .tags(mapToTagArray(allTags))
                .register(registry);
            return gaugeValue;
        });
        gauge.set(value);
        return gauge;
    }

    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(withInstance(tags)))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Map<String, String> withInstance(Map<String, String> tags) {
        Map<String, String> copy = new HashMap<>(tags);
        copy.put(INSTANCE_TAG, instanceId);
        return copy;
    }

    private String buildCacheKey(String name, Map<String, String> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> key.append(":").append(e.getKey()).append("=").append(e.getValue()));
        return key.toString();
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[tags.size() * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        return tagArray;
    }
}
