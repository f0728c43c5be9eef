package io.keepwarm.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_INSTANCE_ID = "keepwarm-test-01";

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsProvider provider = new MetricsProvider(registry, TEST_INSTANCE_ID);

    @Test
    void testCounterIsTaggedWithInstance() {
        Map<String, String> tags = new HashMap<>();
        tags.put(MetricsConstants.MODEL_ID_TAG, "model-a");
        tags.put(MetricsConstants.OUTCOME_TAG, "success");

        Counter counter = provider.counter(MetricsConstants.PROBE_TOTAL_METRIC_NAME, tags);
        counter.increment();
        provider.counter(MetricsConstants.PROBE_TOTAL_METRIC_NAME, tags).increment(2.0);

        assertThat(counter.getId().getTag(MetricsConstants.INSTANCE_TAG)).isEqualTo(TEST_INSTANCE_ID);
        assertThat(counter.getId().getTag(MetricsConstants.MODEL_ID_TAG)).isEqualTo("model-a");
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    void testCallerTagsAreNotModified() {
        Map<String, String> tags = new HashMap<>();
        tags.put(MetricsConstants.MODEL_ID_TAG, "model-a");

        provider.counter(MetricsConstants.PROBE_TOTAL_METRIC_NAME, tags);

        assertThat(tags).containsOnlyKeys(MetricsConstants.MODEL_ID_TAG);
    }

    @Test
    void testGaugeIsReusedAndUpdated() {
        AtomicDouble first = provider.gauge(MetricsConstants.MODELS_IN_ERROR_METRIC_NAME, 1.0, new HashMap<>());
        AtomicDouble second = provider.gauge(MetricsConstants.MODELS_IN_ERROR_METRIC_NAME, 4.0, new HashMap<>());

        assertThat(second).isSameAs(first);
        Gauge gauge = registry.get(MetricsConstants.MODELS_IN_ERROR_METRIC_NAME).gauge();
        assertThat(gauge.value()).isEqualTo(4.0);
    }

    @Test
    void testTimerRecordsLatency() {
        Map<String, String> tags = new HashMap<>();
        tags.put(MetricsConstants.MODEL_ID_TAG, "model-a");

        Timer timer = provider.timer(MetricsConstants.PROBE_LATENCY_METRIC_NAME, tags);
        timer.record(250, TimeUnit.MILLISECONDS);

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }
}
