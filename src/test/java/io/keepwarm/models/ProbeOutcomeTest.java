package io.keepwarm.models;

import io.keepwarm.enums.FailureKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeOutcomeTest {

    @Test
    void testLabelIsIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(ProbeOutcome.failure(FailureKind.TIMEOUT, "timed out", 3).label()).isEqualTo("timeout");
            assertThat(ProbeOutcome.failure(FailureKind.AUTH_FAILURE, "HTTP 401", 1).label()).isEqualTo("auth_failure");
            assertThat(ProbeOutcome.success(10, 1).label()).isEqualTo("success");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testCompletedAtIsStampedOnACopy() {
        ProbeOutcome outcome = ProbeOutcome.success(10, 2);
        Instant completedAt = Instant.parse("2026-03-02T01:00:05Z");

        ProbeOutcome stamped = outcome.withCompletedAt(completedAt);

        assertThat(outcome.getCompletedAt()).isNull();
        assertThat(stamped.getCompletedAt()).isEqualTo(completedAt);
        assertThat(stamped.getAttempts()).isEqualTo(2);
        assertThat(stamped.getLatencyMillis()).isEqualTo(10L);
    }
}
