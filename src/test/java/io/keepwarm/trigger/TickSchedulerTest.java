package io.keepwarm.trigger;

import io.keepwarm.SchedulerEngine;
import io.keepwarm.models.TickSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TickSchedulerTest {

    @Mock
    private SchedulerEngine engine;

    private TickScheduler tickScheduler;

    @AfterEach
    void tearDown() {
        if (tickScheduler != null) {
            tickScheduler.stop();
        }
    }

    @Test
    void testRunTickDelegatesToEngine() {
        when(engine.tick()).thenReturn(TickSummary.builder().tickAt(Instant.EPOCH).due(1).build());
        tickScheduler = new TickScheduler(engine, 60);

        tickScheduler.runTick();

        verify(engine).tick();
    }

    @Test
    void testRunTickSurvivesEngineFailure() {
        when(engine.tick()).thenThrow(new IllegalStateException("store unavailable"));
        tickScheduler = new TickScheduler(engine, 60);

        assertThatCode(() -> tickScheduler.runTick()).doesNotThrowAnyException();
        verify(engine).tick();
    }

    @Test
    void testStartRunsFirstTickImmediately() {
        when(engine.tick()).thenReturn(TickSummary.builder().tickAt(Instant.EPOCH).build());
        tickScheduler = new TickScheduler(engine, 3600);

        tickScheduler.start();

        assertThat(tickScheduler.isRunning()).isTrue();
        verify(engine, timeout(2000)).tick();
    }

    @Test
    void testStop() {
        tickScheduler = new TickScheduler(engine, 60);
        tickScheduler.start();

        tickScheduler.stop();

        assertThat(tickScheduler.isRunning()).isFalse();
    }
}
