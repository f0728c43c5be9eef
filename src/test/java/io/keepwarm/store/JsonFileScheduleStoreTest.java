package io.keepwarm.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.keepwarm.enums.FailureKind;
import io.keepwarm.enums.RunStatus;
import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;
import io.keepwarm.models.ScheduleRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileScheduleStoreTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private JsonFileScheduleStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new JsonFileScheduleStore(tempDir.resolve("schedules"), objectMapper);
    }

    @Test
    void testLoadFromMissingDirectoryIsEmpty() throws Exception {
        assertThat(store.load()).isEmpty();
        assertThat(store.getLastLoadSkipped()).isZero();
    }

    @Test
    void testSaveThenLoadReturnsEqualRecord() throws Exception {
        ScheduleDefinition definition = definition("org/model-a");
        RunState state = RunState.builder()
            .status(RunStatus.ERROR)
            .lastFireAt(Instant.parse("2026-03-02T01:30:00Z"))
            .lastSuccessAt(Instant.parse("2026-03-02T00:30:12Z"))
            .consecutiveFailures(3)
            .lastErrorMessage("HTTP 500: boom")
            .lastFailureKind(FailureKind.TRANSIENT)
            .lastLatencyMillis(830L)
            .windowOpen(true)
            .build();

        store.save("org/model-a", definition, state);
        Map<String, ScheduleRecord> loaded = store.load();

        assertThat(loaded).containsOnlyKeys("org/model-a");
        assertThat(loaded.get("org/model-a").getDefinition()).isEqualTo(definition);
        assertThat(loaded.get("org/model-a").getState()).isEqualTo(state);
    }

    @Test
    void testModelIdIsUrlEncodedInFileName() throws Exception {
        store.save("org/model-a", definition("org/model-a"), RunState.idle());

        assertThat(store.recordPath("org/model-a").getFileName().toString()).isEqualTo("org%2Fmodel-a.json");
        assertThat(Files.exists(store.recordPath("org/model-a"))).isTrue();
    }

    @Test
    void testSaveOverwritesAndLeavesNoTempFiles() throws Exception {
        store.save("model-a", definition("model-a"), RunState.idle());
        RunState running = RunState.builder().status(RunStatus.RUNNING).build();
        store.save("model-a", definition("model-a"), running);

        assertThat(store.load().get("model-a").getState().getStatus()).isEqualTo(RunStatus.RUNNING);
        try (Stream<Path> files = Files.list(tempDir.resolve("schedules"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("model-a.json");
        }
    }

    @Test
    void testMalformedRecordIsSkipped() throws Exception {
        store.save("model-a", definition("model-a"), RunState.idle());
        store.save("model-b", definition("model-b"), RunState.idle());
        Files.writeString(tempDir.resolve("schedules").resolve("broken.json"), "{ not json");
        Files.writeString(tempDir.resolve("schedules").resolve("model-c.json"),
            objectMapper.writeValueAsString(new ScheduleRecord(definition("other-id"), RunState.idle())));

        Map<String, ScheduleRecord> loaded = store.load();

        assertThat(loaded).containsOnlyKeys("model-a", "model-b");
        assertThat(store.getLastLoadSkipped()).isEqualTo(2);
    }

    @Test
    void testMissingStateLoadsAsIdle() throws Exception {
        Files.createDirectories(tempDir.resolve("schedules"));
        Files.writeString(tempDir.resolve("schedules").resolve("model-a.json"),
            objectMapper.writeValueAsString(new ScheduleRecord(definition("model-a"), null)));

        assertThat(store.load().get("model-a").getState().getStatus()).isEqualTo(RunStatus.IDLE);
    }

    @Test
    void testDeleteRemovesRecord() throws Exception {
        store.save("model-a", definition("model-a"), RunState.idle());

        store.delete("model-a");
        store.delete("never-existed");

        assertThat(store.load()).isEmpty();
    }

    @Test
    void testListAllIsSortedByModelId() throws Exception {
        store.save("zeta", definition("zeta"), RunState.idle());
        store.save("alpha", definition("alpha"), RunState.idle());

        List<ScheduleRecord> records = store.listAll();

        assertThat(records).extracting(r -> r.getDefinition().getModelId()).containsExactly("alpha", "zeta");
    }

    @Test
    void testSaveRejectsMismatchedDefinition() {
        assertThatThrownBy(() -> store.save("model-a", definition("model-b"), RunState.idle()))
            .isInstanceOf(StoreException.class);
    }

    private static ScheduleDefinition definition(String modelId) {
        return ScheduleDefinition.builder()
            .modelId(modelId)
            .targetUrl("https://api.example.com/" + modelId)
            .fromTime(LocalTime.of(7, 30))
            .toTime(LocalTime.of(16, 30))
            .intervalMinutes(60)
            .timezone("Asia/Seoul")
            .enabled(true)
            .updatedAt(Instant.parse("2026-03-01T09:00:00Z"))
            .build();
    }
}
