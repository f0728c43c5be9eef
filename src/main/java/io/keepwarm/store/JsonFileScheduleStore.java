package io.keepwarm.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;
import io.keepwarm.models.ScheduleRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static io.keepwarm.config.Constants.RECORD_FILE_SUFFIX;
import static io.keepwarm.config.Constants.TEMP_FILE_SUFFIX;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * File based {@link ScheduleStore}: one pretty-printed JSON document per model.
 * 
 * Layout:
 * <pre>
 * {directory}/
 *   {url-encoded model id}.json   {"definition": {...}, "state": {...}}
 * </pre>
 * 
 * Records are written to a temp file in the same directory and moved over the previous
 * file, so a crash mid-write leaves the old record intact.
 */
@Slf4j
public class JsonFileScheduleStore implements ScheduleStore {
    
    private final Path directory;
    private final ObjectMapper objectMapper;
    private volatile int lastLoadSkipped;
    
    public JsonFileScheduleStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        log.info("JsonFileScheduleStore initialized at {}", directory.toAbsolutePath());
    }
    
    @Override
    public Map<String, ScheduleRecord> load() throws StoreException {
        Map<String, ScheduleRecord> records = new TreeMap<>();
        int skipped = 0;
        
        if (!Files.isDirectory(directory)) {
            log.info("Schedule store directory {} does not exist yet, starting empty", directory);
            lastLoadSkipped = 0;
            return records;
        }
        
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + RECORD_FILE_SUFFIX)) {
            for (Path file : files) {
                try {
                    ScheduleRecord record = readRecord(file);
                    records.put(record.getDefinition().getModelId(), record);
                } catch (Exception e) {
                    skipped++;
                    log.error("Skipping malformed schedule record {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list schedule store directory " + directory, e);
        }
        
        lastLoadSkipped = skipped;
        log.info("Loaded {} schedule record(s) from {} ({} skipped)", records.size(), directory, skipped);
        return records;
    }
    
    @Override
    public void save(String modelId, ScheduleDefinition definition, RunState state) throws StoreException {
        if (definition == null || !modelId.equals(definition.getModelId())) {
            throw new StoreException("Definition does not belong to model " + modelId);
        }
        Path target = recordPath(modelId);
        Path temp = directory.resolve(target.getFileName() + TEMP_FILE_SUFFIX);
        
        try {
            Files.createDirectories(directory);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(new ScheduleRecord(definition, state));
            Files.write(temp, json);
            moveIntoPlace(temp, target);
            log.debug("Saved schedule record for model '{}' to {}", modelId, target.getFileName());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupException) {
                log.warn("Failed to remove temp file {}: {}", temp, cleanupException.getMessage());
            }
            throw new StoreException("Failed to save schedule record for model " + modelId, e);
        }
    }
    
    @Override
    public void delete(String modelId) throws StoreException {
        try {
            boolean deleted = Files.deleteIfExists(recordPath(modelId));
            log.debug("Delete schedule record for model '{}': {}", modelId, deleted ? "deleted" : "not present");
        } catch (IOException e) {
            throw new StoreException("Failed to delete schedule record for model " + modelId, e);
        }
    }
    
    @Override
    public List<ScheduleRecord> listAll() throws StoreException {
        List<ScheduleRecord> records = new ArrayList<>(load().values());
        records.sort(Comparator.comparing(r -> r.getDefinition().getModelId()));
        return records;
    }
    
    /**
     * Number of records skipped as malformed by the most recent {@link #load()}.
     */
    public int getLastLoadSkipped() {
        return lastLoadSkipped;
    }
    
    Path recordPath(String modelId) {
        return directory.resolve(URLEncoder.encode(modelId, UTF_8) + RECORD_FILE_SUFFIX);
    }
    
    private ScheduleRecord readRecord(Path file) throws IOException {
        ScheduleRecord record = objectMapper.readValue(file.toFile(), ScheduleRecord.class);
        if (record == null || record.getDefinition() == null || record.getDefinition().getModelId() == null) {
            throw new IOException("record has no definition or model id");
        }
        String expectedId = decodeFileName(file);
        if (!expectedId.equals(record.getDefinition().getModelId())) {
            throw new IOException(String.format("model id '%s' does not match file name",
                record.getDefinition().getModelId()));
        }
        if (record.getState() == null) {
            record.setState(RunState.idle());
        }
        return record;
    }
    
    private static String decodeFileName(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - RECORD_FILE_SUFFIX.length()), UTF_8);
    }
    
    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
