package io.keepwarm.store;

import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;
import io.keepwarm.models.ScheduleRecord;

import java.util.List;
import java.util.Map;

/**
 * Durable keyed record set of schedule definitions and their run states.
 * Writes are atomic per model: a reader sees either the previous or the new record.
 */
public interface ScheduleStore {
    
    /**
     * Load every readable record. A missing or empty store yields an empty map;
     * a malformed record is skipped without failing the others.
     */
    Map<String, ScheduleRecord> load() throws StoreException;
    
    /**
     * Create or replace the record of a model
     */
    void save(String modelId, ScheduleDefinition definition, RunState state) throws StoreException;
    
    /**
     * Delete the record of a model. Deleting a missing record is a no-op.
     */
    void delete(String modelId) throws StoreException;
    
    /**
     * All readable records sorted by model id
     */
    List<ScheduleRecord> listAll() throws StoreException;
}
