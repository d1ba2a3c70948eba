package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Field-level change to one entity.
 * <p>
 * {@code checksum} covers {@code changes} only and does not depend on key order.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class DeltaRecord {
    String id;
    String entity;
    String entityId;
    long timestamp;
    DeltaOperation operation;
    @Builder.Default
    Map<String, Object> changes = Map.of();
    Map<String, Object> previous;
    long version;
    String checksum;

    /**
     * @return buffer key shared by all deltas of the same entity instance
     */
    public String entityKey() {
        return entity + ":" + entityId;
    }
}
