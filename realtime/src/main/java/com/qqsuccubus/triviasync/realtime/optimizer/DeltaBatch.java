package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Value;

import java.util.List;

/**
 * Compacted deltas of one entity instance, emitted by a periodic flush.
 */
@Value
public class DeltaBatch {
    String entity;
    String entityId;
    List<DeltaRecord> deltas;
    long flushedAt;
}
