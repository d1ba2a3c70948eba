package com.qqsuccubus.triviasync.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Row change event emitted by a table-change subscription.
 * <p>
 * {@code newRecord} is present for INSERT and UPDATE, {@code oldRecord} for UPDATE (when the
 * backend replicates it) and DELETE.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableChange {
    String table;
    ChangeType type;
    JsonNode newRecord;
    JsonNode oldRecord;
    /**
     * Epoch millis of the commit on the authoritative store.
     */
    long commitTimestamp;

    public static TableChange inserted(String table, JsonNode row, long commitTimestamp) {
        return new TableChange(table, ChangeType.INSERT, row, null, commitTimestamp);
    }

    public static TableChange updated(String table, JsonNode row, JsonNode previous, long commitTimestamp) {
        return new TableChange(table, ChangeType.UPDATE, row, previous, commitTimestamp);
    }

    public static TableChange deleted(String table, JsonNode previous, long commitTimestamp) {
        return new TableChange(table, ChangeType.DELETE, null, previous, commitTimestamp);
    }

    /**
     * Row as it looks after the change, or the removed row for a DELETE.
     *
     * @return affected row
     */
    public JsonNode affectedRow() {
        return switch (type) {
            case INSERT, UPDATE -> newRecord;
            case DELETE -> oldRecord;
        };
    }
}
