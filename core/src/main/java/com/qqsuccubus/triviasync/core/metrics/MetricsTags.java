package com.qqsuccubus.triviasync.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the client running the sync layer.
     */
    public static final String CLIENT_ID = "client_id";

    /**
     * Tag key for subscription kind (table-change/broadcast/presence).
     */
    public static final String KIND = "kind";

    /**
     * Tag key for event or conflict type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for the result of an operation.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

}
