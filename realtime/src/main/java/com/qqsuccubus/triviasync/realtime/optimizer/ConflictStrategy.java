package com.qqsuccubus.triviasync.realtime.optimizer;

public enum ConflictStrategy {
    /**
     * Keep the side with the larger {@code timestamp} field.
     */
    LAST_WRITE_WINS,
    /**
     * Three-way field merge against the common base, recursive for nested maps.
     */
    MERGE,
    /**
     * Publish a {@link ConflictPrompt} and leave the decision to the user.
     */
    USER_CHOICE,
    /**
     * Delegate to a registered {@link ConflictResolver}.
     */
    CUSTOM
}
