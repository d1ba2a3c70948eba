package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Value;

import java.util.Map;

/**
 * Conflict handed to the UI under {@link ConflictStrategy#USER_CHOICE}.
 */
@Value
public class ConflictPrompt {
    String entity;
    Map<String, Object> local;
    Map<String, Object> remote;
    Map<String, Object> base;
    long raisedAt;
}
