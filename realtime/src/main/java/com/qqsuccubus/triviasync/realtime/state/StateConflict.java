package com.qqsuccubus.triviasync.realtime.state;

import lombok.Value;

import java.util.List;

@Value
public class StateConflict {
    StateVersion local;
    StateVersion remote;
    ConflictType type;
    /**
     * Names of the fields whose values differ.
     */
    List<String> fields;
}
