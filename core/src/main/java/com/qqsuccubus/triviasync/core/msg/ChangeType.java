package com.qqsuccubus.triviasync.core.msg;

/**
 * Kind of row change carried by a {@link TableChange}.
 */
public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE
}
