package com.qqsuccubus.triviasync.realtime.presence;

/**
 * User interaction that counts as activity for idle detection.
 */
public enum ActivitySignal {
    MOUSE_MOVE,
    KEY_PRESS,
    CLICK,
    SCROLL,
    TOUCH
}
