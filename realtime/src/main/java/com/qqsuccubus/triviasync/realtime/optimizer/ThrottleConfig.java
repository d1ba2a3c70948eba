package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Value;

import java.time.Duration;

/**
 * Fixed-window throttle: at most {@code limit} calls per {@code window}.
 */
@Value(staticConstructor = "of")
public class ThrottleConfig {
    int limit;
    Duration window;
}
