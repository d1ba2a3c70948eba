package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Value;

import java.time.Duration;

@Value(staticConstructor = "of")
public class DebounceConfig {
    Duration delay;
}
