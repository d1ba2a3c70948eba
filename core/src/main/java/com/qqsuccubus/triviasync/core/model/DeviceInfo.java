package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Device fingerprint attached to a presence record.
 */
@Value
@Builder
@Jacksonized
public class DeviceInfo {
    DeviceType type;
    String browser;
    String os;
}
