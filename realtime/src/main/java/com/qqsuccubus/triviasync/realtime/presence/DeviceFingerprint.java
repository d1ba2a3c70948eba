package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.DeviceInfo;
import com.qqsuccubus.triviasync.core.model.DeviceType;

import java.util.Locale;

/**
 * Coarse device classification from a user agent string.
 */
public final class DeviceFingerprint {
    private DeviceFingerprint() {
    }

    public static DeviceInfo fromUserAgent(String userAgent) {
        String ua = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
        return DeviceInfo.builder()
            .type(deviceType(ua))
            .browser(browser(ua))
            .os(os(ua))
            .build();
    }

    private static DeviceType deviceType(String ua) {
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return DeviceType.TABLET;
        }
        if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
            return DeviceType.MOBILE;
        }
        return DeviceType.DESKTOP;
    }

    // Edge and Chrome UAs both mention Safari, order matters
    private static String browser(String ua) {
        if (ua.contains("edg/")) {
            return "Edge";
        }
        if (ua.contains("firefox")) {
            return "Firefox";
        }
        if (ua.contains("chrome")) {
            return "Chrome";
        }
        if (ua.contains("safari")) {
            return "Safari";
        }
        return "Unknown";
    }

    private static String os(String ua) {
        if (ua.contains("android")) {
            return "Android";
        }
        if (ua.contains("iphone") || ua.contains("ipad")) {
            return "iOS";
        }
        if (ua.contains("windows")) {
            return "Windows";
        }
        if (ua.contains("mac os")) {
            return "macOS";
        }
        if (ua.contains("linux")) {
            return "Linux";
        }
        return "Unknown";
    }
}
