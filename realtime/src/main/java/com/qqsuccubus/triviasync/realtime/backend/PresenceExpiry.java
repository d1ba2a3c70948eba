package com.qqsuccubus.triviasync.realtime.backend;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drops presence records whose owner stopped heartbeating, e.g. after a crash or a lost
 * transport without an untrack.
 */
public final class PresenceExpiry {

    private PresenceExpiry() {
    }

    public static boolean isStale(PresenceRecord record, long now, long staleAfterMillis) {
        return now - record.getLastSeen() > staleAfterMillis;
    }

    /**
     * @return the live part of {@code state}; keys left without records are omitted
     */
    public static Map<String, List<PresenceRecord>> live(Map<String, List<PresenceRecord>> state, long now,
                                                         long staleAfterMillis) {
        Map<String, List<PresenceRecord>> live = new LinkedHashMap<>();
        state.forEach((key, records) -> {
            List<PresenceRecord> fresh = records.stream()
                .filter(record -> !isStale(record, now, staleAfterMillis))
                .toList();
            if (!fresh.isEmpty()) {
                live.put(key, fresh);
            }
        });
        return live;
    }
}
