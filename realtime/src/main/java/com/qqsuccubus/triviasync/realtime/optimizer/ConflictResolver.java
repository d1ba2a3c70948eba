package com.qqsuccubus.triviasync.realtime.optimizer;

import java.util.Map;

@FunctionalInterface
public interface ConflictResolver {

    /**
     * @param local  Local version
     * @param remote Remote version
     * @param base   Common ancestor, may be null
     * @return resolved version
     */
    Map<String, Object> resolve(Map<String, Object> local, Map<String, Object> remote, Map<String, Object> base);
}
