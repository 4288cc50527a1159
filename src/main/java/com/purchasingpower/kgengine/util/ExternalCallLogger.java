package com.purchasingpower.kgengine.util;

import com.purchasingpower.kgengine.model.CallContext;
import com.purchasingpower.kgengine.model.ServiceType;
import org.slf4j.Logger;

import java.util.Map;

/**
 * Entry point for store call logging (Neo4j, Pinecone, in-memory graph).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Small maps are printed in full, larger ones as an entry count.
     */
    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() <= 5) {
            return map.toString();
        }
        return "{" + map.size() + " entries}";
    }
}
