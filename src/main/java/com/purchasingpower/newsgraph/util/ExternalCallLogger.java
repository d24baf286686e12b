package com.purchasingpower.newsgraph.util;

import org.slf4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Structured request/response logging for calls to Neo4j and embedding providers.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Formats statement parameters for DEBUG output. Embedding vectors are reduced to their length.
     */
    public static String formatParameters(Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        parameters.forEach((key, value) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(key).append('=');
            if (value instanceof List<?> list && list.size() > 8) {
                sb.append("[").append(list.size()).append(" items]");
            } else {
                sb.append(truncate(String.valueOf(value), 120));
            }
        });
        return sb.append('}').toString();
    }
}
