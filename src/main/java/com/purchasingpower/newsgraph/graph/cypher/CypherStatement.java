package com.purchasingpower.newsgraph.graph.cypher;

/**
 * A named, parameterized Cypher statement together with how it must be executed.
 *
 * @param name operation name used in logs
 * @param text Cypher text with {@code $parameter} placeholders
 * @param mode transaction mode the transport must use
 */
public record CypherStatement(String name, String text, Mode mode) {

    public enum Mode {
        /**
         * Schema changes; must run in an auto-commit transaction.
         */
        SCHEMA,
        READ,
        WRITE
    }
}
