package com.purchasingpower.newsgraph.util;

/**
 * External services whose calls are logged through {@link ExternalCallLogger}.
 */
public enum ServiceType {
    NEO4J_BOLT("🟢", "Neo4j Bolt"),
    NEO4J_QUERY_API("🟩", "Neo4j Query API"),
    IN_MEMORY("⚪", "In-memory graph"),
    GEMINI("🔴", "Gemini"),
    OLLAMA("🔵", "Ollama"),
    HASH("⚫", "Hash embeddings");

    private final String emoji;
    private final String displayName;

    ServiceType(String emoji, String displayName) {
        this.emoji = emoji;
        this.displayName = displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }
}
