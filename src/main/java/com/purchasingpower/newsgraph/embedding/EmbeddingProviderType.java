package com.purchasingpower.newsgraph.embedding;

public enum EmbeddingProviderType {
    GEMINI,
    OLLAMA,
    HASH
}
