package com.purchasingpower.kgengine.model;

/**
 * Stores the engine talks to, used to tag external call log lines.
 *
 * @see com.purchasingpower.kgengine.util.ExternalCallLogger
 */
public enum ServiceType {
    PINECONE("🔵", "Pinecone"),
    NEO4J("🟢", "Neo4j"),
    MEMORY_GRAPH("⚪", "InMemoryGraph");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
