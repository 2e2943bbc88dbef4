package com.openforge.taskcore.embedding;

/**
 * Which side of a retrieval pair a text is embedded for.
 *
 * Asymmetric models (e5, bge) expect a different input prefix per side; providers
 * with task-typed embeddings (Gemini, Vertex) take {@link #taskType()} instead.
 */
public enum EmbeddingMode {
    QUERY("RETRIEVAL_QUERY"),
    DOCUMENT("RETRIEVAL_DOCUMENT");

    private final String taskType;

    EmbeddingMode(String taskType) {
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
