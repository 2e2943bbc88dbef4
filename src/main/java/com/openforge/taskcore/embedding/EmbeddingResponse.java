package com.openforge.taskcore.embedding;

import java.util.List;

/**
 * Response from POST /embeddings. Only the first vector is read, since every
 * request carries a single input.
 */
public record EmbeddingResponse(
        List<EmbeddingData> data,
        Usage usage
) {

    /**
     * The embedded vector, checked against the dimension the template index was created with.
     *
     * @throws IllegalStateException when the response has no vector or the wrong dimension
     */
    public List<Float> vector(int expectedDimensions) {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new IllegalStateException("Embedding response contained no data");
        }
        List<Float> vector = data.get(0).embedding();
        if (vector.size() != expectedDimensions) {
            throw new IllegalStateException("Embedding dimension %d does not match configured %d"
                    .formatted(vector.size(), expectedDimensions));
        }
        return vector;
    }

    public int promptTokens() {
        return usage == null ? 0 : usage.promptTokens();
    }

    public record EmbeddingData(int index, List<Float> embedding) {}

    public record Usage(int promptTokens, int totalTokens) {}
}
