package com.openforge.taskcore.embedding;

import java.util.List;

/**
 * Turns text into a fixed-dimensionality float vector.
 */
public interface EmbeddingService {

    List<Float> embed(String text, EmbeddingMode mode);
}
