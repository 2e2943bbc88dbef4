package com.openforge.taskcore.index;

import java.util.List;

/**
 * Cosine nearest-neighbour search over enabled templates.
 */
public interface TemplateVectorSearch {

    /** False when no vector backend is connected. */
    boolean isAvailable();

    /**
     * @return at most {@code k} hits, closest first
     */
    List<NeighborHit> nearestNeighbors(VectorField field, List<Float> queryVector, int k);
}
