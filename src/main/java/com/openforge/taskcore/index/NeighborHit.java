package com.openforge.taskcore.index;

/**
 * One nearest-neighbour result.
 *
 * @param templateId the matched template
 * @param distance   cosine distance; null when the index returned no usable score,
 *                   which callers must treat as a data-integrity fault
 */
public record NeighborHit(String templateId, Double distance) {

    public boolean hasDistance() {
        return distance != null && !distance.isNaN();
    }

    /** {@code 1 - distance} clamped to [0, 1]; 0 when there is no distance. */
    public double similarity() {
        if (!hasDistance()) return 0.0;
        return Math.max(0.0, Math.min(1.0, 1.0 - distance));
    }
}
