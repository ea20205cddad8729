package com.mindtrends.monitor.model;

/**
 * How one chunk was put onto the scale of the chunk before it.
 *
 * @param ratio         multiplier applied to {@code to}'s raw values relative to {@code from};
 *                      a later chunk reported at twice the true scale gives a ratio of 0.5
 * @param overlapDays   dates present in both chunks
 * @param lowConfidence true when the ratio fell back to 1.0
 * @param reason        why the ratio fell back, null when it did not
 */
public record CalibrationLink(ChunkWindow from,
                              ChunkWindow to,
                              double ratio,
                              int overlapDays,
                              boolean lowConfidence,
                              DegenerateReason reason) {

    public enum DegenerateReason {
        NO_OVERLAP,
        ZERO_OVERLAP_MEAN
    }
}
