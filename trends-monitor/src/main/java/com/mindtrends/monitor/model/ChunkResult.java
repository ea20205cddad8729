package com.mindtrends.monitor.model;

/**
 * Outcome of fetching one {@link ChunkWindow}: either a {@link SeriesChunk}
 * or a {@link FetchFailure}. Callers branch on {@link #isSuccess()}.
 */
public interface ChunkResult {

    ChunkWindow window();

    boolean isSuccess();
}
