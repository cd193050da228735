package com.changefeed.gateway.snapshot;

import java.util.List;
import java.util.Map;

/**
 * Baseline rows of one channel. Subscribing with {@code resumeFrom = atSequence} delivers every
 * change made after the rows were read; some of them may already be reflected in the rows.
 */
public record SnapshotResponse(
    String channel, long atSequence, int rowCount, boolean truncated, List<Map<String, Object>> rows) {}
