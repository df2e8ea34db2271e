package com.familygraph.model;

import java.util.List;

public record RelativesNetworkResponse(
    Long personId,
    int depth,
    String depthMode,
    int totalCount,
    int matchedCount,
    boolean truncated,
    List<RelativeInfo> relatives
) {}
