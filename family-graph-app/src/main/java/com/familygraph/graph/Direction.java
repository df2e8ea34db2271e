package com.familygraph.graph;

/**
 * Whether an adjacency entry mirrors a stored edge as written (FORWARD) or its inverse (BACKWARD).
 */
public enum Direction {
    FORWARD,
    BACKWARD
}
