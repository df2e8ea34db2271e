package com.familygraph.graph;

/**
 * Base type for failures that end a discovery or path query.
 */
public abstract class GraphQueryException extends RuntimeException {

    protected GraphQueryException(String message) {
        super(message);
    }
}
