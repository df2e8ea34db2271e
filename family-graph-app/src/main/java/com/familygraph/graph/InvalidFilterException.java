package com.familygraph.graph;

public class InvalidFilterException extends GraphQueryException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
