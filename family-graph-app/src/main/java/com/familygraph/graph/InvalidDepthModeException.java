package com.familygraph.graph;

public class InvalidDepthModeException extends GraphQueryException {

    public InvalidDepthModeException(String value) {
        super("Invalid depth mode '" + value + "'. Use 'up_to' or 'only_at'");
    }
}
