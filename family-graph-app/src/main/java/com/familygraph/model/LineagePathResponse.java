package com.familygraph.model;

import java.util.List;

public record LineagePathResponse(
    boolean connectionFound,
    boolean samePerson,
    String message,
    Long commonPersonId,
    int personCount,
    List<PathNode> path
) {}
