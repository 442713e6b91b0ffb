package com.nevis.notebook.model;

public record BackendHealth(
    String backend,
    String provider,
    String model,
    boolean reachable,
    Integer dimension,
    Boolean dimensionMatches,
    String error
) {}
