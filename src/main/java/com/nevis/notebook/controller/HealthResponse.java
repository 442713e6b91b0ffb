package com.nevis.notebook.controller;

import com.nevis.notebook.model.BackendHealth;

public record HealthResponse(
    String status,
    BackendHealth embedding,
    BackendHealth generation
) {}
