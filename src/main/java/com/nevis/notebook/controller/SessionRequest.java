package com.nevis.notebook.controller;

import jakarta.validation.constraints.Size;

public record SessionRequest(
    @Size(max = 200)
    String title
) {}
