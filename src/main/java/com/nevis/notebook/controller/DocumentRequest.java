package com.nevis.notebook.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record DocumentRequest(
    @NotBlank
    String title,

    @NotEmpty
    List<@Valid PageRequest> pages
) {}
