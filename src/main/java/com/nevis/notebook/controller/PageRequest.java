package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record PageRequest(
    @NotNull
    @Positive
    @JsonProperty("page_number")
    Integer pageNumber,

    @NotNull
    String text
) {}
