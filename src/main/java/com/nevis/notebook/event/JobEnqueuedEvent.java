package com.nevis.notebook.event;

import com.nevis.notebook.model.ContentType;

import java.util.UUID;

public record JobEnqueuedEvent(UUID jobId, ContentType contentType) {}
