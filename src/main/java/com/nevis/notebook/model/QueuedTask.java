package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record QueuedTask(UUID jobId, int deliveryCount, OffsetDateTime enqueuedAt) {}
