package com.nevis.notebook.model;

import com.nevis.notebook.exception.InvalidStatusTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, FAILED));
        // PENDING is reachable from PROCESSING only through the recovery sweep
        TRANSITIONS.put(PROCESSING, EnumSet.of(COMPLETED, FAILED, PENDING));
        // explicit user retry / reprocess
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
        TRANSITIONS.put(COMPLETED, EnumSet.of(PENDING));
    }

    public boolean canTransitionTo(JobStatus target) {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet()).contains(target);
    }

    public void checkTransition(JobStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(this, target);
        }
    }
}
