package com.nevis.notebook.exception;

import com.nevis.notebook.model.JobStatus;
import lombok.Getter;

@Getter
public class InvalidStatusTransitionException extends RuntimeException {
    private final JobStatus from;
    private final JobStatus to;

    public InvalidStatusTransitionException(JobStatus from, JobStatus to) {
        super("Illegal job status transition: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }
}
