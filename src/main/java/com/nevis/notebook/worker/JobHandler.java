package com.nevis.notebook.worker;

import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.ProcessingJob;

/**
 * Does the work of one content type. Must be safe to run more than once for the
 * same job.
 */
public interface JobHandler {

    ContentType contentType();

    void handle(ProcessingJob job);

    /**
     * Whether the input needed to redo the job from scratch is still stored.
     */
    boolean hasRetainedInput(ProcessingJob job);
}
