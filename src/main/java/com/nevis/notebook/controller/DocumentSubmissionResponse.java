package com.nevis.notebook.controller;

import com.nevis.notebook.model.DocumentSubmission;

public record DocumentSubmissionResponse(
    DocumentResponse document,
    JobResponse job
) {
    static DocumentSubmissionResponse from(DocumentSubmission submission) {
        return new DocumentSubmissionResponse(
            DocumentResponse.from(submission.document()),
            JobResponse.from(submission.job()));
    }
}
