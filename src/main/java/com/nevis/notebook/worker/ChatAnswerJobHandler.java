package com.nevis.notebook.worker;

import com.nevis.notebook.model.ChatAnswerTask;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.service.JobPayloadCodec;
import com.nevis.notebook.service.RagOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ChatAnswerJobHandler implements JobHandler {

    private final RagOrchestrator ragOrchestrator;
    private final JobPayloadCodec payloadCodec;

    @Override
    public ContentType contentType() {
        return ContentType.CHAT_ANSWER;
    }

    @Override
    public void handle(ProcessingJob job) {
        ChatAnswerTask task = payloadCodec.read(job.payload(), ChatAnswerTask.class);
        ChatTurn answer = ragOrchestrator.answerRecordedTurn(task);
        log.debug("Job {}: answered turn {} with turn {}", job.id(), task.userTurnId(), answer.id());
    }

    @Override
    public boolean hasRetainedInput(ProcessingJob job) {
        return job.payload() != null;
    }
}
