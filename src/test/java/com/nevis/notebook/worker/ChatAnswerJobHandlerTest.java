package com.nevis.notebook.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.notebook.exception.ProcessingFailedException;
import com.nevis.notebook.model.ChatAnswerTask;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.model.TurnRole;
import com.nevis.notebook.service.JobPayloadCodec;
import com.nevis.notebook.service.RagOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatAnswerJobHandlerTest {

    @Mock
    private RagOrchestrator ragOrchestrator;

    private JobPayloadCodec payloadCodec;
    private ChatAnswerJobHandler handler;

    @BeforeEach
    void setUp() {
        payloadCodec = new JobPayloadCodec(new ObjectMapper());
        handler = new ChatAnswerJobHandler(ragOrchestrator, payloadCodec);
    }

    @Test
    void shouldAnswerTheRecordedTurn() {
        ChatAnswerTask task = new ChatAnswerTask(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 7L,
            "What changed?", true, List.of(UUID.randomUUID()));
        when(ragOrchestrator.answerRecordedTurn(task)).thenReturn(new ChatTurn(UUID.randomUUID(), 8L,
            task.sessionId(), TurnRole.ASSISTANT, "Costs fell.", List.of(), OffsetDateTime.now()));

        handler.handle(job(payloadCodec.write(task)));

        verify(ragOrchestrator).answerRecordedTurn(task);
    }

    @Test
    void shouldFailWithoutPayload() {
        ProcessingJob job = job(null);

        assertThat(handler.hasRetainedInput(job)).isFalse();
        assertThatThrownBy(() -> handler.handle(job)).isInstanceOf(ProcessingFailedException.class);
        verifyNoInteractions(ragOrchestrator);
    }

    private static ProcessingJob job(String payload) {
        return new ProcessingJob(UUID.randomUUID(), ContentType.CHAT_ANSWER, UUID.randomUUID(), JobStatus.PROCESSING,
            null, 0, payload, OffsetDateTime.now(), OffsetDateTime.now(), OffsetDateTime.now());
    }
}
