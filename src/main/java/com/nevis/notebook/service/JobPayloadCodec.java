package com.nevis.notebook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.notebook.exception.ProcessingFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON form of the payload stored on a processing job.
 */
@Component
@RequiredArgsConstructor
public class JobPayloadCodec {

    private final ObjectMapper objectMapper;

    public String write(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job payload", e);
        }
    }

    public <T> T read(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new ProcessingFailedException("Job has no payload");
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ProcessingFailedException("Unreadable job payload: " + e.getOriginalMessage(), e);
        }
    }
}
