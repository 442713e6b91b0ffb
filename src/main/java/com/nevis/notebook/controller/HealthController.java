package com.nevis.notebook.controller;

import com.nevis.notebook.model.BackendHealth;
import com.nevis.notebook.service.EmbeddingGateway;
import com.nevis.notebook.service.GenerationClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingGateway embeddingGateway;
    private final GenerationClient generationClient;

    @GetMapping("/backends")
    public ResponseEntity<HealthResponse> backends() {
        BackendHealth embedding = embeddingGateway.healthCheck();
        BackendHealth generation = generationClient.healthCheck();

        boolean healthy = embedding.reachable()
            && !Boolean.FALSE.equals(embedding.dimensionMatches())
            && generation.reachable();

        HealthResponse response = new HealthResponse(healthy ? "UP" : "DEGRADED", embedding, generation);
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
