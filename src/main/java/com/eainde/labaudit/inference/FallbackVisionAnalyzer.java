package com.eainde.labaudit.inference;

import com.eainde.labaudit.model.VisionOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Tries each configured vision model once, in order, and returns the first description.
 *
 * <p>Never throws: when every model fails the outcome is a failure carrying the last
 * error, which downstream stages receive as text.</p>
 */
@Slf4j
public class FallbackVisionAnalyzer {

    private final List<VisionInferenceClient> clients;

    public FallbackVisionAnalyzer(List<VisionInferenceClient> clients) {
        this.clients = List.copyOf(clients);
    }

    public VisionOutcome analyze(byte[] imageBytes, String mimeType) {
        String lastError = "no vision models configured";
        for (VisionInferenceClient client : clients) {
            try {
                String description = client.analyzeImage(imageBytes, mimeType);
                if (description == null || description.isBlank()) {
                    lastError = client.modelName() + " returned no text";
                    log.warn("Vision model {} returned no text - trying next model", client.modelName());
                    continue;
                }
                log.info("Vision analysis produced by {} ({} chars)", client.modelName(), description.length());
                return VisionOutcome.success(description, client.modelName());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("Vision model {} failed - trying next model: {}", client.modelName(), e.getMessage());
            }
        }
        log.error("All {} vision models failed; last error: {}", clients.size(), lastError);
        return VisionOutcome.failure(lastError);
    }

    public List<String> modelNames() {
        return clients.stream().map(VisionInferenceClient::modelName).toList();
    }
}
