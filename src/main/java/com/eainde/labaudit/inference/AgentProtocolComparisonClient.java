package com.eainde.labaudit.inference;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProtocolComparisonClient} backed by the {@link ProtocolComparisonAgent} AI service.
 */
@Slf4j
public class AgentProtocolComparisonClient implements ProtocolComparisonClient {

    private final ProtocolComparisonAgent agent;

    public AgentProtocolComparisonClient(ProtocolComparisonAgent agent) {
        this.agent = agent;
    }

    @Override
    public String compare(String visionText, String protocolText) {
        try {
            String response = agent.compare(visionText, protocolText);
            log.info("Protocol comparison returned {} chars", response == null ? 0 : response.length());
            return response == null ? "" : response;
        } catch (RuntimeException e) {
            throw new InferenceException("Protocol comparison failed: " + e.getMessage(), e);
        }
    }
}
