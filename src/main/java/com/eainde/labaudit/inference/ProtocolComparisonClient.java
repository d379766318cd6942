package com.eainde.labaudit.inference;

/**
 * Hosted reasoning model that compares an image description against protocol text.
 */
public interface ProtocolComparisonClient {

    /**
     * @return raw model output, expected (but not guaranteed) to be the JSON audit object
     * @throws InferenceException if the call fails
     */
    String compare(String visionText, String protocolText);
}
