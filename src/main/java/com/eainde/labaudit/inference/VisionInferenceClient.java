package com.eainde.labaudit.inference;

/**
 * One hosted vision model that describes a laboratory image.
 */
public interface VisionInferenceClient {

    /**
     * @return the model's description, beginning with the {@code EXPERIMENT_TYPE:} and
     *         {@code IMAGE_QUALITY:} markers when the model follows instructions
     * @throws InferenceException if the call fails or the model returns no text
     */
    String analyzeImage(byte[] imageBytes, String mimeType);

    String modelName();
}
