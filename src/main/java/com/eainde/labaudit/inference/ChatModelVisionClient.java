package com.eainde.labaudit.inference;

import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.Base64;

/**
 * Sends the image as base64 {@link ImageContent} together with the analyst prompt to a
 * LangChain4j {@link ChatModel}.
 */
public class ChatModelVisionClient implements VisionInferenceClient {

    static final String DEFAULT_MIME_TYPE = "image/jpeg";

    public static final String ANALYST_PROMPT = """
            You are an expert pharmaceutical laboratory analyst with 20 years of experience
            in quality control and GMP compliance. Analyze this laboratory image in precise
            scientific detail.

            FIRST, identify the experiment type. State ONE of these on the very first line:
            EXPERIMENT_TYPE: MTT_CELL_VIABILITY (multi-well plate with purple/blue colored wells)
            EXPERIMENT_TYPE: GEL_ELECTROPHORESIS (gel with bands/lanes under UV or visible light)
            EXPERIMENT_TYPE: HPLC_CHROMATOGRAPHY (chromatogram chart with peaks)
            EXPERIMENT_TYPE: COLONY_COUNTING (petri dishes with bacterial colonies)
            EXPERIMENT_TYPE: OTHER (none of the above)

            On the second line rate how legible the image is as evidence, from 1 (unusable)
            to 10 (perfectly clear):
            IMAGE_QUALITY: <1-10>

            THEN describe EXACTLY what you observe:
            1. Overall image quality and clarity
            2. Sample conditions (color, turbidity, uniformity, morphology)
            3. Any visible anomalies, contamination, or irregularities
            4. Equipment/setup observations (if visible)
            5. Any signs of procedural deviation

            Be specific and quantitative where possible. Flag anything that looks unusual,
            inconsistent, or potentially problematic. Your observations will be compared
            against the Standard Operating Procedure.
            """;

    private final String modelName;
    private final ChatModel chatModel;

    public ChatModelVisionClient(String modelName, ChatModel chatModel) {
        this.modelName = modelName;
        this.chatModel = chatModel;
    }

    @Override
    public String analyzeImage(byte[] imageBytes, String mimeType) {
        String base64 = Base64.getEncoder().encodeToString(imageBytes);
        UserMessage message = UserMessage.from(
                TextContent.from(ANALYST_PROMPT),
                ImageContent.from(base64, mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType));

        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder().messages(message).build());
        } catch (RuntimeException e) {
            throw new InferenceException("Vision model " + modelName + " failed: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new InferenceException("Vision model " + modelName + " returned no text");
        }
        return text;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
