package com.eainde.labaudit.inference;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every inference call. Message content is not logged;
 * it contains the image payload.
 */
public class InferenceLoggingListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(InferenceLoggingListener.class);

    static final String START_TIME = "labaudit.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending request to model {} ({} messages)",
                requestContext.chatRequest().parameters().modelName(),
                requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Model {} responded in {}ms", responseContext.chatRequest().parameters().modelName(), duration);
            return;
        }
        log.info("Model {} responded in {}ms - tokens input: {}, output: {}, total: {}",
                responseContext.chatRequest().parameters().modelName(),
                duration,
                usage.inputTokenCount(),
                usage.outputTokenCount(),
                usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Inference call failed", errorContext.error());
    }
}
