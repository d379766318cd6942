package com.eainde.labaudit.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of model text that may be wrapped in prose or a fenced block.
 *
 * <p>Three independent strategies, tried in order of preference by {@link #extract}:</p>
 * <ol>
 *   <li>{@link #parseWhole} - the whole text is the object</li>
 *   <li>{@link #parseFencedBlock} - the first triple-backtick block, optionally tagged {@code json}</li>
 *   <li>{@link #parseBraceSpan} - the greedy span from the first {@code {} to the last {@code }}</li>
 * </ol>
 * Each strategy only accepts a single JSON object with nothing after it; arrays and
 * scalars count as a miss.
 */
public class JsonExtraction {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern BRACE_SPAN = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectReader strictReader;

    public JsonExtraction(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<JsonNode> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return parseWhole(text)
                .or(() -> parseFencedBlock(text))
                .or(() -> parseBraceSpan(text));
    }

    public Optional<JsonNode> parseWhole(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return readObject(text.trim());
    }

    public Optional<JsonNode> parseFencedBlock(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return readObject(matcher.group(1));
    }

    public Optional<JsonNode> parseBraceSpan(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = BRACE_SPAN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return readObject(matcher.group());
    }

    private Optional<JsonNode> readObject(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = strictReader.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
