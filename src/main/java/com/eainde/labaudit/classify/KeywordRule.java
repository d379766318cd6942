package com.eainde.labaudit.classify;

import com.eainde.labaudit.model.ExperimentType;

import java.util.List;

/**
 * One row of a keyword table: any keyword (lower case, substring match) selects the type.
 */
public record KeywordRule(ExperimentType type, List<String> keywords) {

    public KeywordRule {
        keywords = List.copyOf(keywords);
    }

    public static KeywordRule of(ExperimentType type, String... keywords) {
        return new KeywordRule(type, List.of(keywords));
    }

    public boolean matches(String lowerCaseText) {
        return keywords.stream().anyMatch(lowerCaseText::contains);
    }
}
