package com.eainde.labaudit.classify;

import com.eainde.labaudit.model.ExperimentType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keyword classification of experiment types. Both tables are ordered data; the first
 * matching row wins.
 *
 * <ul>
 *   <li>{@link #PROTOCOL_RULES} are matched against the first line of the protocol, which
 *       carries its title and usually its protocol id prefix (e.g. {@code SOP-GE}).</li>
 *   <li>{@link #DESCRIPTION_RULES} are matched against the whole vision description.</li>
 * </ul>
 */
public class ExperimentTypeClassifier {

    public static final List<KeywordRule> PROTOCOL_RULES = List.of(
            KeywordRule.of(ExperimentType.MTT_CELL_VIABILITY, "mtt", "cell viability", "sop-cv"),
            KeywordRule.of(ExperimentType.GEL_ELECTROPHORESIS, "gel", "electrophoresis", "sop-ge"),
            KeywordRule.of(ExperimentType.HPLC_CHROMATOGRAPHY, "hplc", "chromatograph", "sop-hp"),
            KeywordRule.of(ExperimentType.COLONY_COUNTING, "colony", "cfu", "bacterial", "sop-bc"));

    public static final List<KeywordRule> DESCRIPTION_RULES = List.of(
            KeywordRule.of(ExperimentType.MTT_CELL_VIABILITY,
                    "mtt", "96-well", "microplate", "well plate", "formazan", "purple well", "cell viability"),
            KeywordRule.of(ExperimentType.GEL_ELECTROPHORESIS,
                    "gel electrophoresis", "agarose", "gel band", "dna gel", "gel lane", "electrophoresis"),
            KeywordRule.of(ExperimentType.HPLC_CHROMATOGRAPHY,
                    "hplc", "chromatogram", "chromatography", "retention time", "peak area"),
            KeywordRule.of(ExperimentType.COLONY_COUNTING,
                    "colony count", "cfu", "petri dish", "bacterial colony", "agar plate"));

    private final List<KeywordRule> protocolRules;
    private final List<KeywordRule> descriptionRules;

    public ExperimentTypeClassifier() {
        this(PROTOCOL_RULES, DESCRIPTION_RULES);
    }

    public ExperimentTypeClassifier(List<KeywordRule> protocolRules, List<KeywordRule> descriptionRules) {
        this.protocolRules = List.copyOf(protocolRules);
        this.descriptionRules = List.copyOf(descriptionRules);
    }

    /** Keyword classification of a vision description; {@code OTHER} when nothing matches. */
    public ExperimentType classifyDescription(String description) {
        if (description == null || description.isBlank()) {
            return ExperimentType.OTHER;
        }
        return firstMatch(descriptionRules, description.toLowerCase(Locale.ROOT))
                .orElse(ExperimentType.OTHER);
    }

    /** Type the protocol expects, judged from its first non-blank line only. */
    public Optional<ExperimentType> expectedForProtocol(String protocolText) {
        if (protocolText == null || protocolText.isBlank()) {
            return Optional.empty();
        }
        String firstLine = protocolText.strip().lines().findFirst().orElse("");
        return firstMatch(protocolRules, firstLine.toLowerCase(Locale.ROOT));
    }

    private static Optional<ExperimentType> firstMatch(List<KeywordRule> rules, String lowerCaseText) {
        return rules.stream()
                .filter(rule -> rule.matches(lowerCaseText))
                .map(KeywordRule::type)
                .findFirst();
    }
}
