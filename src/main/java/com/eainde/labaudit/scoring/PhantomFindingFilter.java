package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.Finding;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Drops low-severity findings that only restate an inability to assess something.
 *
 * <p>An inability to assess is a checklist fact, not a finding; counting it twice would
 * penalize the score for the same missing information. A finding is dropped only when
 * its severity is MINOR or OBSERVATION <em>and</em> its observation, discrepancy or impact
 * text matches one of the non-substantive patterns. CRITICAL and MAJOR findings always stay.</p>
 */
@Slf4j
public class PhantomFindingFilter {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "cannot be (verified|assessed|determined|confirmed|evaluated|observed)",
            "can ?not (verify|assess|determine|confirm|evaluate)",
            "unable to (verify|assess|determine|confirm|evaluate)",
            "not (possible|feasible) to (verify|assess|determine|confirm|evaluate)",
            "not (visible|verifiable|discernible|determinable|assessable) (in|from) ((the|a|this) )?(static |single |provided )?(image|photo|photograph|picture)",
            "(from|in) ((a|the|this) )?(static|single) (image|photo|photograph|picture)",
            "static (image|photo|photograph|picture)",
            "insufficient (information|evidence|detail|resolution)",
            "no (information|data|documentation|record) (is |was )?(available|provided|visible)",
            "(lack|absence) of (information|documentation|records|metadata) (to|for) (verify|assess|confirm)");

    private final List<Pattern> patterns;

    public PhantomFindingFilter() {
        this(DEFAULT_PATTERNS);
    }

    public PhantomFindingFilter(List<String> patterns) {
        this.patterns = patterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public List<Finding> filter(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return List.of();
        }
        return findings.stream()
                .filter(finding -> {
                    boolean phantom = isPhantom(finding);
                    if (phantom) {
                        log.debug("Dropping non-substantive {} finding {}", finding.severity(), finding.id());
                    }
                    return !phantom;
                })
                .toList();
    }

    public boolean isPhantom(Finding finding) {
        if (finding.severity() == null || !finding.severity().isLow()) {
            return false;
        }
        String text = finding.assessedText().toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }
}
