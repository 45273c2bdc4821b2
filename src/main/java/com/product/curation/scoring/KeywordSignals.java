package com.product.curation.scoring;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Keyword patterns grouped by how strongly they indicate a sales-development product.
 * All patterns match case-insensitively.
 */
public final class KeywordSignals {

    private final List<Pattern> high;
    private final List<Pattern> medium;
    private final List<Pattern> low;

    public KeywordSignals(List<String> high, List<String> medium, List<String> low) {
        this.high = compile(high);
        this.medium = compile(medium);
        this.low = compile(low);
    }

    public List<Pattern> high() {
        return high;
    }

    public List<Pattern> medium() {
        return medium;
    }

    public List<Pattern> low() {
        return low;
    }

    public static KeywordSignals defaults() {
        return new KeywordSignals(
                List.of(
                        "\\bSDR\\b",
                        "\\bBDR\\b",
                        "\\bsales\\s*rep\\b",
                        "\\bcold\\s*(email|outreach|call)",
                        "\\bprospecting\\b",
                        "\\blead\\s*(gen|generation)\\b",
                        "\\boutreach\\b",
                        "\\bsales\\s*automation\\b",
                        "\\bsales\\s*engagement\\b"),
                List.of(
                        "\\bCRM\\b",
                        "\\bpipeline\\b",
                        "\\bquota\\b",
                        "\\bconversion\\b",
                        "\\bresponse\\s*rate\\b",
                        "\\bemail\\s*(sequence|campaign)\\b",
                        "\\bLinkedIn\\b",
                        "\\bmeeting\\b",
                        "\\bdemo\\b",
                        "\\bclose\\b"),
                List.of(
                        "\\bAI\\b",
                        "\\bautomation\\b",
                        "\\bproductivity\\b",
                        "\\bworkflow\\b",
                        "\\bintegration\\b",
                        "\\banalytics\\b"));
    }

    private static List<Pattern> compile(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns are required");
        return patterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }
}
