package com.product.curation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to produce comparison keys for names and URLs.
 *
 * <p>Input is lowercased and trimmed first, then every rule for the requested target runs
 * in priority order. Null or blank input normalizes to the empty string.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalizeName(String name) {
        return normalize(name, NormalizationTarget.NAME);
    }

    public String normalizeUrl(String url) {
        return normalize(url, NormalizationTarget.URL);
    }

    public String normalize(String value, NormalizationTarget target) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String result = value.toLowerCase(Locale.ROOT).trim();
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(target)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }
        return result;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
