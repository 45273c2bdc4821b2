package com.product.curation.rules;

import java.util.List;

/**
 * Built-in rules for product names and product URLs.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine holding every default name and URL rule.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getNameRules());
        engine.addRules(getUrlRules());
        return engine;
    }

    /**
     * Name rules: drop a trailing domain suffix ("apollo.io" → "apollo"), then drop every
     * character that is not a lowercase letter or digit.
     */
    public static List<NormalizationRule> getNameRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("name-domain-suffix")
                        .pattern("\\.(io|ai|com|co|app)$")
                        .target(NormalizationTarget.NAME)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("name-non-alphanumeric")
                        .pattern("[^a-z0-9]")
                        .target(NormalizationTarget.NAME)
                        .priority(100)
                        .build()
        );
    }

    /**
     * URL rules: strip the scheme, a leading "www." and trailing slashes.
     */
    public static List<NormalizationRule> getUrlRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("url-scheme")
                        .pattern("^https?://")
                        .target(NormalizationTarget.URL)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("url-www")
                        .pattern("^www\\.")
                        .target(NormalizationTarget.URL)
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("url-trailing-slash")
                        .pattern("/+$")
                        .target(NormalizationTarget.URL)
                        .priority(30)
                        .build()
        );
    }
}
