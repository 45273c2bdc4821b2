package com.product.curation.scoring;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.Claim;
import com.product.curation.store.CandidateNotFoundException;
import com.product.curation.store.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Computes how relevant a candidate is to the index from its category, its claims and
 * its description. The score is a pure function of those inputs and the configured
 * {@link ScoringWeights}; scoring writes nothing.
 */
public class RelevanceScorer {
    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    private final CandidateStore store;
    private final ScoringWeights weights;
    private final KeywordSignals signals;

    public RelevanceScorer(CandidateStore store) {
        this(store, ScoringWeights.defaults(), KeywordSignals.defaults());
    }

    public RelevanceScorer(CandidateStore store, ScoringWeights weights, KeywordSignals signals) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.weights = Objects.requireNonNull(weights, "weights are required");
        this.signals = Objects.requireNonNull(signals, "signals are required");
    }

    /**
     * Scores a stored candidate using its current claims.
     *
     * @throws CandidateNotFoundException if the candidate does not exist
     */
    public ScoringResult score(long candidateId) {
        Candidate candidate = store.getCandidate(candidateId)
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));
        return score(candidate, store.listClaims(candidateId));
    }

    /**
     * Scores a candidate against the given claims.
     */
    public ScoringResult score(Candidate candidate, List<Claim> claims) {
        Objects.requireNonNull(candidate, "candidate is required");
        List<Claim> safeClaims = claims != null ? claims : List.of();
        List<String> reasons = new ArrayList<>();
        double score = 0.0;

        double categoryScore = weights.categoryWeight(candidate.getCategory()) * weights.getCategoryFactor();
        score += categoryScore;
        reasons.add(String.format(Locale.ROOT, "Category '%s': +%.2f",
                candidate.getCategory().wireName(), categoryScore));

        if (!safeClaims.isEmpty()) {
            double claimBonus = Math.min(safeClaims.size() * weights.getPerClaimBonus(), weights.getClaimBonusCap());
            score += claimBonus;
            reasons.add(String.format(Locale.ROOT, "%d claims: +%.2f", safeClaims.size(), claimBonus));

            String claimText = safeClaims.stream()
                    .map(Claim::content)
                    .collect(Collectors.joining(" "));
            KeywordScore keywords = keywordScore(claimText);
            score += keywords.score();
            reasons.addAll(keywords.reasons());

            double avgConfidence = safeClaims.stream()
                    .mapToDouble(Claim::confidence)
                    .average()
                    .orElse(0.0);
            double confidenceBonus = avgConfidence * weights.getConfidenceFactor();
            score += confidenceBonus;
            reasons.add(String.format(Locale.ROOT, "Avg confidence %.2f: +%.2f", avgConfidence, confidenceBonus));
        }

        String description = candidate.getDescription();
        if (description != null && !description.isBlank()) {
            double descriptionBonus = keywordScore(description).score() * weights.getDescriptionFactor();
            if (descriptionBonus > 0) {
                score += descriptionBonus;
                reasons.add(String.format(Locale.ROOT, "Description keywords: +%.2f", descriptionBonus));
            }
        }

        int feedCount = (int) safeClaims.stream()
                .mapToLong(Claim::feedId)
                .distinct()
                .count();
        if (feedCount > 1) {
            double feedBonus = Math.min(feedCount * weights.getPerFeedBonus(), weights.getFeedBonusCap());
            score += feedBonus;
            reasons.add(String.format(Locale.ROOT, "%d sources: +%.2f", feedCount, feedBonus));
        }

        double clamped = Math.max(0.0, Math.min(1.0, score));
        log.debug("scoring.computed candidateId={} score={} claims={} feeds={}",
                candidate.getId(), clamped, safeClaims.size(), feedCount);
        return new ScoringResult(candidate.getId(), clamped, reasons, safeClaims.size(), feedCount);
    }

    /**
     * Sums the weights of every signal that occurs in the text, each signal counted once.
     * Only high signals produce reasons, at most {@link ScoringWeights#getMaxKeywordReasons()}.
     */
    KeywordScore keywordScore(String text) {
        if (text == null || text.isEmpty()) {
            return new KeywordScore(0.0, List.of());
        }
        double score = 0.0;
        List<String> reasons = new ArrayList<>();
        for (Pattern pattern : signals.high()) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                score += weights.getHighSignalWeight();
                if (reasons.size() < weights.getMaxKeywordReasons()) {
                    reasons.add(String.format(Locale.ROOT, "'%s': +%.2f",
                            matcher.group(), weights.getHighSignalWeight()));
                }
            }
        }
        score += countMatching(signals.medium(), text) * weights.getMediumSignalWeight();
        score += countMatching(signals.low(), text) * weights.getLowSignalWeight();
        return new KeywordScore(Math.min(score, weights.getKeywordCap()), reasons);
    }

    private static int countMatching(List<Pattern> patterns, String text) {
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                count++;
            }
        }
        return count;
    }

    record KeywordScore(double score, List<String> reasons) {
    }
}
