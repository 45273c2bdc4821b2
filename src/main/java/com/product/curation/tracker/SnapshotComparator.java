package com.product.curation.tracker;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.ChangeType;
import com.product.curation.core.model.DetectedChange;
import com.product.curation.core.model.Snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a fresh page against the previous snapshot of the same candidate.
 *
 * <ul>
 *   <li>Content events are only considered when the previous fingerprint is present and
 *       differs. Differing pricing yields {@link ChangeType#PRICING_CHANGE}, differing
 *       features yields {@link ChangeType#FEATURE_ADDED}; when neither differs a single
 *       {@link ChangeType#CONTENT_CHANGE} is emitted instead.</li>
 *   <li>A {@link ChangeType#NEWS} event is emitted whenever both titles are present and
 *       differ, independently of the content outcome.</li>
 * </ul>
 */
public class SnapshotComparator {

    private static final int PRICING_EXCERPT = 100;
    private static final int TITLE_EXCERPT = 50;

    public List<DetectedChange> compare(Candidate candidate, Snapshot previous, PageSnapshot current) {
        List<DetectedChange> changes = new ArrayList<>();
        String previousHash = previous.contentHash();
        if (previousHash != null && !previousHash.isEmpty() && !previousHash.equals(current.contentHash())) {
            if (!Objects.equals(previous.pricingText(), current.pricingText())) {
                changes.add(change(candidate, ChangeType.PRICING_CHANGE,
                        describePricing(previous.pricingText(), current.pricingText())));
            }
            if (!Objects.equals(previous.featuresText(), current.featuresText())) {
                changes.add(change(candidate, ChangeType.FEATURE_ADDED,
                        describeFeatures(previous.featuresText(), current.featuresText())));
            }
            if (changes.isEmpty()) {
                changes.add(change(candidate, ChangeType.CONTENT_CHANGE, "Website content updated"));
            }
        }

        String previousTitle = previous.title();
        String currentTitle = current.title();
        if (previousTitle != null && currentTitle != null && !previousTitle.equals(currentTitle)) {
            changes.add(change(candidate, ChangeType.NEWS,
                    "Title changed: '" + truncate(currentTitle, TITLE_EXCERPT) + "'"));
        }
        return changes;
    }

    private static String describePricing(String before, String after) {
        if (before == null) {
            return "Pricing info added: " + truncate(after, PRICING_EXCERPT);
        }
        if (after == null) {
            return "Pricing info removed";
        }
        return "Pricing updated: " + truncate(after, PRICING_EXCERPT);
    }

    private static String describeFeatures(String before, String after) {
        if (before == null) {
            return "Features section added";
        }
        if (after == null) {
            return "Features section changed";
        }
        return "Features updated";
    }

    private static DetectedChange change(Candidate candidate, ChangeType type, String description) {
        return new DetectedChange(candidate.getId(), candidate.getName(), type, description, candidate.getUrl());
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
