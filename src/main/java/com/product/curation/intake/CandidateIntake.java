package com.product.curation.intake;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.Category;
import com.product.curation.core.model.ClaimType;
import com.product.curation.core.model.Feed;
import com.product.curation.core.model.FeedReliability;
import com.product.curation.store.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes extraction output into the store.
 *
 * <p>Candidates without a URL are dropped. Candidates are keyed by URL, so a URL that is
 * already stored reuses the existing candidate. New candidates start in
 * {@link CandidateStatus#ANALYZING}. Each claim is attached to every stored candidate whose
 * extracted name matches the claim's candidate name ignoring case. Finally the mention is
 * marked processed and linked to the first stored candidate, and the feed counters are
 * incremented, the useful counter only when at least one candidate was stored.</p>
 *
 * <p>The whole result is validated before the first write.</p>
 */
public class CandidateIntake {
    private static final Logger log = LoggerFactory.getLogger(CandidateIntake.class);

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final CandidateStore store;

    public CandidateIntake(CandidateStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * @throws IllegalArgumentException if the result references an unknown feed or mention,
     *                                  or contains an invalid candidate or claim
     */
    public IntakeResult ingest(ExtractionResult result) {
        Objects.requireNonNull(result, "result is required");
        validate(result);
        long feedId = resolveFeed(result);

        List<Long> candidateIds = new ArrayList<>();
        int claimsAdded = 0;
        int skipped = 0;
        for (ExtractedCandidate extracted : result.candidates()) {
            if (isBlank(extracted.url())) {
                skipped++;
                log.debug("intake.skipped name='{}' reason=no-url", extracted.name());
                continue;
            }
            Candidate stored = store.addCandidate(Candidate.builder()
                    .name(extracted.name().trim())
                    .url(extracted.url().trim())
                    .description(extracted.description())
                    .category(Category.fromWireName(extracted.category()))
                    .status(CandidateStatus.ANALYZING)
                    .build());
            candidateIds.add(stored.getId());

            String key = extracted.name().trim().toLowerCase(Locale.ROOT);
            for (ExtractedClaim claim : result.claims()) {
                if (claim.candidateName() != null
                        && claim.candidateName().trim().toLowerCase(Locale.ROOT).equals(key)) {
                    store.addClaim(stored.getId(), feedId,
                            ClaimType.parse(claim.claimType()).orElse(null),
                            claim.content().trim(),
                            claim.confidence() != null ? claim.confidence() : DEFAULT_CONFIDENCE,
                            claim.rawText());
                    claimsAdded++;
                }
            }
        }

        if (result.mentionId() != null) {
            store.markMentionProcessed(result.mentionId(), candidateIds.isEmpty() ? null : candidateIds.get(0));
        }
        store.incrementFeedCounters(feedId, !candidateIds.isEmpty());

        log.info("intake.completed feedId={} mentionId={} candidates={} claims={} skipped={}",
                feedId, result.mentionId(), candidateIds.size(), claimsAdded, skipped);
        return new IntakeResult(candidateIds, claimsAdded, skipped);
    }

    private void validate(ExtractionResult result) {
        if (result.feedId() == null && isBlank(result.feedName())) {
            throw new IllegalArgumentException("Extraction result must name its feed");
        }
        if (result.feedId() != null && store.getFeed(result.feedId()).isEmpty()) {
            throw new IllegalArgumentException("Feed not found: " + result.feedId());
        }
        if (result.mentionId() != null && store.getMention(result.mentionId()).isEmpty()) {
            throw new IllegalArgumentException("Mention not found: " + result.mentionId());
        }
        for (ExtractedCandidate candidate : result.candidates()) {
            if (candidate == null || isBlank(candidate.name())) {
                throw new IllegalArgumentException("Extracted candidate without a name");
            }
        }
        for (ExtractedClaim claim : result.claims()) {
            if (claim == null || isBlank(claim.content())) {
                throw new IllegalArgumentException("Extracted claim without content");
            }
            Double confidence = claim.confidence();
            if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
                throw new IllegalArgumentException("Claim confidence must be in [0, 1], got " + confidence);
            }
        }
    }

    private long resolveFeed(ExtractionResult result) {
        if (result.feedId() != null) {
            return result.feedId();
        }
        Feed feed = store.addFeed(result.feedName().trim(), null, FeedReliability.UNRATED);
        return feed.id();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
