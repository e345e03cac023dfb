package com.novaware.catalog.service.identity;

import com.novaware.catalog.model.ExternalReview;
import com.novaware.catalog.model.Review;
import com.novaware.catalog.model.ReviewerIdentity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Appends external reviews to an item's review list, rejecting any whose
 * (reviewer id, comment) key is already present or was staged earlier in the same merge.
 */
@Component
public class ReviewMerger {
    public static final String COMMENT_FALLBACK = "No comment";

    private final LongSupplier clock;

    public ReviewMerger() {
        this(System::currentTimeMillis);
    }

    ReviewMerger(LongSupplier clock) {
        this.clock = clock;
    }

    public static class Outcome {
        private final List<Review> reviews;
        private final int added;
        private final int duplicates;
        private final int quotaDropped;
        private final int unmapped;

        Outcome(List<Review> reviews, int added, int duplicates, int quotaDropped, int unmapped) {
            this.reviews = reviews;
            this.added = added;
            this.duplicates = duplicates;
            this.quotaDropped = quotaDropped;
            this.unmapped = unmapped;
        }

        public List<Review> getReviews() { return reviews; }
        public int getAdded() { return added; }
        public int getDuplicates() { return duplicates; }
        public int getQuotaDropped() { return quotaDropped; }
        /** Reviews whose reviewer has no identity for reasons other than quota. */
        public int getUnmapped() { return unmapped; }
    }

    public Review toReview(ExternalReview ext, ReviewerIdentity identity) {
        String comment = firstNonBlank(ext.getText(), ext.getTitle());
        int rating = ext.getRating() != null ? (int) Math.round(ext.getRating()) : 0;
        long createdAt = ext.getTimestamp() != null ? ext.getTimestamp() : clock.getAsLong();
        return new Review(identity.getId(), identity.getName(), rating, comment, createdAt);
    }

    public Outcome merge(List<Review> existing, List<ExternalReview> incoming, IdentityResolution identities) {
        List<Review> merged = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Review r : merged) seen.add(r.dedupKey());

        int added = 0;
        int duplicates = 0;
        int quotaDropped = 0;
        int unmapped = 0;
        for (ExternalReview ext : incoming) {
            ReviewerIdentity identity = identities.get(ext.getReviewer_key());
            if (identity == null) {
                if (identities.isQuotaDropped(ext.getReviewer_key())) quotaDropped++;
                else unmapped++;
                continue;
            }
            Review review = toReview(ext, identity);
            if (!seen.add(review.dedupKey())) {
                duplicates++;
                continue;
            }
            merged.add(review);
            added++;
        }
        return new Outcome(merged, added, duplicates, quotaDropped, unmapped);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return COMMENT_FALLBACK;
    }
}
