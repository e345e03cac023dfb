package com.novaware.catalog.service.identity;

import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.Review;
import com.novaware.catalog.model.ReviewerIdentity;
import com.novaware.catalog.store.ReviewerIdentityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Fills an item's reviews up to its declared review count using existing reviewer identities.
 *
 * <p>Reviewers already present on the item are not sampled again, and a generated review is
 * staged only if its dedup key is unused. Rating and count are then recomputed from the full
 * list, so a second pass over the same item finds the target met or the shortfall accepted.
 */
@Component
public class ReviewTopUp {
    private static final Logger log = LoggerFactory.getLogger(ReviewTopUp.class);

    private final ReviewerIdentityStore identityStore;
    private final ReviewTextGenerator textGenerator;
    private final LongSupplier clock;

    @Autowired
    public ReviewTopUp(ReviewerIdentityStore identityStore, ReviewTextGenerator textGenerator) {
        this(identityStore, textGenerator, System::currentTimeMillis);
    }

    ReviewTopUp(ReviewerIdentityStore identityStore, ReviewTextGenerator textGenerator, LongSupplier clock) {
        this.identityStore = identityStore;
        this.textGenerator = textGenerator;
        this.clock = clock;
    }

    public static class Result {
        private final List<Review> reviews;
        private final int added;
        private final ReviewAggregates aggregates;

        Result(List<Review> reviews, int added) {
            this.reviews = reviews;
            this.added = added;
            this.aggregates = ReviewAggregates.of(reviews);
        }

        public List<Review> getReviews() { return reviews; }
        public int getAdded() { return added; }
        public ReviewAggregates getAggregates() { return aggregates; }
    }

    /** Missing review count, zero when the item already meets its target. */
    public static int shortfall(CatalogItem item) {
        int target = item.getNum_reviews() != null ? item.getNum_reviews() : 0;
        int have = item.getReviews() != null ? item.getReviews().size() : 0;
        return Math.max(0, target - have);
    }

    public Mono<Result> topUp(CatalogItem item, Random random) {
        List<Review> reviews = item.getReviews() != null ? new ArrayList<>(item.getReviews()) : new ArrayList<>();
        int missing = shortfall(item);
        if (missing == 0) return Mono.just(new Result(reviews, 0));

        Set<String> present = new LinkedHashSet<>();
        Set<String> keys = new HashSet<>();
        for (Review r : reviews) {
            if (r.getReviewer_id() != null) present.add(r.getReviewer_id());
            keys.add(r.dedupKey());
        }
        return identityStore.sample(missing, present)
                .collectList()
                .map(sampled -> {
                    int added = 0;
                    long now = clock.getAsLong();
                    for (ReviewerIdentity identity : sampled) {
                        int rating = 1 + random.nextInt(5);
                        Review review = new Review(identity.getId(), identity.getName(), rating,
                                textGenerator.comment(rating, random), now);
                        if (keys.add(review.dedupKey())) {
                            reviews.add(review);
                            added++;
                        }
                    }
                    if (added < missing) {
                        log.debug("top-up id={} short by {} reviewers, accepting {} reviews", item.getId(),
                                missing - added, reviews.size());
                    }
                    return new Result(reviews, added);
                });
    }
}
