package com.novaware.catalog.service.identity;

import com.novaware.catalog.model.Review;

import java.util.List;

/** Rating and review count derived from the full review list. */
public final class ReviewAggregates {
    private final double rating;
    private final int numReviews;

    private ReviewAggregates(double rating, int numReviews) {
        this.rating = rating;
        this.numReviews = numReviews;
    }

    public static ReviewAggregates of(List<Review> reviews) {
        if (reviews == null || reviews.isEmpty()) return new ReviewAggregates(0.0, 0);
        long sum = 0;
        for (Review r : reviews) sum += r.getRating();
        double mean = (double) sum / reviews.size();
        return new ReviewAggregates(Math.round(mean * 10) / 10.0, reviews.size());
    }

    public double getRating() { return rating; }
    public int getNumReviews() { return numReviews; }
}
