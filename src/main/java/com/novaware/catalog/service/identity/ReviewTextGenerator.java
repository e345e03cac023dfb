package com.novaware.catalog.service.identity;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/** Short review comments assembled from a fixed phrase bank, toned by the rating. */
@Component
public class ReviewTextGenerator {
    private static final List<String> POSITIVE = List.of(
            "Fits exactly as described.",
            "Great quality for the price.",
            "The fabric feels soft and comfortable.",
            "Looks even better in person.",
            "Would definitely buy this again.",
            "Arrived quickly and well packaged.");
    private static final List<String> NEUTRAL = List.of(
            "Decent item overall.",
            "Sizing runs a little small.",
            "Color is slightly different from the photos.",
            "Does the job, nothing special.",
            "Okay for everyday wear.");
    private static final List<String> NEGATIVE = List.of(
            "Material feels thinner than expected.",
            "Stitching came loose after a few washes.",
            "Did not fit as described.",
            "Not worth the price.");

    public String comment(int rating, Random random) {
        List<String> bank = rating >= 4 ? POSITIVE : (rating == 3 ? NEUTRAL : NEGATIVE);
        String first = bank.get(random.nextInt(bank.size()));
        if (random.nextBoolean()) return first;
        String second = bank.get(random.nextInt(bank.size()));
        return second.equals(first) ? first : first + " " + second;
    }
}
