package com.novaware.catalog.service.variants;

import java.util.Random;

/**
 * Splits a stock total across parts with randomized proportions. The parts are never
 * negative and always sum to the total exactly.
 */
public final class StockDistributor {
    private StockDistributor() {}

    public static int[] distribute(int total, int parts, Random random) {
        if (parts <= 0) throw new IllegalArgumentException("parts must be positive: " + parts);
        int[] out = new int[parts];
        if (total <= 0) return out;

        double[] weights = new double[parts];
        double sum = 0;
        for (int i = 0; i < parts; i++) {
            weights[i] = Math.pow(random.nextDouble(), 1.5) + 0.2;
            sum += weights[i];
        }
        int assigned = 0;
        for (int i = 0; i < parts; i++) {
            out[i] = (int) Math.round(weights[i] / sum * total);
            assigned += out[i];
        }
        int diff = total - assigned;
        while (diff != 0) {
            int i = random.nextInt(parts);
            if (diff > 0) {
                out[i]++;
                diff--;
            } else if (out[i] > 0) {
                out[i]--;
                diff++;
            }
        }
        return out;
    }
}
