package com.novaware.catalog.service.variants;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class StockDistributorTest {

    @Test
    public void partsAlwaysSumToTotal() {
        int[] totals = {10, 0, 5, 0, 1, 3, 97};
        for (long seed = 0; seed < 500; seed++) {
            Random random = new Random(seed);
            for (int total : totals) {
                for (int parts = 1; parts <= 6; parts++) {
                    int[] split = StockDistributor.distribute(total, parts, random);
                    assertEquals(parts, split.length);
                    int sum = 0;
                    for (int n : split) {
                        assertTrue(n >= 0, "negative stock for seed " + seed);
                        sum += n;
                    }
                    assertEquals(total, sum, "seed " + seed + " total " + total + " parts " + parts);
                }
            }
        }
    }

    @Test
    public void zeroTotalGivesZeros() {
        assertArrayEquals(new int[]{0, 0, 0}, StockDistributor.distribute(0, 3, new Random(1)));
        assertArrayEquals(new int[]{0, 0}, StockDistributor.distribute(-4, 2, new Random(1)));
    }

    @Test
    public void rejectsNoParts() {
        assertThrows(IllegalArgumentException.class, () -> StockDistributor.distribute(5, 0, new Random(1)));
    }
}
