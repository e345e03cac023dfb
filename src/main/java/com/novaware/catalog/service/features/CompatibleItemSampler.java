package com.novaware.catalog.service.features;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** Uniform shuffle-then-slice sample of peer items, excluding the item itself. */
public final class CompatibleItemSampler {
    private CompatibleItemSampler() {}

    public static List<String> sample(Collection<String> peers, String selfId, int k, Random random) {
        if (peers == null || peers.isEmpty() || k <= 0) return new ArrayList<>();
        List<String> pool = new ArrayList<>(peers.size());
        for (String p : peers) {
            if (p != null && !p.equals(selfId)) pool.add(p);
        }
        Collections.shuffle(pool, random);
        return new ArrayList<>(pool.subList(0, Math.min(k, pool.size())));
    }
}
