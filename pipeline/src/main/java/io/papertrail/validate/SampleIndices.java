package io.papertrail.validate;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/** Uniform selection of distinct row indices (Floyd's algorithm), returned in ascending order. */
public final class SampleIndices {
    private SampleIndices() {}

    public static long[] choose(long population, int k, Random random) {
        if (population < 0 || k < 0) throw new IllegalArgumentException("population and k must be >= 0");
        if (k >= population) {
            long[] all = new long[Math.toIntExact(population)];
            for (int i = 0; i < all.length; i++) all[i] = i;
            return all;
        }
        Set<Long> chosen = new HashSet<>(k * 2);
        for (long j = population - k; j < population; j++) {
            long t = random.nextLong(j + 1);
            if (!chosen.add(t)) chosen.add(j);
        }
        long[] out = chosen.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(out);
        return out;
    }
}
