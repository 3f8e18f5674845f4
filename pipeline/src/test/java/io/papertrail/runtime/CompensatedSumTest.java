package io.papertrail.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CompensatedSumTest {

    @Test
    void skips_nulls_nan_and_text() {
        CompensatedSum s = new CompensatedSum();
        s.addIfPresent(10.0);
        s.addIfPresent(null);
        s.addIfPresent(Double.NaN);
        s.addIfPresent("5");
        s.addIfPresent(5L);
        assertEquals(15.0, s.value());
        assertEquals(2, s.count());
    }

    @Test
    void keeps_small_terms_next_to_large_ones() {
        CompensatedSum s = new CompensatedSum();
        s.add(1e16);
        for (int i = 0; i < 1000; i++) s.add(1.0);
        s.add(-1e16);
        assertEquals(1000.0, s.value());
    }
}
