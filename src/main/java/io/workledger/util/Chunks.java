package io.workledger.util;

import java.util.ArrayList;
import java.util.List;

public final class Chunks {
    private Chunks() {
    }

    /**
     * Splits {@code items} into consecutive views of at most {@code size} elements, in order.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("chunk size must be positive: " + size);
        }
        List<List<T>> out = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            out.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return out;
    }
}
