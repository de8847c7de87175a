package com.partner.match.utils;

import com.partner.match.models.FibonacciHeap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

public final class AlgorithmUtils {
    private AlgorithmUtils() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Bottom-up merge sort. Stable, and unlike {@link List#sort} it never rejects a
     * comparator that is not transitive (tolerance-based comparators are not).
     */
    @SuppressWarnings("unchecked")
    public static <T> List<T> stableSort(List<T> items, Comparator<? super T> comparator) {
        Object[] src = items.toArray();
        int n = src.length;
        if (n < 2) {
            return new ArrayList<>(items);
        }
        Object[] buf = new Object[n];

        for (int width = 1; width < n; width *= 2) {
            for (int lo = 0; lo < n - width; lo += 2 * width) {
                int mid = lo + width;
                int hi = Math.min(lo + 2 * width, n);
                int i = lo, j = mid, k = lo;
                while (i < mid && j < hi) {
                    if (comparator.compare((T) src[j], (T) src[i]) < 0) {
                        buf[k++] = src[j++];
                    } else {
                        buf[k++] = src[i++];
                    }
                }
                while (i < mid) buf[k++] = src[i++];
                while (j < hi) buf[k++] = src[j++];
                System.arraycopy(buf, lo, src, lo, hi - lo);
            }
        }

        List<T> sorted = new ArrayList<>(n);
        for (Object o : Arrays.asList(src)) {
            sorted.add((T) o);
        }
        return sorted;
    }

    /**
     * Highest-scoring {@code k} items in descending score order. Equal scores keep their
     * input order, so the result matches a stable sort followed by truncation.
     */
    public static <T> List<T> topK(List<T> items, ToDoubleFunction<? super T> score, int k) {
        if (k <= 0 || items.isEmpty()) {
            return List.of();
        }
        Comparator<Ranked<T>> lowestFirst = (a, b) -> {
            int c = Double.compare(a.score(), b.score());
            return c != 0 ? c : Integer.compare(b.index(), a.index());
        };
        FibonacciHeap<Ranked<T>> heap = new FibonacciHeap<>(lowestFirst);

        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            heap.insert(new Ranked<>(item, score.applyAsDouble(item), i));
            if (heap.size() > k) {
                heap.extractMin();
            }
        }

        List<T> kept = new ArrayList<>(heap.size());
        while (!heap.isEmpty()) {
            kept.add(heap.extractMin().item());
        }
        Collections.reverse(kept);
        return kept;
    }

    private record Ranked<T>(T item, double score, int index) {
    }
}
