package com.stpa.coverage.engine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates k-combinations of the indices {@code 0..n-1} in lexicographic order without
 * recursion. Only the current index array is held; each call to {@link #next()} returns a copy.
 */
public class IndexCombinationIterator implements Iterator<int[]> {

    private final int n;
    private final int k;
    private final int[] indices;
    private boolean hasNext;

    public IndexCombinationIterator(int n, int k) {
        this.n = n;
        this.k = k;
        this.indices = new int[Math.max(k, 0)];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        this.hasNext = k > 0 && k <= n;
    }

    @Override
    public boolean hasNext() {
        return hasNext;
    }

    @Override
    public int[] next() {
        if (!hasNext) {
            throw new NoSuchElementException();
        }
        int[] current = indices.clone();
        step();
        return current;
    }

    private void step() {
        // Rightmost position that can still move right
        int i = k - 1;
        while (i >= 0 && indices[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            hasNext = false;
            return;
        }
        indices[i]++;
        for (int j = i + 1; j < k; j++) {
            indices[j] = indices[j - 1] + 1;
        }
    }

    /** Binomial coefficient C(n, k), saturating at {@link Long#MAX_VALUE}. */
    public static long count(int n, int k) {
        if (k < 0 || k > n) return 0;
        k = Math.min(k, n - k);
        long result = 1;
        for (int i = 1; i <= k; i++) {
            try {
                result = Math.multiplyExact(result, (long) (n - k + i)) / i;
            } catch (ArithmeticException overflow) {
                return Long.MAX_VALUE;
            }
        }
        return result;
    }
}
