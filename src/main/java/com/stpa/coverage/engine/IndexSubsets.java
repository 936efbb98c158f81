package com.stpa.coverage.engine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Restartable sequence of all index subsets of size {@code minSize..maxSize} over
 * {@code n} elements, smaller sizes first. Every {@link #iterator()} call starts over.
 */
public class IndexSubsets implements Iterable<int[]> {

    private final int n;
    private final int minSize;
    private final int maxSize;

    public IndexSubsets(int n, int minSize, int maxSize) {
        this.n = n;
        this.minSize = minSize;
        this.maxSize = Math.min(maxSize, n);
    }

    public long size() {
        long total = 0;
        for (int k = minSize; k <= maxSize; k++) {
            long c = IndexCombinationIterator.count(n, k);
            if (Long.MAX_VALUE - total < c) return Long.MAX_VALUE;
            total += c;
        }
        return total;
    }

    @Override
    public Iterator<int[]> iterator() {
        return new Iterator<>() {
            private int size = minSize;
            private IndexCombinationIterator current = new IndexCombinationIterator(n, minSize);

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && size < maxSize) {
                    size++;
                    current = new IndexCombinationIterator(n, size);
                }
                return current.hasNext();
            }

            @Override
            public int[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }
}
