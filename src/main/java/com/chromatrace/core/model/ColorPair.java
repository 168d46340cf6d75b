package com.chromatrace.core.model;

import java.io.Serializable;

/**
 * An unordered pair of variable indices whose colors must differ.
 * Always stored normalized so that {@code first < second}.
 *
 * @param first  the smaller index
 * @param second the larger index
 */
public record ColorPair(int first, int second) implements Comparable<ColorPair>, Serializable {

    public ColorPair {
        if (first == second) {
            throw new IllegalArgumentException("Pair must join two distinct variables, got (" + first + ", " + second + ")");
        }
        if (first < 0 || second < 0) {
            throw new IllegalArgumentException("Pair indices must be non-negative, got (" + first + ", " + second + ")");
        }
        if (first > second) {
            int tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static ColorPair of(int i, int j) {
        return new ColorPair(i, j);
    }

    @Override
    public int compareTo(ColorPair other) {
        int cmp = Integer.compare(first, other.first);
        return cmp != 0 ? cmp : Integer.compare(second, other.second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
