package com.chromatrace.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A complete vector of per-variable colors. Equality and hashing are structural,
 * so assignments can be used directly as set members.
 *
 * @param values color of variable {@code i} at position {@code i}
 */
public record Assignment(List<Integer> values) implements Serializable {

    public static final Assignment EMPTY = new Assignment(List.of());

    public Assignment {
        values = List.copyOf(values);
    }

    public static Assignment of(int... values) {
        var list = new ArrayList<Integer>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return new Assignment(list);
    }

    public int size() {
        return values.size();
    }

    public int get(int index) {
        return values.get(index);
    }

    public int[] toArray() {
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    /**
     * Returns true when the vector has exactly {@code n} entries, each in {@code [0, k)}.
     */
    public boolean fitsDomain(ProblemSpec problem) {
        if (values.size() != problem.n()) {
            return false;
        }
        for (int v : values) {
            if (v < 0 || v >= problem.k()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lists the constraint pairs this assignment violates (both ends share a color).
     * The assignment must fit the problem's domain.
     */
    public List<ColorPair> conflicts(ProblemSpec problem) {
        var conflicts = new ArrayList<ColorPair>();
        for (ColorPair pair : problem.pairs()) {
            if (values.get(pair.first()).equals(values.get(pair.second()))) {
                conflicts.add(pair);
            }
        }
        return conflicts;
    }

    /**
     * Full validity check: right length, colors in range, and no violated pair.
     */
    public boolean satisfies(ProblemSpec problem) {
        return fitsDomain(problem) && conflicts(problem).isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
