package com.chromatrace.core.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Assignments already emitted in the current session, in emission order.
 * Append-only; each entry becomes a blocking constraint in the next generated program.
 *
 * <p>Not thread-safe: owned by the session thread. Readers on other threads get
 * immutable copies via {@link #asList()}.
 */
public class ExclusionSet {

    private final LinkedHashSet<Assignment> entries = new LinkedHashSet<>();

    public static ExclusionSet empty() {
        return new ExclusionSet();
    }

    public static ExclusionSet of(Assignment... assignments) {
        var set = new ExclusionSet();
        for (Assignment a : assignments) {
            set.add(a);
        }
        return set;
    }

    /**
     * Appends an assignment.
     *
     * @return false if it was already present (the set is left unchanged)
     */
    public boolean add(Assignment assignment) {
        return entries.add(assignment);
    }

    public boolean contains(Assignment assignment) {
        return entries.contains(assignment);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Assignment> asList() {
        return List.copyOf(entries);
    }
}
