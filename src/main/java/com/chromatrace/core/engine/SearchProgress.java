package com.chromatrace.core.engine;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.tree.TreeIndexer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tree-side view of a session's results, for the renderer: which leaves are viable
 * colorings, which nodes lie on a path to one, and which coloring each viable leaf stands for.
 *
 * <p>Written only by the session thread; safe to read from any thread.
 */
public class SearchProgress {

    /**
     * Where an assignment sits in the decision tree.
     *
     * @param leafIndex  position among the leaves
     * @param leafNodeId breadth-first id of the leaf
     * @param pathIds    ids from the root down to the leaf
     */
    public record LeafCoordinates(long leafIndex, long leafNodeId, List<Long> pathIds) {
        public LeafCoordinates {
            pathIds = List.copyOf(pathIds);
        }
    }

    private final int k;
    private final Map<Long, Assignment> viableLeaves = new ConcurrentHashMap<>();
    private final Set<Long> visitedNodes = ConcurrentHashMap.newKeySet();

    public SearchProgress(int k) {
        this.k = k;
    }

    /**
     * Computes the tree coordinates of an assignment.
     *
     * @return empty when the tree is too large for its ids to fit in a {@code long}
     */
    public static Optional<LeafCoordinates> locate(Assignment assignment, int k) {
        try {
            long leafIndex = TreeIndexer.leafIndex(assignment, k);
            long leafNodeId = TreeIndexer.leafNodeId(assignment, k);
            List<Long> pathIds = TreeIndexer.pathToLeaf(assignment, k).stream()
                    .map(node -> node.id())
                    .toList();
            return Optional.of(new LeafCoordinates(leafIndex, leafNodeId, pathIds));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    Optional<LeafCoordinates> markViable(Assignment assignment) {
        var coordinates = locate(assignment, k);
        coordinates.ifPresent(c -> {
            viableLeaves.put(c.leafNodeId(), assignment);
            visitedNodes.addAll(c.pathIds());
        });
        return coordinates;
    }

    public boolean isViable(long leafNodeId) {
        return viableLeaves.containsKey(leafNodeId);
    }

    public Optional<Assignment> coloringAt(long leafNodeId) {
        return Optional.ofNullable(viableLeaves.get(leafNodeId));
    }

    public Set<Long> viableLeafIds() {
        return Set.copyOf(viableLeaves.keySet());
    }

    /** Ids of every node on a root-to-leaf path of a viable coloring. */
    public Set<Long> visitedNodeIds() {
        return Set.copyOf(visitedNodes);
    }
}
