package com.chromatrace.core.tree;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps assignments onto the complete k-ary decision tree of depth {@code n}.
 *
 * <p>Nodes are numbered breadth-first from the root (id 0). Level {@code d} holds
 * {@code k^d} nodes; the leaves at depth {@code n} are the {@code k^n} total assignments,
 * ordered by their base-{@code k} value with variable 0 as the most significant digit.
 * All arithmetic is overflow-checked.
 */
public final class TreeIndexer {

    private TreeIndexer() {}

    /**
     * Base-{@code k} positional value of the assignment, most significant digit first.
     */
    public static long leafIndex(Assignment assignment, int k) {
        requireArity(k);
        long index = 0;
        for (int d = 0; d < assignment.size(); d++) {
            int digit = assignment.get(d);
            if (digit < 0 || digit >= k) {
                throw new IllegalArgumentException("Digit " + digit + " at position " + d + " is outside [0, " + k + ")");
            }
            index = Math.addExact(Math.multiplyExact(index, k), digit);
        }
        return index;
    }

    /**
     * Inverse of {@link #leafIndex}: the {@code n}-digit base-{@code k} expansion of {@code index}.
     */
    public static Assignment assignmentFromLeafIndex(long index, int k, int n) {
        requireArity(k);
        if (n < 0) {
            throw new IllegalArgumentException("Depth must be >= 0, got " + n);
        }
        long leaves = power(k, n);
        if (index < 0 || index >= leaves) {
            throw new IllegalArgumentException("Leaf index " + index + " is outside [0, " + leaves + ")");
        }
        int[] digits = new int[n];
        long rest = index;
        for (int d = n - 1; d >= 0; d--) {
            digits[d] = (int) (rest % k);
            rest /= k;
        }
        return Assignment.of(digits);
    }

    /**
     * Breadth-first id of the leftmost node at {@code depth}: the number of nodes on all
     * shallower levels.
     */
    public static long firstLeafId(int depth, int k) {
        requireArity(k);
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must be >= 0, got " + depth);
        }
        if (k == 1) {
            return depth;
        }
        return (power(k, depth) - 1) / (k - 1);
    }

    public static long nodeId(int depth, long indexInLevel, int k) {
        long levelSize = power(k, depth);
        if (indexInLevel < 0 || indexInLevel >= levelSize) {
            throw new IllegalArgumentException(
                    "Index " + indexInLevel + " is outside level " + depth + " of size " + levelSize);
        }
        return Math.addExact(firstLeafId(depth, k), indexInLevel);
    }

    /**
     * Id of the leaf that represents a complete assignment.
     */
    public static long leafNodeId(Assignment assignment, int k) {
        return Math.addExact(firstLeafId(assignment.size(), k), leafIndex(assignment, k));
    }

    /**
     * Nodes from the root down to the assignment's leaf, {@code n + 1} entries.
     */
    public static List<TreeNode> pathToLeaf(Assignment assignment, int k) {
        requireArity(k);
        var path = new ArrayList<TreeNode>(assignment.size() + 1);
        long indexInLevel = 0;
        path.add(new TreeNode(0, 0, 0));
        for (int d = 0; d < assignment.size(); d++) {
            int digit = assignment.get(d);
            if (digit < 0 || digit >= k) {
                throw new IllegalArgumentException("Digit " + digit + " at position " + d + " is outside [0, " + k + ")");
            }
            indexInLevel = Math.addExact(Math.multiplyExact(indexInLevel, k), digit);
            path.add(new TreeNode(nodeId(d + 1, indexInLevel, k), d + 1, indexInLevel));
        }
        return path;
    }

    /**
     * Recovers the digits chosen along a root-to-node path. The child number at each step is
     * {@code indexInLevel(child) - indexInLevel(parent) * k}.
     *
     * @param path consecutive nodes starting at the root
     * @return the partial assignment, one digit per edge
     */
    public static List<Integer> partialFromPath(List<TreeNode> path, int k) {
        requireArity(k);
        var digits = new ArrayList<Integer>(Math.max(0, path.size() - 1));
        for (int i = 1; i < path.size(); i++) {
            TreeNode parent = path.get(i - 1);
            TreeNode child = path.get(i);
            if (child.depth() != parent.depth() + 1) {
                throw new IllegalArgumentException("Path is not contiguous at " + parent + " -> " + child);
            }
            long digit = child.indexInLevel() - Math.multiplyExact(parent.indexInLevel(), k);
            if (digit < 0 || digit >= k) {
                throw new IllegalArgumentException(child + " is not a child of " + parent);
            }
            digits.add((int) digit);
        }
        return digits;
    }

    /**
     * Materializes every level of the tree, unless it has more than {@code maxLeaves} leaves.
     *
     * @return the levels (index = depth), or empty when the tree is too large to render
     */
    public static Optional<List<List<TreeNode>>> buildTree(int n, int k, long maxLeaves) {
        requireArity(k);
        if (n < 0) {
            throw new IllegalArgumentException("Depth must be >= 0, got " + n);
        }
        long leaves;
        try {
            leaves = power(k, n);
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        if (leaves > maxLeaves) {
            return Optional.empty();
        }
        var levels = new ArrayList<List<TreeNode>>(n + 1);
        long id = 0;
        for (int d = 0; d <= n; d++) {
            long count = power(k, d);
            var level = new ArrayList<TreeNode>((int) count);
            for (long idx = 0; idx < count; idx++) {
                level.add(new TreeNode(id++, d, idx));
            }
            levels.add(List.copyOf(level));
        }
        return Optional.of(List.copyOf(levels));
    }

    static long power(int base, int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static void requireArity(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Branching factor must be >= 1, got " + k);
        }
    }
}
