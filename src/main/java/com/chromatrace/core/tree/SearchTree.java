package com.chromatrace.core.tree;

import com.chromatrace.core.model.TreeNode;

import java.util.List;
import java.util.Map;

/**
 * A materialized decision tree with its layout, handed to the renderer.
 *
 * @param n         depth (number of variables)
 * @param k         branching factor (number of colors)
 * @param levels    nodes grouped by depth
 * @param positions node id to scene position
 */
public record SearchTree(
    int n,
    int k,
    List<List<TreeNode>> levels,
    Map<Long, NodePosition> positions
) {
    public SearchTree {
        levels = List.copyOf(levels);
        positions = Map.copyOf(positions);
    }

    public List<TreeNode> leaves() {
        return levels.get(levels.size() - 1);
    }

    public int nodeCount() {
        return levels.stream().mapToInt(List::size).sum();
    }
}
