package com.chromatrace.core.tree;

import com.chromatrace.core.model.TreeNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes scene positions for a materialized tree: leaves evenly spaced and centered on
 * {@code x = 0}, every interior node at the mean x of its {@code k} children, and each
 * depth on its own row.
 */
public final class TreeLayout {

    private TreeLayout() {}

    /**
     * Spacing parameters.
     *
     * @param baseGap   horizontal distance between neighbouring leaves
     * @param levelGap  vertical distance between depths
     * @param topMargin y of the root
     */
    public record Geometry(double baseGap, double levelGap, double topMargin) {}

    public static Map<Long, NodePosition> layout(List<List<TreeNode>> levels, int k, Geometry geometry) {
        var positions = new HashMap<Long, NodePosition>();
        if (levels.isEmpty()) {
            return positions;
        }
        int depth = levels.size() - 1;
        List<TreeNode> leaves = levels.get(depth);
        double width = Math.max(1, leaves.size() - 1) * geometry.baseGap();
        double x0 = leaves.size() > 1 ? -width / 2.0 : 0.0;
        double leafY = geometry.topMargin() + depth * geometry.levelGap();

        for (int i = 0; i < leaves.size(); i++) {
            positions.put(leaves.get(i).id(), new NodePosition(x0 + i * geometry.baseGap(), leafY));
        }

        for (int d = depth - 1; d >= 0; d--) {
            double y = geometry.topMargin() + d * geometry.levelGap();
            List<TreeNode> children = levels.get(d + 1);
            for (TreeNode node : levels.get(d)) {
                int firstChild = (int) (node.indexInLevel() * k);
                double sumX = 0;
                for (int j = 0; j < k; j++) {
                    sumX += positions.get(children.get(firstChild + j).id()).x();
                }
                positions.put(node.id(), new NodePosition(sumX / k, y));
            }
        }
        return positions;
    }
}
