package com.chromatrace.core.model;

import java.io.Serializable;

/**
 * A node of the complete k-ary decision tree shown by the renderer.
 *
 * @param id           breadth-first index over the whole tree, root = 0
 * @param depth        distance from the root
 * @param indexInLevel position among all nodes at the same depth
 */
public record TreeNode(
    long id,
    int depth,
    long indexInLevel
) implements Serializable {}
