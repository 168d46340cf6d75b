package com.chromatrace.core.tree;

/**
 * Scene coordinates of a tree node.
 */
public record NodePosition(double x, double y) {}
