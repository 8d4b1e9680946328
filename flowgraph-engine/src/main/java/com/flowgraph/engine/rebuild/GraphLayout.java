package com.flowgraph.engine.rebuild;

import com.flowgraph.engine.graph.Position;

/**
 * Deterministic node placement. Storage leaves, then {@code ai} leaves, stack in the left column;
 * group nodes stack in the middle column with their children listed below each header. Positions
 * depend only on role, index and entry counts, and empty roles take no space.
 */
public final class GraphLayout {

    public static final double LEFT_COLUMN_X = 50;
    public static final double GROUP_COLUMN_X = 500;

    static final double STORAGE_TOP = 100;
    static final double STORAGE_SPACING = 100;
    static final double AI_SECTION_PADDING = 50;
    static final double AI_SPACING = 80;
    static final double GROUP_TOP = 50;
    static final double GROUP_HEADER = 50;
    static final double CHILD_SPACING = 45;
    static final double GROUP_SPACING = 80;

    private GraphLayout() {
    }

    public static Position storage(int index) {
        return new Position(LEFT_COLUMN_X, STORAGE_TOP + index * STORAGE_SPACING);
    }

    /** {@code ai} leaves start below the storage section, or at the top when there is no storage. */
    public static Position ai(int index, int storageCount) {
        double top = storageCount > 0
                ? STORAGE_TOP + storageCount * STORAGE_SPACING + AI_SECTION_PADDING
                : STORAGE_TOP;
        return new Position(LEFT_COLUMN_X, top + index * AI_SPACING);
    }

    public static double firstGroupY() {
        return GROUP_TOP;
    }

    public static Position group(double groupY) {
        return new Position(GROUP_COLUMN_X, groupY);
    }

    public static Position groupChild(double groupY, int index) {
        return new Position(GROUP_COLUMN_X, groupY + GROUP_HEADER + index * CHILD_SPACING);
    }

    /** Y of the group that follows a group at {@code groupY} with {@code childCount} children. */
    public static double nextGroupY(double groupY, int childCount) {
        return groupY + GROUP_HEADER + childCount * CHILD_SPACING + GROUP_SPACING;
    }
}
