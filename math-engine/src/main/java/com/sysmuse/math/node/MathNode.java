package com.sysmuse.math.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the structured expression tree produced by the editor.
 *
 * Nodes are immutable values. Every child slot is an ordered list of nodes;
 * a missing or empty slot is replaced by a single empty {@link LiteralNode},
 * which is the editor's placeholder.
 */
public abstract class MathNode {

    /**
     * Short type tag, matching the "type" field of the persisted JSON form.
     */
    public abstract String getType();

    /**
     * Normalize a child list: null or empty becomes a single empty literal,
     * anything else an unmodifiable copy.
     */
    protected static List<MathNode> slot(List<MathNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return placeholder();
        }
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    protected static List<MathNode> slot(List<MathNode> nodes, String defaultText) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of(new LiteralNode(defaultText));
        }
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public static List<MathNode> placeholder() {
        return List.of(new LiteralNode(""));
    }

    /**
     * Convenience for building a slot holding a single literal.
     */
    public static List<MathNode> text(String text) {
        return List.of(new LiteralNode(text));
    }
}
