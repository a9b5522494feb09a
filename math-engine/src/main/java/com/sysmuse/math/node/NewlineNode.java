package com.sysmuse.math.node;

/**
 * Line break separating equations of a system or independent lines.
 */
public final class NewlineNode extends MathNode {

    @Override
    public String getType() {
        return "newline";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NewlineNode;
    }

    @Override
    public int hashCode() {
        return NewlineNode.class.hashCode();
    }

    @Override
    public String toString() {
        return "Newline";
    }
}
