package com.sysmuse.math.node;

import java.util.Objects;

/**
 * Free text typed by the user: digits, operators, variable letters, '='.
 */
public final class LiteralNode extends MathNode {

    private final String text;

    public LiteralNode(String text) {
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String getType() {
        return "literal";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralNode)) return false;
        return text.equals(((LiteralNode) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash("literal", text);
    }

    @Override
    public String toString() {
        return "Literal(" + text + ")";
    }
}
