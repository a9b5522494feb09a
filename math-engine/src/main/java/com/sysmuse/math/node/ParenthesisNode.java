package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

public final class ParenthesisNode extends MathNode {

    private final List<MathNode> content;

    public ParenthesisNode(List<MathNode> content) {
        this.content = slot(content);
    }

    public List<MathNode> getContent() {
        return content;
    }

    @Override
    public String getType() {
        return "parenthesis";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParenthesisNode)) return false;
        return content.equals(((ParenthesisNode) o).content);
    }

    @Override
    public int hashCode() {
        return Objects.hash("parenthesis", content);
    }

    @Override
    public String toString() {
        return "Paren(" + content + ")";
    }
}
