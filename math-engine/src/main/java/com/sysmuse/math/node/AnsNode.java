package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Reference to the answer of another cell. The index slot holds the cell
 * number as typed by the user.
 */
public final class AnsNode extends MathNode {

    private final List<MathNode> index;

    public AnsNode(List<MathNode> index) {
        this.index = slot(index);
    }

    public AnsNode(int index) {
        this(text(String.valueOf(index)));
    }

    public List<MathNode> getIndex() {
        return index;
    }

    @Override
    public String getType() {
        return "ans";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnsNode)) return false;
        return index.equals(((AnsNode) o).index);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ans", index);
    }

    @Override
    public String toString() {
        return "Ans(" + index + ")";
    }
}
