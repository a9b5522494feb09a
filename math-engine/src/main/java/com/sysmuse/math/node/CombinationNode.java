package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * nCr, the number of unordered selections.
 */
public final class CombinationNode extends MathNode {

    private final List<MathNode> n;
    private final List<MathNode> r;

    public CombinationNode(List<MathNode> n, List<MathNode> r) {
        this.n = slot(n);
        this.r = slot(r);
    }

    public List<MathNode> getN() {
        return n;
    }

    public List<MathNode> getR() {
        return r;
    }

    @Override
    public String getType() {
        return "combination";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CombinationNode)) return false;
        CombinationNode other = (CombinationNode) o;
        return n.equals(other.n) && r.equals(other.r);
    }

    @Override
    public int hashCode() {
        return Objects.hash("combination", n, r);
    }

    @Override
    public String toString() {
        return "Combination(" + n + ", " + r + ")";
    }
}
