package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * nPr, the number of ordered selections.
 */
public final class PermutationNode extends MathNode {

    private final List<MathNode> n;
    private final List<MathNode> r;

    public PermutationNode(List<MathNode> n, List<MathNode> r) {
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
        return "permutation";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermutationNode)) return false;
        PermutationNode other = (PermutationNode) o;
        return n.equals(other.n) && r.equals(other.r);
    }

    @Override
    public int hashCode() {
        return Objects.hash("permutation", n, r);
    }

    @Override
    public String toString() {
        return "Permutation(" + n + ", " + r + ")";
    }
}
