package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Radical. A square root carries index "2" and does not display it.
 */
public final class RootNode extends MathNode {

    private final boolean squareRoot;
    private final List<MathNode> index;
    private final List<MathNode> radicand;

    public RootNode(boolean squareRoot, List<MathNode> index, List<MathNode> radicand) {
        this.squareRoot = squareRoot;
        this.index = slot(index, squareRoot ? "2" : "");
        this.radicand = slot(radicand);
    }

    public static RootNode squareRoot(List<MathNode> radicand) {
        return new RootNode(true, null, radicand);
    }

    public boolean isSquareRoot() {
        return squareRoot;
    }

    public List<MathNode> getIndex() {
        return index;
    }

    public List<MathNode> getRadicand() {
        return radicand;
    }

    @Override
    public String getType() {
        return "root";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RootNode)) return false;
        RootNode other = (RootNode) o;
        return squareRoot == other.squareRoot && index.equals(other.index) && radicand.equals(other.radicand);
    }

    @Override
    public int hashCode() {
        return Objects.hash("root", squareRoot, index, radicand);
    }

    @Override
    public String toString() {
        return "Root(" + (squareRoot ? "" : index + ", ") + radicand + ")";
    }
}
