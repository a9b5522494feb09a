package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Logarithm with a subscript base, or ln when natural. Base defaults to 10.
 */
public final class LogNode extends MathNode {

    private final boolean naturalLog;
    private final List<MathNode> base;
    private final List<MathNode> argument;

    public LogNode(boolean naturalLog, List<MathNode> base, List<MathNode> argument) {
        this.naturalLog = naturalLog;
        this.base = slot(base, "10");
        this.argument = slot(argument);
    }

    public boolean isNaturalLog() {
        return naturalLog;
    }

    public List<MathNode> getBase() {
        return base;
    }

    public List<MathNode> getArgument() {
        return argument;
    }

    @Override
    public String getType() {
        return "log";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogNode)) return false;
        LogNode other = (LogNode) o;
        return naturalLog == other.naturalLog && base.equals(other.base) && argument.equals(other.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash("log", naturalLog, base, argument);
    }

    @Override
    public String toString() {
        return naturalLog ? "ln(" + argument + ")" : "log_" + base + "(" + argument + ")";
    }
}
