package com.sysmuse.calc;

/**
 * Which cells are re-evaluated after a cell changes.
 */
public enum RecalcPolicy {
    /** Only cells that depend on the changed cell through ANS references, in dependency order. */
    PRECISE,
    /** Every cell that mentions any ANS reference, in cell order. */
    ANY_ANS_REFERENCE
}
