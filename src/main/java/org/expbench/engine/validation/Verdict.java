package org.expbench.engine.validation;

/**
 * Outcome of comparing one pre-agg rendering with its on-demand reference.
 */
public enum Verdict {
    PASS,
    MISMATCH,
    /** One side has no result (failed, timed out or not rendered). */
    INCOMPLETE
}
