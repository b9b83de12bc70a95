package com.github.asymptotic.result;

/**
 * How much the reported bounds can be trusted.
 */
public enum Confidence {
    /** Derived by composition rules or a closed-form recurrence solution. */
    HIGH,
    /** Derived from a recognized pattern with a known best case, such as branch and bound. */
    MEDIUM,
    /** Estimated numerically, or part of the program could not be classified. */
    LOW;

    public Confidence and(Confidence other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
