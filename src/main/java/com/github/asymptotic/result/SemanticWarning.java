package com.github.asymptotic.result;

import com.github.asymptotic.Tokenizer.Position;

/**
 * A construct that was recognized but could not be classified. Warnings never abort an analysis;
 * the affected subtree is costed as unknown or with lowered confidence instead.
 */
public record SemanticWarning(Kind kind, Position position, String message) {

    public enum Kind {
        INDETERMINATE_LOOP,
        UNRESOLVED_SHRINK,
        HEURISTIC_BOUND
    }

    @Override
    public String toString() {
        return kind + " at " + position + ": " + message;
    }

}
