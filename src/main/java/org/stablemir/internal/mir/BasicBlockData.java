package org.stablemir.internal.mir;

import java.util.List;
import java.util.Objects;

/**
 * A straight-line sequence of statements ended by exactly one terminator.
 */
public record BasicBlockData(List<Statement> statements, Terminator terminator, boolean isCleanup) {

    public BasicBlockData {
        statements = List.copyOf(statements);
        Objects.requireNonNull(terminator, "terminator");
    }

    public BasicBlockData(List<Statement> statements, Terminator terminator) {
        this(statements, terminator, false);
    }
}
