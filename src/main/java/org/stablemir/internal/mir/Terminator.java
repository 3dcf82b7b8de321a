package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Span;

public record Terminator(TerminatorKind kind, Span span) {

    public static Terminator of(TerminatorKind kind) {
        return new Terminator(kind, Span.DUMMY);
    }
}
