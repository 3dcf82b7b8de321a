package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Span;

public record Statement(StatementKind kind, Span span) {

    public static Statement of(StatementKind kind) {
        return new Statement(kind, Span.DUMMY);
    }
}
