package org.stablemir.api.mir;

public sealed interface Statement permits Statement.Assign, Statement.Nop {

    record Assign(Place place, Rvalue rvalue) implements Statement {
    }

    record Nop() implements Statement {
    }
}
