package org.stablemir.api.mir;

public sealed interface GeneratorKind permits GeneratorKind.Async, GeneratorKind.Gen {

    record Async(AsyncGeneratorKind kind) implements GeneratorKind {
    }

    record Gen() implements GeneratorKind {
    }
}
