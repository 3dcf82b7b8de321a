package org.stablemir.api.ty;

public sealed interface GenericArgKind permits GenericArgKind.Lifetime, GenericArgKind.Type, GenericArgKind.Const {

    record Lifetime(Opaque region) implements GenericArgKind {
    }

    record Type(Ty ty) implements GenericArgKind {
    }

    record Const(Opaque value) implements GenericArgKind {
    }
}
