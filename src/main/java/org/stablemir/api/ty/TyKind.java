package org.stablemir.api.ty;

/**
 * Structure of a type. Only rigid types are modeled so far.
 */
public sealed interface TyKind permits TyKind.Rigid {

    record Rigid(RigidTy ty) implements TyKind {
    }
}
