package org.stablemir.api.ty;

import org.stablemir.api.mir.Mutability;

import java.util.List;

/**
 * A type whose structure is fully known. Nested types are referenced through {@link Ty} handles,
 * which keeps recursive types finite.
 */
public sealed interface RigidTy
        permits RigidTy.Bool, RigidTy.Char, RigidTy.Int, RigidTy.Uint, RigidTy.Float, RigidTy.Adt,
        RigidTy.Foreign, RigidTy.Str, RigidTy.Array, RigidTy.Slice, RigidTy.RawPtr, RigidTy.Ref,
        RigidTy.FnItem, RigidTy.FnPtr, RigidTy.Closure, RigidTy.Generator, RigidTy.Never, RigidTy.Tuple {

    record Bool() implements RigidTy {
    }

    record Char() implements RigidTy {
    }

    record Int(IntTy intTy) implements RigidTy {
    }

    record Uint(UintTy uintTy) implements RigidTy {
    }

    record Float(FloatTy floatTy) implements RigidTy {
    }

    record Adt(AdtDef def, GenericArgs args) implements RigidTy {
    }

    record Foreign(ForeignDef def) implements RigidTy {
    }

    record Str() implements RigidTy {
    }

    /**
     * @param element The element type.
     * @param length  The length constant, not yet structured.
     */
    record Array(Ty element, Opaque length) implements RigidTy {
    }

    record Slice(Ty element) implements RigidTy {
    }

    record RawPtr(Ty pointee, Mutability mutability) implements RigidTy {
    }

    record Ref(Opaque region, Ty referent, Mutability mutability) implements RigidTy {
    }

    /**
     * The type of a specific function item.
     */
    record FnItem(FnDef def, GenericArgs args) implements RigidTy {
    }

    record FnPtr(Binder<FnSig> sig) implements RigidTy {
    }

    record Closure(ClosureDef def, GenericArgs args) implements RigidTy {
    }

    record Generator(GeneratorDef def, GenericArgs args, Movability movability) implements RigidTy {
    }

    record Never() implements RigidTy {
    }

    record Tuple(List<Ty> fields) implements RigidTy {
        public Tuple {
            fields = List.copyOf(fields);
        }
    }
}
