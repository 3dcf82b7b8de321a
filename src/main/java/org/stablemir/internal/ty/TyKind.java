package org.stablemir.internal.ty;

import org.stablemir.internal.DefId;

import java.util.List;

/**
 * The structural kind of a compiler type. Every variant is visible to {@link Visitor}, so code that
 * must handle all kinds fails to compile when a variant is added.
 */
public sealed interface TyKind
        permits TyKind.Bool, TyKind.Char, TyKind.Int, TyKind.Uint, TyKind.Float, TyKind.Adt, TyKind.Foreign,
        TyKind.Str, TyKind.Array, TyKind.Slice, TyKind.RawPtr, TyKind.Ref, TyKind.FnDef, TyKind.FnPtr,
        TyKind.Dynamic, TyKind.Closure, TyKind.Generator, TyKind.GeneratorWitness,
        TyKind.GeneratorWitnessMir, TyKind.Never, TyKind.Tuple, TyKind.Alias, TyKind.Param, TyKind.Bound,
        TyKind.Placeholder, TyKind.Infer, TyKind.Error {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitBool(Bool kind);
        R visitChar(Char kind);
        R visitInt(Int kind);
        R visitUint(Uint kind);
        R visitFloat(Float kind);
        R visitAdt(Adt kind);
        R visitForeign(Foreign kind);
        R visitStr(Str kind);
        R visitArray(Array kind);
        R visitSlice(Slice kind);
        R visitRawPtr(RawPtr kind);
        R visitRef(Ref kind);
        R visitFnDef(FnDef kind);
        R visitFnPtr(FnPtr kind);
        R visitDynamic(Dynamic kind);
        R visitClosure(Closure kind);
        R visitGenerator(Generator kind);
        R visitGeneratorWitness(GeneratorWitness kind);
        R visitGeneratorWitnessMir(GeneratorWitnessMir kind);
        R visitNever(Never kind);
        R visitTuple(Tuple kind);
        R visitAlias(Alias kind);
        R visitParam(Param kind);
        R visitBound(Bound kind);
        R visitPlaceholder(Placeholder kind);
        R visitInfer(Infer kind);
        R visitError(Error kind);
    }

    record Bool() implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record Char() implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChar(this);
        }
    }

    record Int(IntTy intTy) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    record Uint(UintTy uintTy) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUint(this);
        }
    }

    record Float(FloatTy floatTy) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    /**
     * An algebraic data type: struct, enum or union.
     */
    record Adt(DefId adtDef, GenericArgs args) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAdt(this);
        }
    }

    /**
     * An extern type of unknown size.
     */
    record Foreign(DefId def) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForeign(this);
        }
    }

    record Str() implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStr(this);
        }
    }

    record Array(Ty element, Const length) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record Slice(Ty element) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }

    record RawPtr(Ty pointee, Mutability mutability) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRawPtr(this);
        }
    }

    record Ref(Region region, Ty referent, Mutability mutability) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    /**
     * The zero-sized type of a specific function item.
     */
    record FnDef(DefId def, GenericArgs args) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFnDef(this);
        }
    }

    record FnPtr(PolyFnSig sig) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFnPtr(this);
        }
    }

    /**
     * A trait object, e.g. {@code dyn Trait + 'a}. Its predicate list is only kept in printed form.
     */
    record Dynamic(String predicates, Region region) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDynamic(this);
        }
    }

    record Closure(DefId def, GenericArgs args) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClosure(this);
        }
    }

    record Generator(DefId def, GenericArgs args, Movability movability) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGenerator(this);
        }
    }

    /**
     * Only exists during type checking of generators.
     */
    record GeneratorWitness(String binder) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGeneratorWitness(this);
        }
    }

    /**
     * Only exists during type checking of generators.
     */
    record GeneratorWitnessMir(DefId def, GenericArgs args) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGeneratorWitnessMir(this);
        }
    }

    record Never() implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNever(this);
        }
    }

    record Tuple(List<Ty> fields) implements TyKind {
        public Tuple {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    /**
     * A projection, opaque type or inherent associated type, before normalization.
     */
    record Alias(String aliasKind, DefId def, GenericArgs args) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlias(this);
        }
    }

    /**
     * A generic type parameter in scope.
     */
    record Param(int index, String name) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParam(this);
        }
    }

    /**
     * A type bound by an enclosing binder.
     */
    record Bound(int debruijn, int var) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBound(this);
        }
    }

    /**
     * Only exists inside the trait solver.
     */
    record Placeholder(int universe, int var) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlaceholder(this);
        }
    }

    /**
     * Only exists during type inference.
     */
    record Infer(String var) implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInfer(this);
        }
    }

    /**
     * Only exists when compilation already failed.
     */
    record Error() implements TyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitError(this);
        }
    }
}
