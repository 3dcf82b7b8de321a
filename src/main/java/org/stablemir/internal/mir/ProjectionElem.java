package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Ty;

import java.util.Optional;

/**
 * One step of a place projection.
 */
public sealed interface ProjectionElem {

    record Deref() implements ProjectionElem {
        @Override
        public String toString() {
            return "Deref";
        }
    }

    record Field(int index, Ty ty) implements ProjectionElem {
        @Override
        public String toString() {
            return "Field(" + index + ", " + ty + ")";
        }
    }

    record Index(int local) implements ProjectionElem {
        @Override
        public String toString() {
            return "Index(_" + local + ")";
        }
    }

    record ConstantIndex(long offset, long minLength, boolean fromEnd) implements ProjectionElem {
        @Override
        public String toString() {
            return "ConstantIndex { offset: " + offset + ", min_length: " + minLength + ", from_end: " + fromEnd + " }";
        }
    }

    record Subslice(long from, long to, boolean fromEnd) implements ProjectionElem {
        @Override
        public String toString() {
            return "Subslice { from: " + from + ", to: " + to + ", from_end: " + fromEnd + " }";
        }
    }

    record Downcast(Optional<String> name, int variant) implements ProjectionElem {
        @Override
        public String toString() {
            return "Downcast(" + name.orElse("None") + ", " + variant + ")";
        }
    }

    record OpaqueCast(Ty ty) implements ProjectionElem {
        @Override
        public String toString() {
            return "OpaqueCast(" + ty + ")";
        }
    }
}
