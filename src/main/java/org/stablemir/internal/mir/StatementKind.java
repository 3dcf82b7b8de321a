package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Ty;

import java.util.List;

public sealed interface StatementKind
        permits StatementKind.Assign, StatementKind.FakeRead, StatementKind.SetDiscriminant,
        StatementKind.Deinit, StatementKind.StorageLive, StatementKind.StorageDead, StatementKind.Retag,
        StatementKind.PlaceMention, StatementKind.AscribeUserType, StatementKind.Coverage,
        StatementKind.Intrinsic, StatementKind.ConstEvalCounter, StatementKind.Nop {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAssign(Assign assign);
        R visitFakeRead(FakeRead fakeRead);
        R visitSetDiscriminant(SetDiscriminant setDiscriminant);
        R visitDeinit(Deinit deinit);
        R visitStorageLive(StorageLive storageLive);
        R visitStorageDead(StorageDead storageDead);
        R visitRetag(Retag retag);
        R visitPlaceMention(PlaceMention placeMention);
        R visitAscribeUserType(AscribeUserType ascribe);
        R visitCoverage(Coverage coverage);
        R visitIntrinsic(Intrinsic intrinsic);
        R visitConstEvalCounter(ConstEvalCounter counter);
        R visitNop(Nop nop);
    }

    record Assign(Place place, Rvalue rvalue) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * A read only seen by the borrow checker.
     */
    record FakeRead(String cause, Place place) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFakeRead(this);
        }
    }

    record SetDiscriminant(Place place, int variant) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetDiscriminant(this);
        }
    }

    record Deinit(Place place) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeinit(this);
        }
    }

    record StorageLive(int local) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStorageLive(this);
        }
    }

    record StorageDead(int local) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStorageDead(this);
        }
    }

    record Retag(String kind, Place place) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRetag(this);
        }
    }

    record PlaceMention(Place place) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlaceMention(this);
        }
    }

    record AscribeUserType(Place place, Ty userTy, String variance) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAscribeUserType(this);
        }
    }

    /**
     * A code coverage counter increment.
     */
    record Coverage(String counter) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCoverage(this);
        }
    }

    /**
     * A non-diverging intrinsic such as {@code assume} or {@code copy_nonoverlapping}.
     */
    record Intrinsic(String intrinsic, List<Operand> operands) implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntrinsic(this);
        }
    }

    /**
     * Counts steps during const evaluation.
     */
    record ConstEvalCounter() implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstEvalCounter(this);
        }
    }

    record Nop() implements StatementKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNop(this);
        }
    }
}
