package org.stablemir.bridge.convert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stablemir.api.ConversionErrorCode;
import org.stablemir.api.ConversionException;
import org.stablemir.api.CrateItem;
import org.stablemir.api.mir.BinOp;
import org.stablemir.api.mir.BorrowKind;
import org.stablemir.api.mir.CastKind;
import org.stablemir.api.mir.MutBorrowKind;
import org.stablemir.api.mir.Mutability;
import org.stablemir.api.mir.NullOp;
import org.stablemir.api.mir.Operand;
import org.stablemir.api.mir.Place;
import org.stablemir.api.mir.PointerCoercion;
import org.stablemir.api.mir.Rvalue;
import org.stablemir.api.mir.Safety;
import org.stablemir.api.mir.UnOp;
import org.stablemir.api.ty.Opaque;
import org.stablemir.api.ty.RigidTy;
import org.stablemir.api.ty.TyKind;
import org.stablemir.api.ty.UintTy;
import org.stablemir.bridge.Tables;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.internal.ty.Region;
import org.stablemir.internal.ty.Ty;
import org.stablemir.internal.ty.Unsafety;
import org.stablemir.testutil.MirFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.stablemir.bridge.convert.StableConverters.RVALUES;

@Tag("unit")
class RvalueConverterTest {

    private static final Place LOCAL_1 = new Place(1, "[]");

    private Tables tables;

    @BeforeEach
    void setUp() {
        tables = new Tables(MirFixtures.demoCrate(), InternStrategy.LINEAR);
    }

    @AfterEach
    void tearDown() {
        tables.close();
    }

    private Rvalue convert(org.stablemir.internal.mir.Rvalue rvalue) {
        return RVALUES.stable(rvalue, tables);
    }

    @Test
    void use_keepsOperandKind() {
        assertEquals(new Rvalue.Use(new Operand.Move(LOCAL_1)),
                convert(new org.stablemir.internal.mir.Rvalue.Use(MirFixtures.move(1))));
        assertEquals(new Rvalue.Use(new Operand.Constant("const 5_i32")),
                convert(new org.stablemir.internal.mir.Rvalue.Use(MirFixtures.constant("const 5_i32", Ty.I32))));
    }

    @Test
    void ref_keepsRegionOpaque() {
        Rvalue stable = convert(new org.stablemir.internal.mir.Rvalue.Ref(
                new Region("'a"),
                new org.stablemir.internal.mir.BorrowKind.Mut(org.stablemir.internal.mir.MutBorrowKind.TWO_PHASE_BORROW),
                org.stablemir.internal.mir.Place.local(1)));

        assertEquals(new Rvalue.Ref(new Opaque("'a"), new BorrowKind.Mut(MutBorrowKind.TWO_PHASE_BORROW), LOCAL_1), stable);
    }

    @Test
    void threadLocalRef_derivesItemIdentity() {
        Rvalue stable = convert(new org.stablemir.internal.mir.Rvalue.ThreadLocalRef(MirFixtures.PRINTLN));

        CrateItem item = ((Rvalue.ThreadLocalRef) stable).item();
        assertEquals(MirFixtures.PRINTLN, tables.itemDefId(item));
    }

    @Test
    void addressOfAndLenAndDiscriminant_keepPlace() {
        org.stablemir.internal.mir.Place place = org.stablemir.internal.mir.Place.local(1);

        assertEquals(new Rvalue.AddressOf(Mutability.NOT, LOCAL_1),
                convert(new org.stablemir.internal.mir.Rvalue.AddressOf(org.stablemir.internal.ty.Mutability.NOT, place)));
        assertEquals(new Rvalue.Len(LOCAL_1), convert(new org.stablemir.internal.mir.Rvalue.Len(place)));
        assertEquals(new Rvalue.Discriminant(LOCAL_1), convert(new org.stablemir.internal.mir.Rvalue.Discriminant(place)));
        assertEquals(new Rvalue.CopyForDeref(LOCAL_1), convert(new org.stablemir.internal.mir.Rvalue.CopyForDeref(place)));
    }

    @Test
    void cast_internsTargetType() {
        Rvalue stable = convert(new org.stablemir.internal.mir.Rvalue.Cast(
                org.stablemir.internal.mir.CastKind.Simple.INT_TO_INT, MirFixtures.copy(1), Ty.USIZE));

        Rvalue.Cast cast = (Rvalue.Cast) stable;
        assertThat(cast.kind()).isInstanceOf(CastKind.IntToInt.class);
        assertEquals(new TyKind.Rigid(new RigidTy.Uint(UintTy.USIZE)), tables.tyKind(cast.target()));
    }

    @Test
    void cast_convertsPointerCoercions() {
        Rvalue unsize = convert(new org.stablemir.internal.mir.Rvalue.Cast(
                new org.stablemir.internal.mir.CastKind.PointerCoercionCast(org.stablemir.internal.mir.PointerCoercion.Simple.UNSIZE),
                MirFixtures.copy(1), Ty.slice(Ty.U8)));
        Rvalue closure = convert(new org.stablemir.internal.mir.Rvalue.Cast(
                new org.stablemir.internal.mir.CastKind.PointerCoercionCast(
                        new org.stablemir.internal.mir.PointerCoercion.ClosureFnPointer(Unsafety.UNSAFE)),
                MirFixtures.copy(1), Ty.UNIT));

        assertEquals(new CastKind.PointerCoercionCast(new PointerCoercion.Unsize()), ((Rvalue.Cast) unsize).kind());
        assertEquals(new CastKind.PointerCoercionCast(new PointerCoercion.ClosureFnPointer(Safety.UNSAFE)),
                ((Rvalue.Cast) closure).kind());
    }

    @Test
    void binaryOps_mapOperator() {
        assertEquals(new Rvalue.BinaryOp(BinOp.SHL_UNCHECKED, new Operand.Copy(LOCAL_1), new Operand.Move(new Place(2, "[]"))),
                convert(new org.stablemir.internal.mir.Rvalue.BinaryOp(
                        org.stablemir.internal.mir.BinOp.SHL_UNCHECKED, MirFixtures.copy(1), MirFixtures.move(2))));
        assertEquals(new Rvalue.CheckedBinaryOp(BinOp.MUL, new Operand.Copy(LOCAL_1), new Operand.Copy(LOCAL_1)),
                convert(new org.stablemir.internal.mir.Rvalue.CheckedBinaryOp(
                        org.stablemir.internal.mir.BinOp.MUL, MirFixtures.copy(1), MirFixtures.copy(1))));
        assertEquals(new Rvalue.UnaryOp(UnOp.NEG, new Operand.Copy(LOCAL_1)),
                convert(new org.stablemir.internal.mir.Rvalue.UnaryOp(
                        org.stablemir.internal.mir.UnOp.NEG, MirFixtures.copy(1))));
    }

    @Test
    void nullaryOp_keepsFieldPathAndInternsType() {
        Rvalue stable = convert(new org.stablemir.internal.mir.Rvalue.NullaryOp(
                new org.stablemir.internal.mir.NullOp.OffsetOf(List.of(0, 2)), Ty.tuple(Ty.U8, Ty.I32, Ty.BOOL)));

        Rvalue.NullaryOp op = (Rvalue.NullaryOp) stable;
        assertEquals(new NullOp.OffsetOf(List.of(0, 2)), op.op());
        assertThat(tables.tyKind(op.ty())).isInstanceOf(TyKind.Rigid.class);
    }

    @Test
    void unsupportedRvalues_areNotYetImplemented() {
        org.stablemir.internal.ty.Const count = new org.stablemir.internal.ty.Const("4_usize", Ty.USIZE);

        assertNotYetImplemented(new org.stablemir.internal.mir.Rvalue.Repeat(MirFixtures.copy(1), count), "Rvalue.Repeat");
        assertNotYetImplemented(new org.stablemir.internal.mir.Rvalue.Aggregate("Tuple", List.of(MirFixtures.copy(1))),
                "Rvalue.Aggregate");
        assertNotYetImplemented(new org.stablemir.internal.mir.Rvalue.ShallowInitBox(MirFixtures.move(1), Ty.I32),
                "Rvalue.ShallowInitBox");
    }

    private void assertNotYetImplemented(org.stablemir.internal.mir.Rvalue rvalue, String construct) {
        assertThatThrownBy(() -> convert(rvalue))
                .isInstanceOfSatisfying(ConversionException.class, e -> {
                    assertEquals(ConversionErrorCode.NOT_YET_IMPLEMENTED, e.code());
                    assertEquals(construct, e.construct());
                });
    }
}
