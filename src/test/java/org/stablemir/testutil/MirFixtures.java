package org.stablemir.testutil;

import org.stablemir.internal.CrateNum;
import org.stablemir.internal.DefId;
import org.stablemir.internal.InMemoryCompilerContext;
import org.stablemir.internal.mir.AssertKind;
import org.stablemir.internal.mir.BasicBlockData;
import org.stablemir.internal.mir.BinOp;
import org.stablemir.internal.mir.Body;
import org.stablemir.internal.mir.LocalDecl;
import org.stablemir.internal.mir.Operand;
import org.stablemir.internal.mir.Place;
import org.stablemir.internal.mir.ProjectionElem;
import org.stablemir.internal.mir.Rvalue;
import org.stablemir.internal.mir.Statement;
import org.stablemir.internal.mir.StatementKind;
import org.stablemir.internal.mir.SwitchTargets;
import org.stablemir.internal.mir.Terminator;
import org.stablemir.internal.mir.TerminatorKind;
import org.stablemir.internal.mir.UnwindAction;
import org.stablemir.internal.ty.Const;
import org.stablemir.internal.ty.GenericArgs;
import org.stablemir.internal.ty.Span;
import org.stablemir.internal.ty.Ty;
import org.stablemir.internal.ty.TyKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hand-built compiler bodies and crates shared by the tests.
 */
public final class MirFixtures {

    public static final DefId MAIN = DefId.local(0);
    public static final DefId CHECKED_ADD = DefId.local(1);
    public static final DefId CLASSIFY = DefId.local(2);
    public static final DefId PRINTLN = new DefId(new CrateNum(1), 7);

    private MirFixtures() {
    }

    public static Operand copy(int local) {
        return new Operand.Copy(Place.local(local));
    }

    public static Operand move(int local) {
        return new Operand.Move(Place.local(local));
    }

    public static Operand constant(String rendering, Ty ty) {
        return new Operand.Constant(new Const(rendering, ty));
    }

    public static Statement assign(int local, Rvalue rvalue) {
        return Statement.of(new StatementKind.Assign(Place.local(local), rvalue));
    }

    /**
     * {@code fn checked_add(a: i32, b: i32) -> i32}: an overflow-checked addition.
     * <pre>
     * bb0: _3 = CheckedAdd(copy _1, copy _2)
     *      assert(!move (_3.1), "attempt to add with overflow") -> [success: bb1, unwind: continue]
     * bb1: _0 = move (_3.0)
     *      return
     * </pre>
     */
    public static Body checkedAdd() {
        Ty pair = Ty.tuple(Ty.I32, Ty.BOOL);
        BasicBlockData bb0 = new BasicBlockData(
                List.of(assign(3, new Rvalue.CheckedBinaryOp(BinOp.ADD, copy(1), copy(2)))),
                Terminator.of(new TerminatorKind.Assert(
                        new Operand.Move(Place.of(3, new ProjectionElem.Field(1, Ty.BOOL))),
                        false,
                        new AssertKind.Overflow(BinOp.ADD, copy(1), copy(2)),
                        1,
                        new UnwindAction.Continue())));
        BasicBlockData bb1 = new BasicBlockData(
                List.of(assign(0, new Rvalue.Use(new Operand.Move(Place.of(3, new ProjectionElem.Field(0, Ty.I32)))))),
                Terminator.of(new TerminatorKind.Return()));
        return new Body(
                List.of(bb0, bb1),
                List.of(LocalDecl.of(Ty.I32), LocalDecl.of(Ty.I32), LocalDecl.of(Ty.I32), LocalDecl.of(pair)),
                2);
    }

    /**
     * {@code fn classify(x: u8) -> u8}: a three-way switch whose arms join in a call with a cleanup
     * edge.
     * <pre>
     * bb0: switchInt(copy _1) -> [0: bb1, 1: bb2, otherwise: bb3]
     * bb1: _0 = const 10_u8; goto -> bb4
     * bb2: _0 = const 20_u8; goto -> bb4
     * bb3: _2 = println(copy _1) -> [return: bb4, unwind: bb5]
     * bb4: return
     * bb5 (cleanup): resume
     * </pre>
     */
    public static Body classify() {
        Map<Long, Integer> arms = new LinkedHashMap<>();
        arms.put(0L, 1);
        arms.put(1L, 2);
        Ty println = new Ty(new TyKind.FnDef(PRINTLN, GenericArgs.EMPTY));
        return new Body(
                List.of(
                        new BasicBlockData(List.of(),
                                Terminator.of(new TerminatorKind.SwitchInt(copy(1), SwitchTargets.of(arms, 3)))),
                        new BasicBlockData(List.of(assign(0, new Rvalue.Use(constant("10_u8", Ty.U8)))),
                                Terminator.of(new TerminatorKind.Goto(4))),
                        new BasicBlockData(List.of(assign(0, new Rvalue.Use(constant("20_u8", Ty.U8)))),
                                Terminator.of(new TerminatorKind.Goto(4))),
                        new BasicBlockData(List.of(),
                                Terminator.of(new TerminatorKind.Call(
                                        constant("println", println),
                                        List.of(copy(1)),
                                        Place.local(2),
                                        Optional.of(4),
                                        new UnwindAction.Cleanup(5),
                                        "Normal",
                                        Span.DUMMY))),
                        new BasicBlockData(List.of(), Terminator.of(new TerminatorKind.Return())),
                        new BasicBlockData(List.of(), Terminator.of(new TerminatorKind.UnwindResume()), true)),
                List.of(LocalDecl.of(Ty.U8), LocalDecl.of(Ty.U8), LocalDecl.of(Ty.UNIT)),
                1);
    }

    /**
     * {@code fn main()} with a single {@code return}.
     */
    public static Body trivialMain() {
        return new Body(
                List.of(new BasicBlockData(List.of(), Terminator.of(new TerminatorKind.Return()))),
                List.of(LocalDecl.of(Ty.UNIT)),
                0);
    }

    /**
     * Local crate {@code demo} with {@code main}, {@code checked_add} and {@code classify}; external
     * crates {@code std}, {@code core} and two crates both named {@code rand}.
     */
    public static InMemoryCompilerContext demoCrate() {
        return InMemoryCompilerContext.builder("demo")
                .externalCrate(1, "std")
                .externalCrate(2, "core")
                .externalCrate(3, "rand")
                .externalCrate(4, "rand")
                .body(MAIN, trivialMain())
                .body(CHECKED_ADD, checkedAdd())
                .body(CLASSIFY, classify())
                .entryFn(MAIN)
                .build();
    }

    /**
     * A library crate: no entry point, no dependencies.
     */
    public static InMemoryCompilerContext libraryCrate() {
        return InMemoryCompilerContext.builder("lib")
                .body(CHECKED_ADD, checkedAdd())
                .build();
    }
}
