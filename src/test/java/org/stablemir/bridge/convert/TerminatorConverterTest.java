package org.stablemir.bridge.convert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.stablemir.api.ConversionErrorCode;
import org.stablemir.api.ConversionException;
import org.stablemir.api.mir.AssertMessage;
import org.stablemir.api.mir.AsyncGeneratorKind;
import org.stablemir.api.mir.GeneratorKind;
import org.stablemir.api.mir.InlineAsmOperand;
import org.stablemir.api.mir.Operand;
import org.stablemir.api.mir.Place;
import org.stablemir.api.mir.SwitchTarget;
import org.stablemir.api.mir.Terminator;
import org.stablemir.api.mir.UnwindAction;
import org.stablemir.bridge.Tables;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.internal.mir.AssertKind;
import org.stablemir.internal.mir.SwitchTargets;
import org.stablemir.internal.mir.TerminatorKind;
import org.stablemir.internal.ty.Span;
import org.stablemir.internal.ty.Ty;
import org.stablemir.testutil.MirFixtures;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.stablemir.bridge.convert.StableConverters.ASSERT_MESSAGES;
import static org.stablemir.bridge.convert.StableConverters.TERMINATORS;

@Tag("unit")
class TerminatorConverterTest {

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

    private Terminator convert(TerminatorKind kind) {
        return TERMINATORS.stable(org.stablemir.internal.mir.Terminator.of(kind), tables);
    }

    @Test
    void simpleTerminators_mapOneToOne() {
        assertEquals(new Terminator.Goto(3), convert(new TerminatorKind.Goto(3)));
        assertEquals(new Terminator.Return(), convert(new TerminatorKind.Return()));
        assertEquals(new Terminator.Unreachable(), convert(new TerminatorKind.Unreachable()));
    }

    @Test
    @DisplayName("Unwind resume and terminate become Resume and Abort")
    void unwindTerminators_areRenamed() {
        assertEquals(new Terminator.Resume(), convert(new TerminatorKind.UnwindResume()));
        assertEquals(new Terminator.Abort(), convert(new TerminatorKind.UnwindTerminate()));
    }

    @Test
    void switchInt_keepsValueTargetPairsAndOtherwise() {
        Terminator stable = convert(new TerminatorKind.SwitchInt(MirFixtures.copy(1),
                new SwitchTargets(List.of(7L, -1L), List.of(2, 4, 9))));

        assertEquals(new Terminator.SwitchInt(new Operand.Copy(LOCAL_1),
                List.of(new SwitchTarget(7, 2), new SwitchTarget(-1, 4)), 9), stable);
        assertThat(stable.successors()).containsExactly(2, 4, 9);
    }

    @Test
    void switchInt_keepsHighU64ValuesAsUnsignedPattern() {
        Terminator.SwitchInt stable = (Terminator.SwitchInt) convert(new TerminatorKind.SwitchInt(MirFixtures.copy(1),
                new SwitchTargets(List.of(Long.MIN_VALUE, -1L), List.of(2, 4, 9))));

        assertThat(stable.targets())
                .extracting(SwitchTarget::unsignedValue)
                .containsExactly("9223372036854775808", "18446744073709551615");
    }

    @Test
    void drop_dropsReplaceFlag() {
        Terminator stable = convert(new TerminatorKind.Drop(
                org.stablemir.internal.mir.Place.local(1), 2, new org.stablemir.internal.mir.UnwindAction.Cleanup(5), true));

        assertEquals(new Terminator.Drop(LOCAL_1, 2, new UnwindAction.Cleanup(5)), stable);
        assertThat(stable.successors()).containsExactly(2, 5);
    }

    @Test
    void call_withoutReturnTarget_hasOnlyUnwindSuccessors() {
        Terminator stable = convert(new TerminatorKind.Call(
                MirFixtures.constant("panic", Ty.NEVER), List.of(MirFixtures.move(1)),
                org.stablemir.internal.mir.Place.local(0), Optional.empty(),
                new org.stablemir.internal.mir.UnwindAction.Terminate(), "Normal", Span.DUMMY));

        Terminator.Call call = (Terminator.Call) stable;
        assertEquals(new Operand.Constant("panic"), call.func());
        assertThat(call.args()).containsExactly(new Operand.Move(LOCAL_1));
        assertThat(call.target()).isEmpty();
        assertEquals(new UnwindAction.Terminate(), call.unwind());
        assertThat(stable.successors()).isEmpty();
    }

    @Test
    void assert_convertsMessage() {
        Terminator stable = convert(new TerminatorKind.Assert(MirFixtures.copy(1), true,
                new AssertKind.BoundsCheck(MirFixtures.copy(2), MirFixtures.copy(3)), 1,
                new org.stablemir.internal.mir.UnwindAction.Unreachable()));

        assertEquals(new Terminator.Assert(new Operand.Copy(LOCAL_1), true,
                new AssertMessage.BoundsCheck(new Operand.Copy(new Place(2, "[]")), new Operand.Copy(new Place(3, "[]"))),
                1, new UnwindAction.Unreachable()), stable);
    }

    @Test
    void assertMessages_convertGeneratorKinds() {
        assertEquals(new AssertMessage.ResumedAfterReturn(new GeneratorKind.Async(AsyncGeneratorKind.CLOSURE)),
                ASSERT_MESSAGES.stable(new AssertKind.ResumedAfterReturn(
                        org.stablemir.internal.mir.GeneratorKind.ASYNC_CLOSURE), tables));
        assertEquals(new AssertMessage.ResumedAfterPanic(new GeneratorKind.Gen()),
                ASSERT_MESSAGES.stable(new AssertKind.ResumedAfterPanic(
                        org.stablemir.internal.mir.GeneratorKind.GEN), tables));
        assertThat(ASSERT_MESSAGES.stable(new AssertKind.MisalignedPointerDereference(
                MirFixtures.copy(1), MirFixtures.copy(2)), tables))
                .isInstanceOf(AssertMessage.MisalignedPointerDereference.class);
    }

    @Test
    void inlineAsm_rendersTemplateAndExposesRegisterOperands() {
        org.stablemir.internal.mir.Place out = org.stablemir.internal.mir.Place.local(2);
        Terminator stable = convert(new TerminatorKind.InlineAsm(
                List.of("mov {0}, {1}"),
                List.of(
                        new org.stablemir.internal.mir.InlineAsmOperand.Out("reg", false, Optional.of(out)),
                        new org.stablemir.internal.mir.InlineAsmOperand.In("reg", MirFixtures.copy(1)),
                        new org.stablemir.internal.mir.InlineAsmOperand.SymStatic(MirFixtures.PRINTLN)),
                List.of("NOMEM", "NOSTACK"),
                List.of(Span.DUMMY),
                Optional.of(1),
                new org.stablemir.internal.mir.UnwindAction.Continue()));

        Terminator.InlineAsm asm = (Terminator.InlineAsm) stable;
        assertEquals("[mov {0}, {1}]", asm.template());
        assertEquals("[NOMEM, NOSTACK]", asm.options());
        List<InlineAsmOperand> operands = asm.operands();
        assertThat(operands.get(0).inValue()).isEmpty();
        assertThat(operands.get(0).outPlace()).contains(new Place(2, "[]"));
        assertThat(operands.get(1).inValue()).contains(new Operand.Copy(LOCAL_1));
        assertThat(operands.get(2).inValue()).isEmpty();
        assertThat(operands.get(2).outPlace()).isEmpty();
        assertThat(operands.get(2).rawRepr()).isNotBlank();
        assertThat(stable.successors()).containsExactly(1);
    }

    static Stream<Arguments> unreachableTerminators() {
        return Stream.of(
                Arguments.of(new TerminatorKind.Yield(MirFixtures.copy(1), 1, org.stablemir.internal.mir.Place.local(2),
                        Optional.empty()), "TerminatorKind.Yield"),
                Arguments.of(new TerminatorKind.GeneratorDrop(), "TerminatorKind.GeneratorDrop"),
                Arguments.of(new TerminatorKind.FalseEdge(1, 2), "TerminatorKind.FalseEdge"),
                Arguments.of(new TerminatorKind.FalseUnwind(1, new org.stablemir.internal.mir.UnwindAction.Continue()),
                        "TerminatorKind.FalseUnwind"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("unreachableTerminators")
    void preOptimizationTerminators_violateInvariant(TerminatorKind kind, String construct) {
        ConversionException e = assertThrows(ConversionException.class, () -> convert(kind));

        assertEquals(ConversionErrorCode.INVARIANT_VIOLATED, e.code());
        assertEquals(construct, e.construct());
    }
}
