package org.stablemir.bridge.convert;

import org.stablemir.api.ConversionException;
import org.stablemir.api.mir.InlineAsmOperand;
import org.stablemir.api.mir.Operand;
import org.stablemir.api.mir.SwitchTarget;
import org.stablemir.api.mir.Terminator;
import org.stablemir.bridge.Tables;
import org.stablemir.internal.mir.SwitchTargets;
import org.stablemir.internal.mir.TerminatorKind;

import java.util.ArrayList;
import java.util.List;

import static org.stablemir.bridge.convert.StableConverters.ASSERT_MESSAGES;
import static org.stablemir.bridge.convert.StableConverters.INLINE_ASM_OPERANDS;
import static org.stablemir.bridge.convert.StableConverters.OPERANDS;
import static org.stablemir.bridge.convert.StableConverters.PLACES;
import static org.stablemir.bridge.convert.StableConverters.UNWIND_ACTIONS;

/**
 * Converts block terminators. Generator and borrow-check-only terminators are gone by the time a body
 * is optimized, so meeting one is an invariant violation rather than a missing feature.
 */
public final class TerminatorConverter implements IStableConverter<org.stablemir.internal.mir.Terminator, Terminator> {

	@Override
	public Terminator stable(org.stablemir.internal.mir.Terminator terminator, Tables tables) {
		return terminator.kind().accept(new KindVisitor(tables));
	}

	private static final class KindVisitor implements TerminatorKind.Visitor<Terminator> {

		private final Tables tables;

		KindVisitor(Tables tables) {
			this.tables = tables;
		}

		@Override
		public Terminator visitGoto(TerminatorKind.Goto gotoKind) {
			return new Terminator.Goto(gotoKind.target());
		}

		@Override
		public Terminator visitSwitchInt(TerminatorKind.SwitchInt switchInt) {
			SwitchTargets targets = switchInt.targets();
			List<SwitchTarget> branches = new ArrayList<>(targets.values().size());
			for (int i = 0; i < targets.values().size(); i++) {
				branches.add(new SwitchTarget(targets.values().get(i), targets.targets().get(i)));
			}
			return new Terminator.SwitchInt(OPERANDS.stable(switchInt.discr(), tables), branches, targets.otherwise());
		}

		@Override
		public Terminator visitUnwindResume(TerminatorKind.UnwindResume resume) {
			return new Terminator.Resume();
		}

		@Override
		public Terminator visitUnwindTerminate(TerminatorKind.UnwindTerminate terminate) {
			return new Terminator.Abort();
		}

		@Override
		public Terminator visitReturn(TerminatorKind.Return returnKind) {
			return new Terminator.Return();
		}

		@Override
		public Terminator visitUnreachable(TerminatorKind.Unreachable unreachable) {
			return new Terminator.Unreachable();
		}

		@Override
		public Terminator visitDrop(TerminatorKind.Drop drop) {
			return new Terminator.Drop(
					PLACES.stable(drop.place(), tables),
					drop.target(),
					UNWIND_ACTIONS.stable(drop.unwind(), tables));
		}

		@Override
		public Terminator visitCall(TerminatorKind.Call call) {
			List<Operand> args = new ArrayList<>(call.args().size());
			for (org.stablemir.internal.mir.Operand arg : call.args()) {
				args.add(OPERANDS.stable(arg, tables));
			}
			return new Terminator.Call(
					OPERANDS.stable(call.func(), tables),
					args,
					PLACES.stable(call.destination(), tables),
					call.target(),
					UNWIND_ACTIONS.stable(call.unwind(), tables));
		}

		@Override
		public Terminator visitAssert(TerminatorKind.Assert assertKind) {
			return new Terminator.Assert(
					OPERANDS.stable(assertKind.cond(), tables),
					assertKind.expected(),
					ASSERT_MESSAGES.stable(assertKind.msg(), tables),
					assertKind.target(),
					UNWIND_ACTIONS.stable(assertKind.unwind(), tables));
		}

		@Override
		public Terminator visitYield(TerminatorKind.Yield yieldKind) {
			throw ConversionException.invariantViolated("TerminatorKind.Yield");
		}

		@Override
		public Terminator visitGeneratorDrop(TerminatorKind.GeneratorDrop generatorDrop) {
			throw ConversionException.invariantViolated("TerminatorKind.GeneratorDrop");
		}

		@Override
		public Terminator visitFalseEdge(TerminatorKind.FalseEdge falseEdge) {
			throw ConversionException.invariantViolated("TerminatorKind.FalseEdge");
		}

		@Override
		public Terminator visitFalseUnwind(TerminatorKind.FalseUnwind falseUnwind) {
			throw ConversionException.invariantViolated("TerminatorKind.FalseUnwind");
		}

		@Override
		public Terminator visitInlineAsm(TerminatorKind.InlineAsm inlineAsm) {
			List<InlineAsmOperand> operands = new ArrayList<>(inlineAsm.operands().size());
			for (org.stablemir.internal.mir.InlineAsmOperand operand : inlineAsm.operands()) {
				operands.add(INLINE_ASM_OPERANDS.stable(operand, tables));
			}
			return new Terminator.InlineAsm(
					inlineAsm.template().toString(),
					operands,
					inlineAsm.options().toString(),
					inlineAsm.lineSpans().toString(),
					inlineAsm.destination(),
					UNWIND_ACTIONS.stable(inlineAsm.unwind(), tables));
		}
	}
}
