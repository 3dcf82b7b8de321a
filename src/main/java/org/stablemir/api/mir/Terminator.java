package org.stablemir.api.mir;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The control transfer ending a {@link BasicBlock}. Every block index it holds is an index into
 * the owning {@link Body#blocks()}.
 */
public sealed interface Terminator
        permits Terminator.Goto, Terminator.SwitchInt, Terminator.Resume, Terminator.Abort, Terminator.Return,
        Terminator.Unreachable, Terminator.Drop, Terminator.Call, Terminator.Assert, Terminator.InlineAsm {

    /**
     * @return Every block this terminator may jump to, normal edges first, then the cleanup edge.
     */
    List<Integer> successors();

    private static List<Integer> withUnwind(List<Integer> normal, UnwindAction unwind) {
        if (unwind instanceof UnwindAction.Cleanup cleanup) {
            List<Integer> all = new ArrayList<>(normal);
            all.add(cleanup.block());
            return List.copyOf(all);
        }
        return List.copyOf(normal);
    }

    record Goto(int target) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of(target);
        }
    }

    record SwitchInt(Operand discr, List<SwitchTarget> targets, int otherwise) implements Terminator {
        public SwitchInt {
            targets = List.copyOf(targets);
        }

        @Override
        public List<Integer> successors() {
            List<Integer> all = new ArrayList<>();
            for (SwitchTarget t : targets) {
                all.add(t.target());
            }
            all.add(otherwise);
            return List.copyOf(all);
        }
    }

    record Resume() implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }
    }

    record Abort() implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }
    }

    record Return() implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }
    }

    record Unreachable() implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }
    }

    record Drop(Place place, int target, UnwindAction unwind) implements Terminator {
        @Override
        public List<Integer> successors() {
            return Terminator.withUnwind(List.of(target), unwind);
        }
    }

    /**
     * @param target Where execution continues after the call; empty if the callee diverges.
     */
    record Call(Operand func, List<Operand> args, Place destination, Optional<Integer> target,
                UnwindAction unwind) implements Terminator {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public List<Integer> successors() {
            return Terminator.withUnwind(target.map(List::of).orElse(List.of()), unwind);
        }
    }

    record Assert(Operand cond, boolean expected, AssertMessage msg, int target, UnwindAction unwind)
            implements Terminator {
        @Override
        public List<Integer> successors() {
            return Terminator.withUnwind(List.of(target), unwind);
        }
    }

    /**
     * @param template  The assembly template, rendered.
     * @param options   The assembler options, rendered.
     * @param lineSpans Source spans of the template lines, rendered.
     */
    record InlineAsm(String template, List<InlineAsmOperand> operands, String options, String lineSpans,
                     Optional<Integer> destination, UnwindAction unwind) implements Terminator {
        public InlineAsm {
            operands = List.copyOf(operands);
        }

        @Override
        public List<Integer> successors() {
            return Terminator.withUnwind(destination.map(List::of).orElse(List.of()), unwind);
        }
    }
}
