package org.stablemir.internal.mir;

/**
 * What happens when a call or drop unwinds.
 */
public sealed interface UnwindAction
        permits UnwindAction.Continue, UnwindAction.Unreachable, UnwindAction.Terminate, UnwindAction.Cleanup {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitContinue(Continue action);
        R visitUnreachable(Unreachable action);
        R visitTerminate(Terminate action);
        R visitCleanup(Cleanup cleanup);
    }

    /**
     * Unwind into the caller.
     */
    record Continue() implements UnwindAction {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    record Unreachable() implements UnwindAction {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnreachable(this);
        }
    }

    /**
     * Abort the program.
     */
    record Terminate() implements UnwindAction {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTerminate(this);
        }
    }

    /**
     * Jump to a cleanup block.
     */
    record Cleanup(int block) implements UnwindAction {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCleanup(this);
        }
    }
}
