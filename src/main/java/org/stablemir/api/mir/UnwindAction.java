package org.stablemir.api.mir;

public sealed interface UnwindAction
        permits UnwindAction.Continue, UnwindAction.Unreachable, UnwindAction.Terminate, UnwindAction.Cleanup {

    record Continue() implements UnwindAction {
    }

    record Unreachable() implements UnwindAction {
    }

    record Terminate() implements UnwindAction {
    }

    record Cleanup(int block) implements UnwindAction {
    }
}
