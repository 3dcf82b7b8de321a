package org.stablemir.internal.ty;

import java.util.List;

/**
 * A function signature. The last element of {@code inputsAndOutput} is the return type.
 */
public record FnSig(List<Ty> inputsAndOutput, boolean cVariadic, Unsafety unsafety, Abi abi) {

    public FnSig {
        if (inputsAndOutput.isEmpty()) {
            throw new IllegalArgumentException("A signature needs at least its return type");
        }
        inputsAndOutput = List.copyOf(inputsAndOutput);
    }

    public List<Ty> inputs() {
        return inputsAndOutput.subList(0, inputsAndOutput.size() - 1);
    }

    public Ty output() {
        return inputsAndOutput.get(inputsAndOutput.size() - 1);
    }
}
