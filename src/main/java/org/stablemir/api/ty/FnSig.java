package org.stablemir.api.ty;

import org.stablemir.api.mir.Safety;

import java.util.List;

/**
 * @param inputsAndOutput Parameter types followed by the return type.
 */
public record FnSig(List<Ty> inputsAndOutput, boolean cVariadic, Safety unsafety, Abi abi) {

    public FnSig {
        inputsAndOutput = List.copyOf(inputsAndOutput);
    }

    public List<Ty> inputs() {
        return inputsAndOutput.subList(0, inputsAndOutput.size() - 1);
    }

    public Ty output() {
        return inputsAndOutput.get(inputsAndOutput.size() - 1);
    }
}
