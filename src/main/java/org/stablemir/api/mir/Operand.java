package org.stablemir.api.mir;

public sealed interface Operand permits Operand.Copy, Operand.Move, Operand.Constant {

    record Copy(Place place) implements Operand {
    }

    record Move(Place place) implements Operand {
    }

    /**
     * @param rendering The constant as the compiler prints it.
     */
    record Constant(String rendering) implements Operand {
    }
}
