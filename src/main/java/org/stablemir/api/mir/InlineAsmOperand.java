package org.stablemir.api.mir;

import java.util.Optional;

/**
 * An inline assembly operand. Only the value flowing in and the place written back are
 * structured; everything else is in {@code rawRepr}.
 */
public record InlineAsmOperand(Optional<Operand> inValue, Optional<Place> outPlace, String rawRepr) {
}
