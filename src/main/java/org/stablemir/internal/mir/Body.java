package org.stablemir.internal.mir;

import java.util.List;

/**
 * An optimized function body. Local {@code 0} is the return place, locals {@code 1..=argCount}
 * are the arguments.
 */
public record Body(List<BasicBlockData> basicBlocks, List<LocalDecl> localDecls, int argCount) {

    public Body {
        basicBlocks = List.copyOf(basicBlocks);
        localDecls = List.copyOf(localDecls);
        if (localDecls.isEmpty()) {
            throw new IllegalArgumentException("A body always has a return place");
        }
        if (argCount < 0 || argCount >= localDecls.size()) {
            throw new IllegalArgumentException("Argument count " + argCount + " out of range for "
                    + localDecls.size() + " locals");
        }
    }
}
