package org.stablemir.internal.ty;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered generic arguments; position binds them to generic parameters.
 */
public record GenericArgs(List<GenericArg> args) {

    public static final GenericArgs EMPTY = new GenericArgs(List.of());

    public GenericArgs {
        args = List.copyOf(args);
    }

    public static GenericArgs of(GenericArg... args) {
        return new GenericArgs(Arrays.asList(args));
    }

    /**
     * @param types Type arguments only.
     * @return Generic arguments consisting of the given types in order.
     */
    public static GenericArgs ofTypes(Ty... types) {
        return new GenericArgs(Arrays.stream(types).<GenericArg>map(GenericArg.Type::new).toList());
    }

    public int size() {
        return args.size();
    }
}
