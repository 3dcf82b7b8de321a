package org.stablemir.internal.mir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Jump table of a {@code SwitchInt}. {@code targets} holds one block per value followed by the
 * {@link #otherwise()} block. Values are unsigned 64-bit patterns, so discriminants above
 * {@code i64::MAX} are stored as negative longs; wider values are not modeled.
 */
public record SwitchTargets(List<Long> values, List<Integer> targets) {

    public SwitchTargets {
        values = List.copyOf(values);
        targets = List.copyOf(targets);
        if (targets.size() != values.size() + 1) {
            throw new IllegalArgumentException("Expected " + (values.size() + 1) + " targets, got " + targets.size());
        }
    }

    /**
     * @param valueTargets Value to block pairs, in iteration order.
     * @param otherwise    Block taken when no value matches.
     * @return The switch targets.
     */
    public static SwitchTargets of(Map<Long, Integer> valueTargets, int otherwise) {
        List<Long> values = new ArrayList<>(valueTargets.keySet());
        List<Integer> targets = new ArrayList<>(valueTargets.values());
        targets.add(otherwise);
        return new SwitchTargets(values, targets);
    }

    /**
     * Branches on a boolean: {@code 0} goes to {@code ifFalse}, anything else to {@code ifTrue}.
     */
    public static SwitchTargets staticIf(int ifFalse, int ifTrue) {
        return new SwitchTargets(List.of(0L), List.of(ifFalse, ifTrue));
    }

    public int otherwise() {
        return targets.get(targets.size() - 1);
    }

    public int size() {
        return values.size();
    }
}
