package org.stablemir.bridge;

import org.stablemir.api.Context;

import java.util.function.Consumer;

/**
 * A {@link Context} that also grants access to the session's raw tables. Only handed to trusted
 * extensions that need to map between compiler values and stable handles themselves; ordinary
 * tools see the plain {@link Context}.
 */
public interface TrustedContext extends Context {

    /**
     * Runs {@code action} with exclusive access to the session tables. The tables must not escape
     * the action.
     *
     * @param action The privileged operation.
     */
    void withTables(Consumer<Tables> action);
}
