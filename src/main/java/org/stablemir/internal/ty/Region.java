package org.stablemir.internal.ty;

/**
 * A lifetime as the compiler prints it, e.g. {@code 'a} or {@code '{erased}}.
 *
 * @param name The printed form.
 */
public record Region(String name) {

    public static final Region ERASED = new Region("'{erased}");
    public static final Region STATIC = new Region("'static");

    @Override
    public String toString() {
        return name;
    }
}
