package org.stablemir.api.mir;

/**
 * A memory location.
 *
 * @param local      Index into {@link Body#locals()}.
 * @param projection The projection chain in printed form, {@code []} for a bare local.
 */
public record Place(int local, String projection) {
}
