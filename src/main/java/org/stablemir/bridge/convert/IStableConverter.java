package org.stablemir.bridge.convert;

import org.stablemir.bridge.Tables;

/**
 * Converts one family of compiler values into its stable counterpart.
 * <p>
 * Implementations are stateless. Nested types and definitions are turned into handles through the
 * provided {@link Tables}; everything else is copied, so the result never refers back into the
 * compiler.
 *
 * @param <I> The compiler-side type.
 * @param <S> The stable type.
 */
public interface IStableConverter<I, S> {

	/**
	 * @param internal The compiler value.
	 * @param tables   The session minting handles for nested types and definitions.
	 * @return The stable value.
	 * @throws org.stablemir.api.ConversionException if the value has no stable form yet, or cannot
	 *                                               legally appear in optimized MIR.
	 */
	S stable(I internal, Tables tables);
}
