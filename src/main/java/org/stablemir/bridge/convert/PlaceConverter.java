package org.stablemir.bridge.convert;

import org.stablemir.api.mir.Place;
import org.stablemir.bridge.Tables;

/**
 * Keeps the local index and renders the projection chain, which has no stable structure yet.
 */
public final class PlaceConverter implements IStableConverter<org.stablemir.internal.mir.Place, Place> {

	@Override
	public Place stable(org.stablemir.internal.mir.Place place, Tables tables) {
		return new Place(place.local(), place.projection().toString());
	}
}
