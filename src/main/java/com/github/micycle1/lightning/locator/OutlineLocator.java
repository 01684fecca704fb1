package com.github.micycle1.lightning.locator;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

/**
 * Spatial queries against the boundary of one layer's infill area. A locator is
 * built once per layer and must not change while trees are propagated into that
 * layer; implementations are expected to be safe for concurrent readers.
 */
public interface OutlineLocator {

	/**
	 * @return the areal geometry (polygon or multipolygon, holes allowed) this
	 *         locator answers queries for
	 */
	Geometry getOutlines();

	/**
	 * @return true if the boundary has no area, in which case no location is
	 *         inside
	 */
	boolean isEmpty();

	/**
	 * @return true if {@code p} lies in the interior of the area or on its boundary
	 */
	boolean isInside(Coordinate p);

	/**
	 * Finds the point on any boundary ring closest to {@code p}.
	 *
	 * @return the closest boundary point, or null if there is no boundary
	 */
	Coordinate findClosestBoundaryPoint(Coordinate p);

	/**
	 * Moves a location into the area. Locations already inside are returned
	 * unchanged (as a copy); others are moved just past the closest boundary point.
	 *
	 * @return a location that {@link #isInside(Coordinate)} accepts, or null if
	 *         none could be produced
	 */
	Coordinate moveInside(Coordinate p);

	/**
	 * @return true if the straight segment between {@code a} and {@code b} leaves
	 *         the area somewhere between its endpoints
	 */
	boolean crossesBoundary(Coordinate a, Coordinate b);
}
