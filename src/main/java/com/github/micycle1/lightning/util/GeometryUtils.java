package com.github.micycle1.lightning.util;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.math.Vector2D;

import com.github.micycle1.lightning.LightningConstants;

public class GeometryUtils {

	/**
	 * Integer grid, the default precision of tree locations.
	 */
	public static final PrecisionModel INTEGER_PRECISION = new PrecisionModel(1.0);

	private GeometryUtils() {
	}

	/**
	 * Returns a copy of the coordinate snapped to the grid of the given precision
	 * model.
	 */
	public static Coordinate round(Coordinate c, PrecisionModel precision) {
		Coordinate copy = new Coordinate(c.x, c.y);
		precision.makePrecise(copy);
		return copy;
	}

	/**
	 * Vector pointing from {@code from} to {@code to}, scaled to the given length.
	 * Coincident points yield the zero vector.
	 */
	public static Vector2D normal(Coordinate from, Coordinate to, double length) {
		Vector2D v = new Vector2D(from, to);
		double len = v.length();
		if (len < LightningConstants.ZERO_DIST) {
			return new Vector2D(0, 0);
		}
		return v.multiply(length / len);
	}

	/**
	 * Moves {@code p} by {@code distance} in the direction of {@code target}. The
	 * result is rounded to the precision model.
	 *
	 * @param p         the point to move
	 * @param target    the point to move towards
	 * @param distance  how far to move
	 * @param precision the precision of the result
	 * @return the moved point, a new instance
	 */
	public static Coordinate moveTowards(Coordinate p, Coordinate target, double distance, PrecisionModel precision) {
		Vector2D step = normal(p, target, distance);
		return round(step.translate(p), precision);
	}

	/**
	 * Point at {@code fraction} of the way from {@code a} to {@code b}.
	 */
	public static Coordinate interpolate(Coordinate a, Coordinate b, double fraction) {
		return new Coordinate(a.x + (b.x - a.x) * fraction, a.y + (b.y - a.y) * fraction);
	}

	public static double distanceToSegment(Coordinate p, Coordinate a, Coordinate b) {
		return new LineSegment(a, b).distance(p);
	}

	public static boolean equals2D(Coordinate a, Coordinate b) {
		return a.distance(b) < LightningConstants.ZERO_DIST;
	}
}
