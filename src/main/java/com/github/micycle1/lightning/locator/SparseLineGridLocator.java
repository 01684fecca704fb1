package com.github.micycle1.lightning.locator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.locationtech.jts.algorithm.LineIntersector;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.algorithm.locate.PointOnGeometryLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.lightning.LightningConstants;
import com.github.micycle1.lightning.util.GeometryUtils;

/**
 * {@link OutlineLocator} backed by a sparse grid of square cells. Every boundary
 * segment is registered in each cell it may pass through, so nearest-point and
 * crossing queries only look at the segments of a few cells around the query
 * instead of the whole boundary.
 * <p>
 * Containment is answered by a JTS {@link IndexedPointInAreaLocator}. Instances
 * are immutable once constructed.
 */
public class SparseLineGridLocator implements OutlineLocator {

	private static final Logger LOGGER = LoggerFactory.getLogger(SparseLineGridLocator.class);

	private final Geometry outlines;
	private final double cellSize;
	private final PrecisionModel precision;
	private final Map<Long, List<LineSegment>> cells = new HashMap<>();
	private final PointOnGeometryLocator pointLocator; // null for an empty boundary
	private int segmentCount = 0;

	// extent of occupied cells, bounds the ring search of nearest queries
	private int minCellX = Integer.MAX_VALUE;
	private int minCellY = Integer.MAX_VALUE;
	private int maxCellX = Integer.MIN_VALUE;
	private int maxCellY = Integer.MIN_VALUE;

	public SparseLineGridLocator(Geometry outlines) {
		this(outlines, LightningConstants.LOCATOR_CELL_SIZE, GeometryUtils.INTEGER_PRECISION);
	}

	/**
	 * Builds the grid over all rings of the given areal geometry.
	 *
	 * @param outlines  polygon or multipolygon; may be empty
	 * @param cellSize  side length of a grid cell
	 * @param precision precision model locations produced by
	 *                  {@link #moveInside(Coordinate)} are rounded to
	 */
	public SparseLineGridLocator(Geometry outlines, double cellSize, PrecisionModel precision) {
		this.outlines = Objects.requireNonNull(outlines, "Outlines cannot be null");
		this.precision = Objects.requireNonNull(precision, "Precision model cannot be null");
		if (!(cellSize > 0)) {
			throw new IllegalArgumentException("Cell size must be positive, got " + cellSize);
		}
		this.cellSize = cellSize;

		if (outlines.isEmpty()) {
			this.pointLocator = null;
			return;
		}
		if (outlines.getDimension() != 2) {
			throw new IllegalArgumentException("Outlines must be areal, got " + outlines.getGeometryType());
		}
		this.pointLocator = new IndexedPointInAreaLocator(outlines);

		for (LineString ring : rings(outlines)) {
			Coordinate[] coords = ring.getCoordinates();
			for (int i = 0; i < coords.length - 1; i++) {
				if (coords[i].equals2D(coords[i + 1])) {
					continue;
				}
				insert(new LineSegment(coords[i], coords[i + 1]));
			}
		}
		LOGGER.debug("Locator over {} boundary segments in {} cells (cell size {})", segmentCount, cells.size(), cellSize);
	}

	private static List<LineString> rings(Geometry outlines) {
		List<LineString> rings = new ArrayList<>();
		for (int i = 0; i < outlines.getNumGeometries(); i++) {
			Geometry part = outlines.getGeometryN(i);
			if (part instanceof Polygon) {
				Polygon polygon = (Polygon) part;
				rings.add(polygon.getExteriorRing());
				for (int j = 0; j < polygon.getNumInteriorRing(); j++) {
					rings.add(polygon.getInteriorRingN(j));
				}
			} else if (part instanceof GeometryCollection) {
				rings.addAll(rings(part));
			}
		}
		return rings;
	}

	private void insert(LineSegment segment) {
		int x0 = cellIndex(Math.min(segment.p0.x, segment.p1.x));
		int x1 = cellIndex(Math.max(segment.p0.x, segment.p1.x));
		int y0 = cellIndex(Math.min(segment.p0.y, segment.p1.y));
		int y1 = cellIndex(Math.max(segment.p0.y, segment.p1.y));
		// a segment passing through a cell is never further from its centre than
		// half the cell diagonal
		double reach = cellSize * Math.sqrt(0.5);
		for (int cx = x0; cx <= x1; cx++) {
			for (int cy = y0; cy <= y1; cy++) {
				Coordinate centre = new Coordinate((cx + 0.5) * cellSize, (cy + 0.5) * cellSize);
				if (segment.distance(centre) <= reach) {
					cells.computeIfAbsent(key(cx, cy), k -> new ArrayList<>()).add(segment);
					minCellX = Math.min(minCellX, cx);
					minCellY = Math.min(minCellY, cy);
					maxCellX = Math.max(maxCellX, cx);
					maxCellY = Math.max(maxCellY, cy);
				}
			}
		}
		segmentCount++;
	}

	private int cellIndex(double v) {
		return (int) Math.floor(v / cellSize);
	}

	private static long key(int cx, int cy) {
		return ((long) cx << 32) | (cy & 0xffffffffL);
	}

	private List<LineSegment> cell(int cx, int cy) {
		List<LineSegment> segments = cells.get(key(cx, cy));
		return segments == null ? Collections.emptyList() : segments;
	}

	@Override
	public Geometry getOutlines() {
		return outlines;
	}

	@Override
	public boolean isEmpty() {
		return pointLocator == null;
	}

	public double getCellSize() {
		return cellSize;
	}

	public int getSegmentCount() {
		return segmentCount;
	}

	@Override
	public boolean isInside(Coordinate p) {
		if (pointLocator == null) {
			return false;
		}
		return pointLocator.locate(p) != Location.EXTERIOR;
	}

	@Override
	public Coordinate findClosestBoundaryPoint(Coordinate p) {
		if (segmentCount == 0) {
			return null;
		}
		final int cx = cellIndex(p.x);
		final int cy = cellIndex(p.y);
		final int maxRing = Math.max(Math.max(Math.abs(cx - minCellX), Math.abs(maxCellX - cx)),
				Math.max(Math.abs(cy - minCellY), Math.abs(maxCellY - cy)));

		// rings closer than the occupied extent hold no segments
		final int firstRing = Math.max(Math.max(minCellX - cx, cx - maxCellX), Math.max(Math.max(minCellY - cy, cy - maxCellY), 0));

		Coordinate best = null;
		double bestDist = Double.POSITIVE_INFINITY;
		for (int ring = firstRing; ring <= maxRing; ring++) {
			// p can lie anywhere in its own cell, so cells of this ring are at least
			// (ring - 1) cells away
			if (best != null && (ring - 1) * cellSize > bestDist) {
				break;
			}
			for (LineSegment segment : ringSegments(cx, cy, ring)) {
				Coordinate q = segment.closestPoint(p);
				double d = q.distance(p);
				if (d < bestDist) {
					bestDist = d;
					best = q;
				}
			}
		}
		return best;
	}

	/**
	 * Segments of the cells on the perimeter of the square of cells centred on
	 * ({@code cx}, {@code cy}) with Chebyshev radius {@code ring}.
	 */
	private List<LineSegment> ringSegments(int cx, int cy, int ring) {
		if (ring == 0) {
			return cell(cx, cy);
		}
		List<LineSegment> segments = new ArrayList<>();
		for (int d = -ring; d <= ring; d++) {
			segments.addAll(cell(cx + d, cy - ring));
			segments.addAll(cell(cx + d, cy + ring));
		}
		for (int d = -ring + 1; d < ring; d++) {
			segments.addAll(cell(cx - ring, cy + d));
			segments.addAll(cell(cx + ring, cy + d));
		}
		return segments;
	}

	@Override
	public Coordinate moveInside(Coordinate p) {
		if (isEmpty()) {
			return null;
		}
		if (isInside(p)) {
			return new Coordinate(p.x, p.y);
		}
		Coordinate closest = findClosestBoundaryPoint(p);
		if (closest == null) {
			return null;
		}
		Coordinate nudged = GeometryUtils.round(GeometryUtils.normal(p, closest, LightningConstants.INWARD_NUDGE).translate(closest), precision);
		if (isInside(nudged)) {
			return nudged;
		}
		Coordinate onBoundary = GeometryUtils.round(closest, precision);
		if (isInside(onBoundary)) {
			return onBoundary;
		}
		LOGGER.debug("Could not move {} inside; closest boundary point {} rounds outside", p, closest);
		return null;
	}

	@Override
	public boolean crossesBoundary(Coordinate a, Coordinate b) {
		if (isEmpty()) {
			return true;
		}
		if (GeometryUtils.equals2D(a, b)) {
			return !isInside(a);
		}
		LineSegment query = new LineSegment(a, b);
		Set<LineSegment> candidates = Collections.newSetFromMap(new IdentityHashMap<>());
		Envelope env = new Envelope(a, b);
		double reach = cellSize * Math.sqrt(0.5);
		for (int cx = cellIndex(env.getMinX()); cx <= cellIndex(env.getMaxX()); cx++) {
			for (int cy = cellIndex(env.getMinY()); cy <= cellIndex(env.getMaxY()); cy++) {
				Coordinate centre = new Coordinate((cx + 0.5) * cellSize, (cy + 0.5) * cellSize);
				if (query.distance(centre) <= reach) {
					candidates.addAll(cell(cx, cy));
				}
			}
		}

		// split the query at every contact with the boundary; the query leaves the
		// area iff one of the pieces has its midpoint outside
		List<Double> params = new ArrayList<>();
		params.add(0.0);
		params.add(1.0);
		LineIntersector li = new RobustLineIntersector();
		for (LineSegment segment : candidates) {
			li.computeIntersection(a, b, segment.p0, segment.p1);
			for (int i = 0; i < li.getIntersectionNum(); i++) {
				double t = query.projectionFactor(li.getIntersection(i));
				params.add(Math.max(0, Math.min(1, t)));
			}
		}
		Collections.sort(params);
		for (int i = 0; i < params.size() - 1; i++) {
			double t0 = params.get(i);
			double t1 = params.get(i + 1);
			if (t1 - t0 < LightningConstants.ZERO_DIST) {
				continue;
			}
			if (!isInside(GeometryUtils.interpolate(a, b, (t0 + t1) / 2))) {
				return true;
			}
		}
		return false;
	}
}
