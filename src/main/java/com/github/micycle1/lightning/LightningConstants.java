package com.github.micycle1.lightning;

public class LightningConstants {

	/**
	 * Side length of a square cell of the boundary locator grid, in integer
	 * coordinate units.
	 */
	public static final double LOCATOR_CELL_SIZE = 4000;
	/**
	 * Fraction of the smoothing magnitude a junction (node with several children)
	 * may move while straightening.
	 */
	public static final double JUNCTION_MAGNITUDE_FACTOR = 3.0 / 4.0;
	// weighted distance is divided by (1 + boost * valence), valence capped
	public static final double VALENCE_BOOST = 0.25;
	public static final int MAX_VALENCE_FOR_BOOST = 4;
	/**
	 * Trees deeper than this are refused by the recursive algorithms (straighten,
	 * prune, realign, polyline extraction) instead of risking a stack overflow.
	 */
	public static final int MAX_TREE_DEPTH = 4096;
	/**
	 * Default limit on how far realignment may move a node that fell outside the
	 * next layer's boundary before the node is discarded instead.
	 */
	public static final double MAX_SNAP_DISTANCE = LOCATOR_CELL_SIZE / 2;
	// distance a snapped node is pushed past the boundary towards the inside
	public static final double INWARD_NUDGE = 2;
	public static final double ZERO_DIST = 1e-9;
}
