package com.github.micycle1.lightning.tree;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;

/**
 * Chooses which child branch of a junction continues the polyline that arrives
 * at the junction when a tree is converted to polylines. The other branches
 * start polylines of their own. The choice only changes how the edges are
 * grouped into polylines, never which edges are printed.
 */
public enum BranchContinuation {

	/** The first child in insertion order continues the polyline. */
	FIRST_CHILD,
	/** The last child in insertion order continues the polyline. */
	LAST_CHILD,
	/**
	 * The child whose edge is best aligned with the edge from the junction to its
	 * parent continues the polyline. Falls back to the first child at a root.
	 */
	STRAIGHTEST;

	int select(LightningTreeNode junction) {
		List<LightningTreeNode> children = junction.getChildren();
		switch (this) {
			case LAST_CHILD:
				return children.size() - 1;
			case STRAIGHTEST:
				return straightest(junction, children);
			case FIRST_CHILD:
			default:
				return 0;
		}
	}

	private static int straightest(LightningTreeNode junction, List<LightningTreeNode> children) {
		LightningTreeNode parent = junction.getParent();
		if (parent == null) {
			return 0;
		}
		Coordinate here = junction.getLocation();
		Vector2D outgoing = new Vector2D(here, parent.getLocation());
		if (outgoing.length() == 0) {
			return 0;
		}
		int best = 0;
		double bestCos = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < children.size(); i++) {
			Vector2D incoming = new Vector2D(children.get(i).getLocation(), here);
			if (incoming.length() == 0) {
				continue;
			}
			double cos = incoming.dot(outgoing) / (incoming.length() * outgoing.length());
			if (cos > bestCos) {
				bestCos = cos;
				best = i;
			}
		}
		return best;
	}
}
