package com.github.micycle1.lightning.layer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.tuple.Pair;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.lightning.LightningSettings;
import com.github.micycle1.lightning.locator.OutlineLocator;
import com.github.micycle1.lightning.locator.SparseLineGridLocator;
import com.github.micycle1.lightning.tree.LightningTreeNode;
import com.github.micycle1.lightning.util.GeometryUtils;

/**
 * The Lightning trees of a single layer. Unsupported locations are grounded on
 * these trees (or on the layer's wall), the trees are propagated to the layer
 * below, and converted into the polylines printed on this layer.
 */
public class LightningLayer {

	private static final Logger LOGGER = LoggerFactory.getLogger(LightningLayer.class);

	private final List<LightningTreeNode> trees = new ArrayList<>();

	public LightningLayer() {
	}

	public LightningLayer(Collection<LightningTreeNode> roots) {
		roots.forEach(this::addTree);
	}

	/**
	 * @return an unmodifiable view of the roots of this layer's trees
	 */
	public List<LightningTreeNode> getTrees() {
		return Collections.unmodifiableList(trees);
	}

	public void addTree(LightningTreeNode root) {
		Objects.requireNonNull(root, "Tree cannot be null");
		if (!root.isRoot()) {
			throw new IllegalArgumentException("Only roots can be added as trees, got " + root);
		}
		trees.add(root);
	}

	public int nodeCount() {
		return trees.stream().mapToInt(LightningTreeNode::nodeCount).sum();
	}

	/**
	 * Grounds an unsupported location. If the wall is within
	 * {@code wallSupportingRadius} the location is connected to the wall by a new
	 * tree; otherwise it becomes a child of the tree node with the smallest
	 * weighted distance, unless the wall is closer still.
	 *
	 * @param unsupported          the location that needs support
	 * @param outlineLocator       locator over this layer's boundary
	 * @param supportingRadius     the maximum distance bridged without support
	 * @param wallSupportingRadius distance to the wall under which the wall is
	 *                             always preferred
	 * @return the new node at {@code unsupported}, or null if neither a tree nor a
	 *         wall is available
	 */
	public LightningTreeNode attach(Coordinate unsupported, OutlineLocator outlineLocator, double supportingRadius, double wallSupportingRadius) {
		Objects.requireNonNull(unsupported, "Unsupported location cannot be null");
		Objects.requireNonNull(outlineLocator, "Outline locator cannot be null");

		Coordinate wall = outlineLocator.findClosestBoundaryPoint(unsupported);
		double wallDist = wall == null ? Double.POSITIVE_INFINITY : wall.distance(unsupported);

		if (wallDist >= wallSupportingRadius) {
			Pair<LightningTreeNode, Double> best = findBestTreeNode(unsupported, supportingRadius);
			if (best != null && best.getRight() < wallDist) {
				return best.getLeft().addChild(unsupported);
			}
		}
		if (wall == null) {
			LOGGER.warn("Cannot ground {}: no trees and no boundary on this layer", unsupported);
			return null;
		}

		Coordinate anchor = GeometryUtils.round(wall, GeometryUtils.INTEGER_PRECISION);
		Coordinate inside = outlineLocator.moveInside(anchor);
		LightningTreeNode root = LightningTreeNode.create(inside == null ? anchor : inside);
		trees.add(root);
		return root.addChild(unsupported);
	}

	private Pair<LightningTreeNode, Double> findBestTreeNode(Coordinate unsupported, double supportingRadius) {
		Pair<LightningTreeNode, Double> best = null;
		for (LightningTreeNode tree : trees) {
			List<LightningTreeNode> nodes = new ArrayList<>();
			tree.visitNodes(nodes::add);
			for (LightningTreeNode node : nodes) {
				double d = node.getWeightedDistance(unsupported, supportingRadius);
				if (best == null || d < best.getRight()) {
					best = Pair.of(node, d);
				}
			}
		}
		return best;
	}

	/**
	 * Propagates every tree to the next layer, building a locator over the next
	 * layer's outlines first.
	 */
	public LightningLayer propagateToNextLayer(Geometry nextOutlines, LightningSettings settings) {
		OutlineLocator locator = new SparseLineGridLocator(nextOutlines, settings.getLocatorCellSize(), GeometryUtils.INTEGER_PRECISION);
		return propagateToNextLayer(nextOutlines, locator, settings);
	}

	/**
	 * Propagates every tree to the next layer. Each tree writes its results into a
	 * slot of its own, so trees may be processed concurrently
	 * ({@link LightningSettings#isParallel()}); the slots are concatenated in tree
	 * order, making the result independent of scheduling.
	 *
	 * @param nextOutlines   the infill area of the next layer
	 * @param outlineLocator locator over {@code nextOutlines}; must not change
	 *                       during the call
	 * @param settings       pruning, straightening and snapping distances
	 * @return the next layer
	 */
	public LightningLayer propagateToNextLayer(Geometry nextOutlines, OutlineLocator outlineLocator, LightningSettings settings) {
		Objects.requireNonNull(nextOutlines, "Next outlines cannot be null");
		Objects.requireNonNull(outlineLocator, "Outline locator cannot be null");
		Objects.requireNonNull(settings, "Settings cannot be null");
		if (nextOutlines.isEmpty() && !trees.isEmpty()) {
			LOGGER.warn("Next layer has no infill area, discarding {} tree(s)", trees.size());
		}

		Stream<LightningTreeNode> stream = settings.isParallel() ? trees.parallelStream() : trees.stream();
		List<List<LightningTreeNode>> slots = stream.map(tree -> {
			List<LightningTreeNode> slot = new ArrayList<>();
			tree.propagateToNextLayer(slot, nextOutlines, outlineLocator, settings.getPruneDistance(), settings.getSmoothMagnitude(),
					settings.getMaxRemoveColinearDist(), settings.getMaxSnapDistance());
			return slot;
		}).collect(Collectors.toList());

		LightningLayer next = new LightningLayer();
		slots.forEach(next.trees::addAll);
		LOGGER.info("Propagated {} tree(s) into {} tree(s) with {} nodes", trees.size(), next.trees.size(), next.nodeCount());
		return next;
	}

	/**
	 * Converts all trees of this layer into printable polylines.
	 */
	public List<LineString> toPolylines(LightningSettings settings) {
		List<LineString> polylines = new ArrayList<>();
		for (LightningTreeNode tree : trees) {
			tree.convertToPolylines(polylines, settings.getLineWidth(), settings.getBranchContinuation());
		}
		LOGGER.debug("{} tree(s) converted into {} polyline(s)", trees.size(), polylines.size());
		return polylines;
	}
}
