package com.github.micycle1.lightning.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.apache.commons.lang3.tuple.Pair;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.lightning.LightningConstants;
import com.github.micycle1.lightning.locator.OutlineLocator;
import com.github.micycle1.lightning.util.GeometryUtils;

/**
 * A single vertex of a Lightning tree, the structure that determines the paths
 * printed as Lightning infill.
 * <p>
 * A node is a position on one layer linked to a parent (closer to the root) and
 * an ordered list of children. The node owns its children; the parent link is a
 * plain back-reference used for upward navigation only. A node without parent
 * is the root of its tree.
 * <p>
 * Besides navigation and mutation, the class carries the per-tree algorithms of
 * Lightning infill: propagation to the layer below (copy, realign, straighten,
 * prune) and conversion to printable polylines. Locations are kept on the
 * integer grid of {@link GeometryUtils#INTEGER_PRECISION}.
 * <p>
 * The recursive algorithms refuse trees deeper than
 * {@link LightningConstants#MAX_TREE_DEPTH} with an
 * {@link IllegalStateException}.
 */
public class LightningTreeNode {

	private static final Logger LOGGER = LoggerFactory.getLogger(LightningTreeNode.class);

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(GeometryUtils.INTEGER_PRECISION);
	// length of the unit vectors summed up when moving a junction
	private static final double JUNCTION_DIRECTION_WEIGHT = 1000;

	private Coordinate location;
	private LightningTreeNode parent;
	private final List<LightningTreeNode> children = new ArrayList<>();
	private Coordinate lastGroundingLocation;

	private LightningTreeNode(Coordinate location, Coordinate lastGroundingLocation) {
		Objects.requireNonNull(location, "A tree node needs a location");
		this.location = new Coordinate(location.x, location.y);
		this.lastGroundingLocation = lastGroundingLocation == null ? null : new Coordinate(lastGroundingLocation.x, lastGroundingLocation.y);
	}

	/**
	 * Creates a new root node.
	 *
	 * @param location the position on the layer this node represents
	 * @return a node without parent or children
	 */
	public static LightningTreeNode create(Coordinate location) {
		return new LightningTreeNode(location, null);
	}

	/**
	 * Creates a new root node that remembers where it was last grounded.
	 *
	 * @param location              the position on the layer this node represents
	 * @param lastGroundingLocation where the branch was last anchored to solid
	 *                              support; may be null
	 */
	public static LightningTreeNode create(Coordinate location, Coordinate lastGroundingLocation) {
		return new LightningTreeNode(location, lastGroundingLocation);
	}

	/**
	 * Gets the position on this layer that this node represents. The returned
	 * instance must not be modified; use {@link #setLocation(Coordinate)}.
	 */
	public Coordinate getLocation() {
		return location;
	}

	public void setLocation(Coordinate p) {
		Objects.requireNonNull(p, "A tree node needs a location");
		this.location = new Coordinate(p.x, p.y);
	}

	/**
	 * @return the parent node, or null if this node is a root
	 */
	public LightningTreeNode getParent() {
		return parent;
	}

	/**
	 * @return an unmodifiable view of the children, in insertion order
	 */
	public List<LightningTreeNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Returns whether this node is the root of a tree, i.e. has no parent.
	 */
	public boolean isRoot() {
		return parent == null;
	}

	/**
	 * If this node was ever a direct child of a root, it remembers that root's
	 * location. Lower layers use it to know where the layer above was supported.
	 *
	 * @return the last grounding location, if any
	 */
	public Optional<Coordinate> getLastGroundingLocation() {
		return Optional.ofNullable(lastGroundingLocation);
	}

	/**
	 * Constructs a new node and adds it as the last child of this node.
	 *
	 * @param p the location of the new node
	 * @return the new node
	 */
	public LightningTreeNode addChild(Coordinate p) {
		LightningTreeNode child = new LightningTreeNode(p, null);
		link(this, child);
		return child;
	}

	/**
	 * Adds an existing node, together with its whole sub-tree, as the last child of
	 * this node. A node that still has a parent is detached from it first.
	 *
	 * @param newChild the node to adopt
	 * @return {@code newChild}
	 * @throws IllegalArgumentException if {@code newChild} is this node or one of
	 *                                  its ancestors, which would close a cycle
	 */
	public LightningTreeNode addChild(LightningTreeNode newChild) {
		Objects.requireNonNull(newChild, "Child cannot be null");
		if (newChild.hasOffspring(this)) {
			throw new IllegalArgumentException("Cannot add " + newChild + " as child of " + this + ": it is an ancestor of (or equal to) the acceptor");
		}
		if (newChild.parent != null) {
			newChild.parent.children.remove(newChild);
		}
		link(this, newChild);
		return newChild;
	}

	private static void link(LightningTreeNode parent, LightningTreeNode child) {
		parent.children.add(child);
		child.parent = parent;
		if (parent.isRoot() && child.lastGroundingLocation == null) {
			child.lastGroundingLocation = new Coordinate(parent.location.x, parent.location.y);
		}
	}

	/**
	 * Makes this node the root of its tree. The parent-child relation of every edge
	 * on the path from the old root to this node is reversed, so the old root ends
	 * up as a leaf (unless it has other children); sub-trees hanging off that path
	 * are untouched.
	 */
	public void reroot() {
		reroot(null);
	}

	/**
	 * Makes this node the root of its tree, then attaches it (and with it the whole
	 * re-oriented tree) as a child of {@code newParent}, if given.
	 *
	 * @param newParent node of another tree to attach to; may be null
	 * @throws IllegalArgumentException if {@code newParent} belongs to this node's
	 *                                  tree
	 */
	public void reroot(LightningTreeNode newParent) {
		LightningTreeNode oldRoot = this;
		List<LightningTreeNode> path = new ArrayList<>();
		while (oldRoot != null) {
			path.add(oldRoot);
			oldRoot = oldRoot.parent;
		}
		if (newParent != null && path.get(path.size() - 1).hasOffspring(newParent)) {
			throw new IllegalArgumentException("Cannot reroot " + this + " onto " + newParent + " of the same tree");
		}

		// reverse the edges from the old root downwards
		for (int i = path.size() - 1; i > 0; i--) {
			LightningTreeNode upper = path.get(i);
			LightningTreeNode lower = path.get(i - 1);
			upper.children.remove(lower);
			lower.children.add(upper);
			upper.parent = lower;
		}
		this.parent = null;
		if (newParent == null && path.size() > 1 && path.get(1).lastGroundingLocation == null) {
			path.get(1).lastGroundingLocation = new Coordinate(location.x, location.y);
		}

		if (newParent != null) {
			link(newParent, this);
		}
	}

	/**
	 * Finds the node of this sub-tree (this node included) closest to the given
	 * location. Ties go to the node visited first in depth-first, children-order
	 * traversal.
	 *
	 * @param loc the location to search for
	 * @return the closest node, never null
	 */
	public LightningTreeNode closestNode(Coordinate loc) {
		LightningTreeNode best = this;
		double bestDist = location.distance(loc);
		for (LightningTreeNode node : preOrder()) {
			double d = node.location.distance(loc);
			if (d < bestDist) {
				bestDist = d;
				best = node;
			}
		}
		return best;
	}

	/**
	 * Returns whether the given node is part of this node's sub-tree. This node
	 * itself counts as its own offspring.
	 *
	 * @param toBeChecked the node to look for
	 * @return true if {@code toBeChecked} is this node or one of its descendants
	 */
	public boolean hasOffspring(LightningTreeNode toBeChecked) {
		for (LightningTreeNode n = toBeChecked; n != null; n = n.parent) {
			if (n == this) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Executes a function for every edge of this node's sub-tree, depth-first. The
	 * first argument is the location of the node closer to the root, the second
	 * that of the node closer to the leaves. The edge from this node to its own
	 * parent is not included.
	 */
	public void visitBranches(BiConsumer<Coordinate, Coordinate> visitor) {
		Deque<LightningTreeNode> stack = new ArrayDeque<>();
		pushChildren(stack, this);
		while (!stack.isEmpty()) {
			LightningTreeNode node = stack.pop();
			visitor.accept(node.parent.location, node.location);
			pushChildren(stack, node);
		}
	}

	/**
	 * Executes a function for every node of this sub-tree, this node first
	 * (depth-first, pre-order). The nodes are gathered before the first call, so
	 * the visitor may modify them.
	 */
	public void visitNodes(Consumer<LightningTreeNode> visitor) {
		preOrder().forEach(visitor);
	}

	private List<LightningTreeNode> preOrder() {
		List<LightningTreeNode> nodes = new ArrayList<>();
		Deque<LightningTreeNode> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			LightningTreeNode node = stack.pop();
			nodes.add(node);
			pushChildren(stack, node);
		}
		return nodes;
	}

	private static void pushChildren(Deque<LightningTreeNode> stack, LightningTreeNode node) {
		for (int i = node.children.size() - 1; i >= 0; i--) {
			stack.push(node.children.get(i));
		}
	}

	/**
	 * @return the number of nodes in this sub-tree, this node included
	 */
	public int nodeCount() {
		return preOrder().size();
	}

	/**
	 * @return the number of edges on the longest path from this node to a leaf
	 */
	public int depth() {
		int depth = 0;
		List<LightningTreeNode> level = Collections.singletonList(this);
		while (true) {
			List<LightningTreeNode> next = new ArrayList<>();
			for (LightningTreeNode node : level) {
				next.addAll(node.children);
			}
			if (next.isEmpty()) {
				return depth;
			}
			depth++;
			level = next;
		}
	}

	/**
	 * Gets a weighted distance from an unsupported location to this node.
	 * <p>
	 * Not all nodes are equally good to attach to: within the supporting radius,
	 * nodes with more children get a valence boost that shrinks their distance,
	 * since attaching there consolidates support. The result grows with the
	 * Euclidean distance, never grows with the number of children, and equals the
	 * Euclidean distance for a leaf or for locations beyond the supporting radius.
	 *
	 * @param unsupportedLocation the location that needs support
	 * @param supportingRadius    the maximum distance that can be bridged without
	 *                            support
	 * @return the weighted distance
	 */
	public double getWeightedDistance(Coordinate unsupportedLocation, double supportingRadius) {
		double dist = location.distance(unsupportedLocation);
		if (dist > supportingRadius) {
			return dist;
		}
		int valence = Math.min(children.size(), LightningConstants.MAX_VALENCE_FOR_BOOST);
		return dist / (1 + LightningConstants.VALENCE_BOOST * valence);
	}

	/**
	 * Copies this node and its entire sub-tree. Every node of the copy keeps the
	 * grounding location of its original; the copied root falls back to its own
	 * location when it has none.
	 *
	 * @return the root of the independent copy
	 */
	public LightningTreeNode deepCopy() {
		LightningTreeNode localRoot = new LightningTreeNode(location, lastGroundingLocation);
		if (localRoot.lastGroundingLocation == null && isRoot()) {
			localRoot.lastGroundingLocation = new Coordinate(location.x, location.y);
		}
		Deque<Pair<LightningTreeNode, LightningTreeNode>> stack = new ArrayDeque<>();
		stack.push(Pair.of(this, localRoot));
		while (!stack.isEmpty()) {
			Pair<LightningTreeNode, LightningTreeNode> pair = stack.pop();
			LightningTreeNode original = pair.getLeft();
			LightningTreeNode copy = pair.getRight();
			for (LightningTreeNode child : original.children) {
				LightningTreeNode childCopy = new LightningTreeNode(child.location, child.lastGroundingLocation);
				childCopy.parent = copy;
				copy.children.add(childCopy);
				stack.push(Pair.of(child, childCopy));
			}
		}
		return localRoot;
	}

	private void checkDepth() {
		int depth = depth();
		if (depth > LightningConstants.MAX_TREE_DEPTH) {
			throw new IllegalStateException("Tree depth " + depth + " exceeds the supported maximum of " + LightningConstants.MAX_TREE_DEPTH);
		}
	}

	/**
	 * Propagates this node's sub-tree to the next layer, snapping nodes at most
	 * {@link LightningConstants#MAX_SNAP_DISTANCE} away from the next boundary.
	 *
	 * @see #propagateToNextLayer(List, Geometry, OutlineLocator, double, double,
	 *      double, double)
	 */
	public void propagateToNextLayer(List<LightningTreeNode> nextTrees, Geometry nextOutlines, OutlineLocator outlineLocator, double pruneDistance,
			double smoothMagnitude, double maxRemoveColinearDist) {
		propagateToNextLayer(nextTrees, nextOutlines, outlineLocator, pruneDistance, smoothMagnitude, maxRemoveColinearDist,
				LightningConstants.MAX_SNAP_DISTANCE);
	}

	/**
	 * Propagates this node's sub-tree to the next layer.
	 * <p>
	 * A copy of the sub-tree is realigned to the next layer's boundary, which may
	 * split it into several trees, then every resulting tree is straightened and
	 * pruned and appended to {@code nextTrees}. This tree is left untouched.
	 *
	 * @param nextTrees             receives the trees of the next layer
	 * @param nextOutlines          the infill area of the next layer
	 * @param outlineLocator        locator built over {@code nextOutlines}
	 * @param pruneDistance         the path length pruned from the extremities of
	 *                              each tree
	 * @param smoothMagnitude       the maximum distance a node may be moved while
	 *                              straightening
	 * @param maxRemoveColinearDist the maximum distance from a straight segment at
	 *                              which straightening may remove a node
	 * @param maxSnapDistance       the maximum distance a node outside the next
	 *                              boundary may be moved to get back inside
	 */
	public void propagateToNextLayer(List<LightningTreeNode> nextTrees, Geometry nextOutlines, OutlineLocator outlineLocator, double pruneDistance,
			double smoothMagnitude, double maxRemoveColinearDist, double maxSnapDistance) {
		Objects.requireNonNull(nextTrees, "Next trees cannot be null");
		Objects.requireNonNull(nextOutlines, "Next outlines cannot be null");
		Objects.requireNonNull(outlineLocator, "Outline locator cannot be null");
		checkDepth();

		LightningTreeNode treeBelow = deepCopy();
		List<LightningTreeNode> rerootedParts = new ArrayList<>();
		boolean rootKept = treeBelow.realign(nextOutlines, outlineLocator, maxSnapDistance, rerootedParts, true);

		List<LightningTreeNode> resulting = new ArrayList<>(rerootedParts.size() + 1);
		if (rootKept) {
			resulting.add(treeBelow);
		}
		resulting.addAll(rerootedParts);

		for (LightningTreeNode tree : resulting) {
			tree.straighten(smoothMagnitude, tree.getLocation(), 0, maxRemoveColinearDist, outlineLocator);
			tree.pruneRecursive(pruneDistance, outlineLocator);
		}
		nextTrees.addAll(resulting);
		LOGGER.debug("Propagated tree at {} into {} tree(s), root {}", location, resulting.size(), rootKept ? "kept" : "discarded");
	}

	/**
	 * Reconnects this (copied) tree to the boundary of the next layer.
	 * <p>
	 * A node inside the boundary stays. A non-root node outside is snapped back
	 * inside when that takes at most {@code maxSnapDistance}. Any other node outside
	 * is discarded: each of its child branches is realigned on its own and, if it
	 * survives, becomes a new root in {@code rerootedParts}. A surviving child
	 * whose edge to this node leaves the boundary is severed the same way.
	 *
	 * @param asRoot whether this node is (or is about to become) a root; roots
	 *               are never snapped
	 * @return whether this node is kept; if not, its children have been moved to
	 *         {@code rerootedParts} or dropped
	 */
	boolean realign(Geometry outlines, OutlineLocator outlineLocator, double maxSnapDistance, List<LightningTreeNode> rerootedParts,
			boolean asRoot) {
		if (outlines.isEmpty() || outlineLocator.isEmpty()) {
			return false;
		}

		boolean keep = outlineLocator.isInside(location);
		if (!keep && !asRoot) {
			Coordinate moved = outlineLocator.moveInside(location);
			if (moved != null && moved.distance(location) <= maxSnapDistance) {
				LOGGER.trace("Snapped node {} to {}", location, moved);
				location = moved;
				keep = true;
			}
		}

		if (keep) {
			boolean regroundMe = false;
			Iterator<LightningTreeNode> it = children.iterator();
			while (it.hasNext()) {
				LightningTreeNode child = it.next();
				boolean connectBranch = child.realign(outlines, outlineLocator, maxSnapDistance, rerootedParts, false);
				if (connectBranch && outlineLocator.crossesBoundary(location, child.location)) {
					child.lastGroundingLocation = null;
					child.parent = null;
					rerootedParts.add(child);
					regroundMe = true;
					it.remove();
				} else if (!connectBranch) {
					child.lastGroundingLocation = null;
					child.parent = null;
					it.remove();
				}
			}
			if (regroundMe) {
				lastGroundingLocation = null;
			}
			return true;
		}

		// lift any descendants out of this tree
		for (LightningTreeNode child : children) {
			boolean childKept = child.realign(outlines, outlineLocator, maxSnapDistance, rerootedParts, true);
			child.parent = null;
			if (childKept) {
				child.lastGroundingLocation = new Coordinate(location.x, location.y);
				rerootedParts.add(child);
			}
		}
		LOGGER.debug("Discarded node {} outside the next boundary, {} branch(es) lifted", location, children.size());
		children.clear();
		return false;
	}

	/**
	 * Smoothens the tree so it is more printable, while still supporting the trees
	 * above. Nodes between two junctions are moved towards the straight line
	 * connecting the junctions, and nodes that end up (nearly) on the line between
	 * their neighbours are removed.
	 *
	 * @param magnitude             the maximum distance a node may be moved
	 * @param maxRemoveColinearDist nodes closer than this to the segment between
	 *                              their parent and child are removed
	 */
	public void straighten(double magnitude, double maxRemoveColinearDist) {
		checkDepth();
		straighten(magnitude, location, 0, maxRemoveColinearDist, null);
	}

	/**
	 * Recursive part of {@link #straighten(double, double)}.
	 *
	 * @param junctionAbove   the last junction seen above
	 * @param accumulatedDist the path length from that junction to this node
	 * @param guard           if non-null, moves and removals are only applied when
	 *                        the result stays inside its boundary
	 * @return the location of the next junction below and the total path length
	 *         from the junction above to it
	 */
	private Pair<Coordinate, Double> straighten(double magnitude, Coordinate junctionAbove, double accumulatedDist, double maxRemoveColinearDist,
			OutlineLocator guard) {
		if (children.size() == 1) {
			LightningTreeNode child = children.get(0);
			double childDist = location.distance(child.location);
			Pair<Coordinate, Double> junctionBelow = child.straighten(magnitude, junctionAbove, accumulatedDist + childDist, maxRemoveColinearDist, guard);

			Coordinate a = junctionAbove;
			Coordinate b = junctionBelow.getLeft();
			if (magnitude > 0 && !GeometryUtils.equals2D(a, b)) {
				double totalDist = Math.max(1, junctionBelow.getRight());
				Coordinate destination = GeometryUtils.interpolate(a, b, accumulatedDist / totalDist);
				Coordinate target;
				if (location.distance(destination) <= magnitude) {
					target = GeometryUtils.round(destination, GeometryUtils.INTEGER_PRECISION);
				} else {
					target = GeometryUtils.moveTowards(location, destination, magnitude, GeometryUtils.INTEGER_PRECISION);
				}
				if (canMoveTo(target, guard)) {
					location = target;
				}
			}

			child = children.get(0); // the recursion may have replaced the child
			if (parent != null && maxRemoveColinearDist > 0
					&& GeometryUtils.distanceToSegment(location, parent.location, child.location) < maxRemoveColinearDist
					&& (guard == null || !guard.crossesBoundary(parent.location, child.location))) {
				removeFromChain(child);
			}
			return junctionBelow;
		}

		final double junctionMagnitude = magnitude * LightningConstants.JUNCTION_MAGNITUDE_FACTOR;
		Vector2D junctionMovingDir = GeometryUtils.normal(location, junctionAbove, JUNCTION_DIRECTION_WEIGHT);
		boolean preventJunctionMoving = false;
		for (int i = 0; i < children.size(); i++) {
			LightningTreeNode child = children.get(i);
			double childDist = location.distance(child.location);
			Pair<Coordinate, Double> below = child.straighten(magnitude, location, childDist, maxRemoveColinearDist, guard);

			junctionMovingDir = junctionMovingDir.add(GeometryUtils.normal(location, below.getLeft(), JUNCTION_DIRECTION_WEIGHT));
			if (below.getRight() < magnitude) {
				// moving would fight the straightening of the short branch
				preventJunctionMoving = true;
			}
		}
		double dirLength = junctionMovingDir.length();
		if (junctionMagnitude > 0 && dirLength > LightningConstants.ZERO_DIST && !children.isEmpty() && !isRoot() && !preventJunctionMoving) {
			Vector2D step = junctionMovingDir.multiply(Math.min(dirLength, junctionMagnitude) / dirLength);
			Coordinate target = GeometryUtils.round(step.translate(location), GeometryUtils.INTEGER_PRECISION);
			if (canMoveTo(target, guard)) {
				location = target;
			}
		}
		return Pair.of(location, accumulatedDist);
	}

	/**
	 * Replaces this degree-two node by its only child in the parent's children.
	 */
	private void removeFromChain(LightningTreeNode child) {
		int idx = parent.children.indexOf(this);
		parent.children.set(idx, child);
		child.parent = parent;
		parent = null;
		children.clear();
	}

	private boolean canMoveTo(Coordinate target, OutlineLocator guard) {
		if (guard == null) {
			return true;
		}
		if (!guard.isInside(target)) {
			return false;
		}
		if (parent != null && guard.crossesBoundary(parent.location, target)) {
			return false;
		}
		for (LightningTreeNode child : children) {
			if (guard.crossesBoundary(target, child.location)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Rounds {@code exact} to the integer grid. If the rounded point is not a valid
	 * new location for this node, the other three grid corners around
	 * {@code exact} are tried, nearest first.
	 *
	 * @return a grid point this node may move to, or null if there is none
	 */
	private Coordinate gridPointInside(Coordinate exact, OutlineLocator guard) {
		Coordinate rounded = GeometryUtils.round(exact, GeometryUtils.INTEGER_PRECISION);
		if (canMoveTo(rounded, guard)) {
			return rounded;
		}
		List<Coordinate> corners = new ArrayList<>(4);
		for (double x : new double[] { Math.floor(exact.x), Math.ceil(exact.x) }) {
			for (double y : new double[] { Math.floor(exact.y), Math.ceil(exact.y) }) {
				Coordinate corner = new Coordinate(x, y);
				if (!corner.equals2D(rounded) && !corners.contains(corner)) {
					corners.add(corner);
				}
			}
		}
		corners.sort(Comparator.comparingDouble(exact::distance));
		for (Coordinate corner : corners) {
			if (canMoveTo(corner, guard)) {
				return corner;
			}
		}
		LOGGER.trace("No grid point inside the boundary near {}, leaf {} kept in place", exact, location);
		return null;
	}

	/**
	 * Prunes the tree from its extremities. Every branch is shortened by up to
	 * {@code distance}, branches are handled independently in children order. A
	 * leaf whose edge fits in the remaining budget is removed and pruning continues
	 * from its parent; otherwise the leaf moves towards its parent by the remaining
	 * budget.
	 *
	 * @param distance the path length to prune
	 * @return the distance pruned; less than {@code distance} only if the whole
	 *         tree below this node was pruned away
	 */
	public double prune(double distance) {
		checkDepth();
		return pruneRecursive(distance, null);
	}

	/**
	 * Recursive part of {@link #prune(double)}.
	 *
	 * @param guard if non-null, a shortened leaf is only placed on grid points
	 *              inside its boundary
	 */
	private double pruneRecursive(double distance, OutlineLocator guard) {
		if (distance <= 0) {
			return 0;
		}

		double maxDistancePruned = 0;
		Iterator<LightningTreeNode> it = children.iterator();
		while (it.hasNext()) {
			LightningTreeNode child = it.next();
			double distPrunedChild = child.pruneRecursive(distance, guard);
			if (distPrunedChild >= distance) {
				// pruning finished inside the child's branch
				maxDistancePruned = Math.max(maxDistancePruned, distPrunedChild);
				continue;
			}
			double edgeLength = location.distance(child.location);
			if (distPrunedChild + edgeLength <= distance) {
				maxDistancePruned = Math.max(maxDistancePruned, distPrunedChild + edgeLength);
				child.parent = null;
				it.remove();
			} else {
				// pruning stops between this node and the child
				Vector2D step = GeometryUtils.normal(child.location, location, distance - distPrunedChild);
				Coordinate target = child.gridPointInside(step.translate(child.location), guard);
				if (target != null) {
					child.location = target;
				}
				maxDistancePruned = distance;
			}
		}
		return maxDistancePruned;
	}

	/**
	 * Converts the tree into polylines, continuing through each junction with its
	 * first child.
	 *
	 * @see #convertToPolylines(List, double, BranchContinuation)
	 */
	public void convertToPolylines(List<LineString> output, double lineWidth) {
		convertToPolylines(output, lineWidth, BranchContinuation.FIRST_CHILD);
	}

	/**
	 * Converts the tree into polylines. Each polyline starts at a leaf and ends at a
	 * junction or the root; every edge of the tree ends up in exactly one
	 * polyline. Polyline ends meeting other polylines at a junction are shortened
	 * by half the line width so the junction is not over-extruded.
	 *
	 * @param output       receives the polylines
	 * @param lineWidth    the width of the printed lines; zero or less disables
	 *                     the shortening
	 * @param continuation which branch continues a polyline through a junction
	 */
	public void convertToPolylines(List<LineString> output, double lineWidth, BranchContinuation continuation) {
		Objects.requireNonNull(continuation, "Branch continuation cannot be null");
		checkDepth();
		List<List<Coordinate>> lines = new ArrayList<>();
		lines.add(new ArrayList<>());
		convertToPolylines(0, lines, continuation);
		removeJunctionOverlap(lines, lineWidth);
		for (List<Coordinate> line : lines) {
			output.add(GEOMETRY_FACTORY.createLineString(line.toArray(new Coordinate[0])));
		}
	}

	/**
	 * Recursive part of
	 * {@link #convertToPolylines(List, double, BranchContinuation)}.
	 *
	 * @param longLineIdx index of the line in {@code output} to continue
	 */
	private void convertToPolylines(int longLineIdx, List<List<Coordinate>> output, BranchContinuation continuation) {
		if (children.isEmpty()) {
			output.get(longLineIdx).add(new Coordinate(location.x, location.y));
			return;
		}
		int firstChildIdx = continuation.select(this);
		children.get(firstChildIdx).convertToPolylines(longLineIdx, output, continuation);
		output.get(longLineIdx).add(new Coordinate(location.x, location.y));

		for (int offset = 1; offset < children.size(); offset++) {
			LightningTreeNode child = children.get((firstChildIdx + offset) % children.size());
			output.add(new ArrayList<>());
			int childLineIdx = output.size() - 1;
			child.convertToPolylines(childLineIdx, output, continuation);
			output.get(childLineIdx).add(new Coordinate(location.x, location.y));
		}
	}

	/**
	 * Shortens the end of every polyline whose end point is shared with another
	 * polyline by up to half the line width, and drops polylines with fewer than
	 * two points.
	 */
	static void removeJunctionOverlap(List<List<Coordinate>> polylines, double lineWidth) {
		polylines.removeIf(line -> line.size() <= 1);
		if (lineWidth <= 0) {
			return;
		}
		final double reduction = lineWidth / 2;

		Map<Coordinate, Integer> touching = new HashMap<>();
		for (List<Coordinate> line : polylines) {
			Set<Coordinate> distinct = new HashSet<>(line);
			for (Coordinate c : distinct) {
				touching.merge(c, 1, Integer::sum);
			}
		}

		Iterator<List<Coordinate>> it = polylines.iterator();
		while (it.hasNext()) {
			List<Coordinate> line = it.next();
			if (touching.get(line.get(line.size() - 1)) < 2) {
				continue;
			}
			double toBeReduced = reduction;
			Coordinate a = line.get(line.size() - 1);
			for (int pointIdx = line.size() - 2; pointIdx >= 0; pointIdx--) {
				Coordinate b = line.get(pointIdx);
				double abLength = a.distance(b);
				if (abLength >= toBeReduced) {
					Coordinate end = GeometryUtils.round(GeometryUtils.interpolate(a, b, toBeReduced / abLength), GeometryUtils.INTEGER_PRECISION);
					line.set(line.size() - 1, end);
					break;
				}
				toBeReduced -= abLength;
				line.remove(line.size() - 1);
				a = b;
			}
			if (line.size() <= 1) {
				it.remove();
			}
		}
	}

	@Override
	public String toString() {
		return "LightningTreeNode{(" + location.x + ", " + location.y + "), children=" + children.size() + (isRoot() ? ", root" : "") + '}';
	}
}
