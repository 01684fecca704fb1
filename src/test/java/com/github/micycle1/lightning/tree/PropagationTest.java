package com.github.micycle1.lightning.tree;

import static com.github.micycle1.lightning.tree.TreeTestUtils.c;
import static com.github.micycle1.lightning.tree.TreeTestUtils.isConsistent;
import static com.github.micycle1.lightning.tree.TreeTestUtils.nodesOf;
import static com.github.micycle1.lightning.tree.TreeTestUtils.undirectedEdges;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.lightning.locator.OutlineLocator;
import com.github.micycle1.lightning.locator.SparseLineGridLocator;

class PropagationTest {

	private static final String SQUARE = "POLYGON ((0 0, 10000 0, 10000 10000, 0 10000, 0 0))";
	private static final String TWO_ISLANDS = "MULTIPOLYGON (((1000 1000, 5000 1000, 5000 5000, 1000 5000, 1000 1000)),"
			+ " ((-5000 1000, -1000 1000, -1000 5000, -5000 5000, -5000 1000)))";
	// two arms joined at the bottom, the gap between them is outside
	private static final String U_SHAPE = "POLYGON ((0 0, 10000 0, 10000 10000, 6000 10000, 6000 2000, 4000 2000, 4000 10000, 0 10000, 0 0))";
	private static final String FRAME = "POLYGON ((20000 20000, 80000 20000, 80000 80000, 20000 80000, 20000 20000),"
			+ " (40000 40000, 40000 60000, 60000 60000, 60000 40000, 40000 40000))";

	private final WKTReader reader = new WKTReader();

	private Geometry read(String wkt) {
		try {
			return reader.read(wkt);
		} catch (ParseException e) {
			throw new IllegalArgumentException(e);
		}
	}

	private static List<LightningTreeNode> propagate(LightningTreeNode tree, Geometry outlines, double prune, double smooth, double colinear,
			double snap) {
		List<LightningTreeNode> next = new ArrayList<>();
		OutlineLocator locator = new SparseLineGridLocator(outlines);
		tree.propagateToNextLayer(next, outlines, locator, prune, smooth, colinear, snap);
		return next;
	}

	@Test
	void treeInsideBoundaryIsCopiedUnchanged() {
		LightningTreeNode root = LightningTreeNode.create(c(5000, 1000));
		root.addChild(c(5000, 3000)).addChild(c(7000, 5000));
		root.addChild(c(2000, 2000));

		List<LightningTreeNode> next = propagate(root, read(SQUARE), 0, 0, 0, 2000);

		assertEquals(1, next.size());
		assertNotSame(root, next.get(0));
		assertEquals(undirectedEdges(root), undirectedEdges(next.get(0)));
		assertTrue(isConsistent(next.get(0)));
	}

	@Test
	void rootOutsideSplitsTreeIntoItsChildren() {
		LightningTreeNode root = LightningTreeNode.create(c(500, 500));
		root.addChild(c(2000, 2000)).addChild(c(3000, 3000));
		root.addChild(c(-2000, 2000));

		List<LightningTreeNode> next = propagate(root, read(TWO_ISLANDS), 0, 0, 0, 2000);

		assertEquals(2, next.size());
		assertEquals(c(2000, 2000), next.get(0).getLocation());
		assertEquals(2, next.get(0).nodeCount());
		assertEquals(c(-2000, 2000), next.get(1).getLocation());
		for (LightningTreeNode tree : next) {
			assertTrue(tree.isRoot());
			// lifted branches remember where the discarded root was
			assertEquals(c(500, 500), tree.getLastGroundingLocation().orElseThrow());
		}
	}

	@Test
	void splitIntoTwoSingleNodeTrees() {
		LightningTreeNode root = LightningTreeNode.create(c(500, 500));
		root.addChild(c(3000, 3000));
		root.addChild(c(-3000, 3000));

		List<LightningTreeNode> next = propagate(root, read(TWO_ISLANDS), 0, 0, 0, 2000);

		assertEquals(2, next.size());
		for (LightningTreeNode tree : next) {
			assertEquals(1, tree.nodeCount());
			assertNotSame(root, tree);
			assertTrue(!tree.getLocation().equals2D(c(500, 500)));
		}
	}

	@Test
	void emptyBoundaryGivesNoTrees() {
		LightningTreeNode root = LightningTreeNode.create(c(0, 0));
		root.addChild(c(10, 10));

		assertTrue(propagate(root, read("POLYGON EMPTY"), 0, 0, 0, 2000).isEmpty());
	}

	@Test
	void originalTreeIsLeftUntouched() {
		LightningTreeNode root = LightningTreeNode.create(c(500, 500));
		LightningTreeNode a = root.addChild(c(2000, 2000));
		a.addChild(c(4900, 2100)).addChild(c(3000, 4000));
		root.addChild(c(-2000, 2000));
		List<String> before = undirectedEdges(root);

		propagate(root, read(TWO_ISLANDS), 500, 300, 100, 2000);

		assertEquals(before, undirectedEdges(root));
		assertTrue(isConsistent(root));
	}

	@Test
	void nodeJustOutsideIsSnappedBackInside() {
		LightningTreeNode root = LightningTreeNode.create(c(5000, 5000));
		root.addChild(c(5000, 10500));

		List<LightningTreeNode> next = propagate(root, read(SQUARE), 0, 0, 0, 2000);

		assertEquals(1, next.size());
		LightningTreeNode child = next.get(0).getChildren().get(0);
		assertEquals(c(5000, 9998), child.getLocation());
	}

	@Test
	void nodeFarOutsideIsDiscarded() {
		LightningTreeNode root = LightningTreeNode.create(c(5000, 5000));
		root.addChild(c(5000, 13000));

		List<LightningTreeNode> next = propagate(root, read(SQUARE), 0, 0, 0, 2000);

		assertEquals(1, next.size());
		assertTrue(next.get(0).getChildren().isEmpty());
	}

	@Test
	void edgeLeavingTheBoundaryIsSevered() {
		LightningTreeNode root = LightningTreeNode.create(c(2000, 8000));
		root.addChild(c(8000, 8000)).addChild(c(8000, 9000));

		List<LightningTreeNode> next = propagate(root, read(U_SHAPE), 0, 0, 0, 2000);

		assertEquals(2, next.size());
		assertEquals(c(2000, 8000), next.get(0).getLocation());
		assertTrue(next.get(0).getChildren().isEmpty());
		assertEquals(c(8000, 8000), next.get(1).getLocation());
		assertEquals(2, next.get(1).nodeCount());
		assertTrue(next.get(1).getLastGroundingLocation().isEmpty());
	}

	@Test
	void propagatedNodesStayInside() {
		Geometry frame = read(FRAME);
		OutlineLocator locator = new SparseLineGridLocator(frame);
		Random random = new Random(42);
		for (int t = 0; t < 5; t++) {
			LightningTreeNode root = LightningTreeNode.create(c(20000 + random.nextInt(60000), 20000 + random.nextInt(60000)));
			List<LightningTreeNode> all = new ArrayList<>(List.of(root));
			for (int i = 0; i < 100; i++) {
				LightningTreeNode parent = all.get(random.nextInt(all.size()));
				Coordinate p = parent.getLocation();
				all.add(parent.addChild(c(p.x + random.nextInt(8001) - 4000, p.y + random.nextInt(8001) - 4000)));
			}

			List<LightningTreeNode> next = new ArrayList<>();
			root.propagateToNextLayer(next, frame, locator, 200, 300, 100, 2000);

			for (LightningTreeNode tree : next) {
				assertTrue(isConsistent(tree));
				for (LightningTreeNode node : nodesOf(tree)) {
					Coordinate p = node.getLocation();
					assertTrue(locator.isInside(p), "Node outside: " + p);
				}
			}
		}
	}

	@Test
	void prunedLeafAlongDiagonalWallStaysInside() {
		// the wall runs along y = x / 3, just above the edge
		Geometry triangle = read("POLYGON ((0 0, 3000 0, 3000 1000, 0 0))");
		OutlineLocator locator = new SparseLineGridLocator(triangle);
		for (int prune = 1; prune <= 3000; prune += 7) {
			LightningTreeNode root = LightningTreeNode.create(c(0, 0));
			root.addChild(c(2999, 999));

			List<LightningTreeNode> next = new ArrayList<>();
			root.propagateToNextLayer(next, triangle, locator, prune, 0, 0, 2000);

			assertEquals(1, next.size());
			LightningTreeNode leaf = next.get(0).getChildren().get(0);
			Coordinate p = leaf.getLocation();
			assertTrue(locator.isInside(p), "Pruned by " + prune + " to " + p);
			// the leaf still moved by the prune distance, give or take the grid
			assertEquals(Math.hypot(2999, 999) - prune, p.distance(c(0, 0)), 1.5);
		}
	}

	@Test
	void nullArgumentsAreRejected() {
		LightningTreeNode root = LightningTreeNode.create(c(0, 0));
		Geometry square = read(SQUARE);
		OutlineLocator locator = new SparseLineGridLocator(square);
		assertThrows(NullPointerException.class, () -> root.propagateToNextLayer(null, square, locator, 0, 0, 0));
		assertThrows(NullPointerException.class, () -> root.propagateToNextLayer(new ArrayList<>(), square, null, 0, 0, 0));
	}
}
