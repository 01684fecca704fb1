package com.github.micycle1.lightning.tree;

import static com.github.micycle1.lightning.tree.TreeTestUtils.c;
import static com.github.micycle1.lightning.tree.TreeTestUtils.randomTree;
import static com.github.micycle1.lightning.tree.TreeTestUtils.undirectedEdges;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

class PolylineConversionTest {

	private LightningTreeNode root;

	/*
	 * (0,0) -> (0,1000) -> (1000,1000)
	 *                   -> (0,2000)
	 */
	@BeforeEach
	void setUp() {
		root = LightningTreeNode.create(c(0, 0));
		LightningTreeNode j = root.addChild(c(0, 1000));
		j.addChild(c(1000, 1000));
		j.addChild(c(0, 2000));
	}

	private static List<LineString> convert(LightningTreeNode tree, double lineWidth, BranchContinuation continuation) {
		List<LineString> output = new ArrayList<>();
		tree.convertToPolylines(output, lineWidth, continuation);
		return output;
	}

	@Test
	void firstChildContinuesThePolyline() {
		List<LineString> lines = convert(root, 0, BranchContinuation.FIRST_CHILD);

		assertEquals(2, lines.size());
		assertArrayEquals(new Coordinate[] { c(1000, 1000), c(0, 1000), c(0, 0) }, lines.get(0).getCoordinates());
		assertArrayEquals(new Coordinate[] { c(0, 2000), c(0, 1000) }, lines.get(1).getCoordinates());
	}

	@Test
	void lastChildContinuesThePolyline() {
		List<LineString> lines = convert(root, 0, BranchContinuation.LAST_CHILD);

		assertArrayEquals(new Coordinate[] { c(0, 2000), c(0, 1000), c(0, 0) }, lines.get(0).getCoordinates());
		assertArrayEquals(new Coordinate[] { c(1000, 1000), c(0, 1000) }, lines.get(1).getCoordinates());
	}

	@Test
	void straightestChildContinuesThePolyline() {
		List<LineString> lines = convert(root, 0, BranchContinuation.STRAIGHTEST);

		assertArrayEquals(new Coordinate[] { c(0, 2000), c(0, 1000), c(0, 0) }, lines.get(0).getCoordinates());
	}

	@Test
	void defaultContinuationIsFirstChild() {
		List<LineString> output = new ArrayList<>();
		root.convertToPolylines(output, 0);
		assertEquals(convert(root, 0, BranchContinuation.FIRST_CHILD), output);
	}

	@ParameterizedTest
	@EnumSource(BranchContinuation.class)
	void everyEdgeIsEmittedOnce(BranchContinuation continuation) {
		LightningTreeNode tree = randomTree(17, 150);
		List<LineString> lines = convert(tree, 0, continuation);

		assertEquals(undirectedEdges(tree), undirectedEdges(lines));
		for (LineString line : lines) {
			assertTrue(line.getNumPoints() >= 2);
		}
	}

	@Test
	void singleNodeGivesNoPolyline() {
		assertTrue(convert(LightningTreeNode.create(c(5, 5)), 400, BranchContinuation.FIRST_CHILD).isEmpty());
	}

	@Test
	void junctionEndsAreShortenedByHalfTheLineWidth() {
		List<LineString> lines = convert(root, 400, BranchContinuation.FIRST_CHILD);

		assertEquals(2, lines.size());
		// ends at the root, which no other polyline touches
		assertArrayEquals(new Coordinate[] { c(1000, 1000), c(0, 1000), c(0, 0) }, lines.get(0).getCoordinates());
		assertArrayEquals(new Coordinate[] { c(0, 2000), c(0, 1200) }, lines.get(1).getCoordinates());
	}

	@Test
	void shortenedPolylineMayLoseVertices() {
		List<List<Coordinate>> lines = new ArrayList<>();
		lines.add(new ArrayList<>(List.of(c(0, 1000), c(0, 0))));
		lines.add(new ArrayList<>(List.of(c(500, 100), c(100, 0), c(0, 0))));

		LightningTreeNode.removeJunctionOverlap(lines, 400);

		assertEquals(List.of(c(0, 1000), c(0, 200)), lines.get(0));
		// the first edge of 100 is used up, the remaining 100 comes off the next
		assertEquals(2, lines.get(1).size());
		assertEquals(c(500, 100), lines.get(1).get(0));
		Coordinate end = lines.get(1).get(1);
		assertEquals(100, end.distance(c(100, 0)), 1);
	}

	@Test
	void polylineShorterThanTheTrimIsDropped() {
		List<List<Coordinate>> lines = new ArrayList<>();
		lines.add(new ArrayList<>(List.of(c(0, 1000), c(0, 0))));
		lines.add(new ArrayList<>(List.of(c(50, 0), c(0, 0))));
		lines.add(new ArrayList<>(List.of(c(7, 7))));

		LightningTreeNode.removeJunctionOverlap(lines, 400);

		assertEquals(1, lines.size());
		assertEquals(List.of(c(0, 1000), c(0, 200)), lines.get(0));
	}
}
