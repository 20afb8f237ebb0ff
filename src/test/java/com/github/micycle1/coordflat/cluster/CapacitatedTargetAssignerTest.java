package com.github.micycle1.coordflat.cluster;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.TestPoints;
import com.github.micycle1.coordflat.target.HaltonTargets;

public class CapacitatedTargetAssignerTest {

	@ParameterizedTest
	@ValueSource(longs = { 1L, 42L, 2024L })
	void countsMatchCapacities(long seed) {
		PointSet pts = TestPoints.cornerCluster("p", 800, 200, 0.25, seed);
		KMeans2D.Clustering c = new KMeans2D(seed, 50, false).cluster(pts, 15);
		PointSet targets = new HaltonTargets(2, 3).generate(pts.size(), 0.02);

		int[] labels = CapacitatedTargetAssigner.assign(targets, c.centersX, c.centersY, c.sizes);
		assertEquals(targets.size(), labels.length);
		int[] counts = new int[c.clusterCount()];
		for (int l : labels) {
			counts[l]++;
		}
		assertArrayEquals(c.sizes, counts);
	}

	@Test
	void uncontestedTargetsGoToNearestCentre() {
		PointSet targets = new PointSet("t", new double[] { 0.1, 0.9, 0.12, 0.88 }, new double[] { 0.1, 0.9, 0.1, 0.9 });
		int[] labels = CapacitatedTargetAssigner.assign(targets, new double[] { 0.0, 1.0 }, new double[] { 0.0, 1.0 }, new int[] { 2, 2 });
		assertArrayEquals(new int[] { 0, 1, 0, 1 }, labels);
	}

	@Test
	void overflowGoesToNextNearest() {
		// three targets near centre 0, which only has room for one
		PointSet targets = new PointSet("t", new double[] { 0.1, 0.2, 0.3 }, new double[] { 0.5, 0.5, 0.5 });
		int[] labels = CapacitatedTargetAssigner.assign(targets, new double[] { 0.0, 0.5, 1.0 }, new double[] { 0.5, 0.5, 0.5 },
				new int[] { 1, 1, 1 });
		// centre 0 keeps its closest bidder
		assertEquals(0, labels[0]);
		int[] counts = new int[3];
		for (int l : labels) {
			counts[l]++;
		}
		assertArrayEquals(new int[] { 1, 1, 1 }, counts);
	}

	@Test
	void zeroCapacityClusterGetsNothing() {
		PointSet targets = TestPoints.uniform("t", 50, 3);
		int[] labels = CapacitatedTargetAssigner.assign(targets, new double[] { 0.5, 0.25, 0.75 }, new double[] { 0.5, 0.25, 0.75 },
				new int[] { 20, 0, 30 });
		for (int l : labels) {
			assertNotEquals(1, l);
		}
	}

	@Test
	void rejectsCapacityMismatch() {
		PointSet targets = TestPoints.uniform("t", 10, 1);
		assertThrows(IllegalArgumentException.class,
				() -> CapacitatedTargetAssigner.assign(targets, new double[] { 0.5 }, new double[] { 0.5 }, new int[] { 9 }));
		assertThrows(IllegalArgumentException.class,
				() -> CapacitatedTargetAssigner.assign(targets, new double[] { 0.5, 0.2 }, new double[] { 0.5, 0.2 }, new int[] { 11, -1 }));
	}
}
