package com.github.micycle1.coordflat.cluster;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.TestPoints;

public class KMeans2DTest {

	private static PointSet blobs(long seed) {
		double[][] centres = { { 0.2, 0.2 }, { 0.8, 0.2 }, { 0.5, 0.8 } };
		Random rnd = new Random(seed);
		double[] x = new double[300];
		double[] y = new double[300];
		for (int i = 0; i < 300; i++) {
			double[] c = centres[i % 3];
			x[i] = c[0] + 0.03 * rnd.nextGaussian();
			y[i] = c[1] + 0.03 * rnd.nextGaussian();
		}
		return new PointSet("blobs", x, y);
	}

	@Test
	void separatesWellSpacedBlobs() {
		PointSet p = blobs(1);
		KMeans2D.Clustering c = new KMeans2D(42, 50, false).cluster(p, 3);
		assertEquals(3, c.clusterCount());
		for (int s : c.sizes) {
			assertEquals(100, s);
		}
		for (int i = 3; i < p.size(); i++) {
			assertEquals(c.labels[i % 3], c.labels[i]);
		}
	}

	@Test
	void sizesAndMembersAgree() {
		PointSet p = TestPoints.uniform("p", 1000, 2);
		KMeans2D.Clustering c = new KMeans2D(7, 50, false).cluster(p, 12);
		int total = 0;
		for (int k = 0; k < c.clusterCount(); k++) {
			int[] m = c.members(k);
			assertEquals(c.sizes[k], m.length);
			for (int i : m) {
				assertEquals(k, c.labels[i]);
			}
			total += m.length;
		}
		assertEquals(1000, total);
		assertTrue(c.maxSize() < 1000);
		assertTrue(c.iterations >= 1 && c.iterations <= 50);
	}

	@Test
	void centresAreMeansOfMembers() {
		PointSet p = TestPoints.uniform("p", 500, 3);
		KMeans2D.Clustering c = new KMeans2D(1, 200, false).cluster(p, 5);
		for (int k = 0; k < 5; k++) {
			double sx = 0, sy = 0;
			for (int i : c.members(k)) {
				sx += p.x(i);
				sy += p.y(i);
			}
			assertEquals(sx / c.sizes[k], c.centersX[k], 1e-9);
			assertEquals(sy / c.sizes[k], c.centersY[k], 1e-9);
		}
	}

	@Test
	void deterministicAndParallelInvariant() {
		PointSet p = TestPoints.cornerCluster("p", 9000, 1000, 0.3, 4);
		KMeans2D.Clustering a = new KMeans2D(5, 30, false).cluster(p, 20);
		KMeans2D.Clustering b = new KMeans2D(5, 30, true).cluster(p, 20);
		assertArrayEquals(a.labels, b.labels);
		assertArrayEquals(a.centersX, b.centersX, 0);
	}

	@Test
	void rejectsBadK() {
		PointSet p = TestPoints.uniform("p", 10, 1);
		KMeans2D km = new KMeans2D(1, 10, false);
		assertThrows(IllegalArgumentException.class, () -> km.cluster(p, 0));
		assertThrows(IllegalArgumentException.class, () -> km.cluster(p, 11));
		assertThrows(IllegalArgumentException.class, () -> new KMeans2D(1, 0, false));
	}
}
