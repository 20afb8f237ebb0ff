package com.github.micycle1.coordflat;

import java.util.Random;

/**
 * Synthetic layouts shared by the tests.
 */
public final class TestPoints {

	private TestPoints() {
	}

	public static PointSet uniform(String name, int n, long seed) {
		Random rnd = new Random(seed);
		double[] x = new double[n];
		double[] y = new double[n];
		for (int i = 0; i < n; i++) {
			x[i] = rnd.nextDouble();
			y[i] = rnd.nextDouble();
		}
		return new PointSet(name, x, y);
	}

	/**
	 * {@code dense} points uniform in {@code [0, side]^2}, then {@code sparse}
	 * points uniform over the rest of the unit square.
	 */
	public static PointSet cornerCluster(String name, int dense, int sparse, double side, long seed) {
		Random rnd = new Random(seed);
		double[] x = new double[dense + sparse];
		double[] y = new double[dense + sparse];
		for (int i = 0; i < dense; i++) {
			x[i] = side * rnd.nextDouble();
			y[i] = side * rnd.nextDouble();
		}
		int i = dense;
		while (i < dense + sparse) {
			double px = rnd.nextDouble();
			double py = rnd.nextDouble();
			if (px < side && py < side) {
				continue;
			}
			x[i] = px;
			y[i] = py;
			i++;
		}
		return new PointSet(name, x, y);
	}
}
