package com.github.micycle1.coordflat.diagnostics;

import java.util.Arrays;
import java.util.Random;

import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.field.KdTree2D;

/**
 * Measures how well a deformation preserves local neighbourhoods.
 * <p>
 * For a seeded sample of point indices, the k nearest neighbours (excluding
 * the point itself) are found in the original and in the deformed layout,
 * each through its own {@link KdTree2D}, and {@code |common| / k} is averaged
 * over the sample. 1.0 means neighbourhoods are untouched (and density likely
 * unchanged); values near 0 mean local structure was scrambled.
 */
public final class CoherenceValidator {

	private final int k;
	private final int sampleSize;
	private final long seed;

	public CoherenceValidator(int k, int sampleSize, long seed) {
		if (k <= 0 || sampleSize <= 0) {
			throw new IllegalArgumentException("k and sampleSize must be positive");
		}
		this.k = k;
		this.sampleSize = sampleSize;
		this.seed = seed;
	}

	public double score(PointSet original, PointSet flattened) {
		final int n = original.size();
		if (flattened.size() != n) {
			throw new IllegalArgumentException("Layouts differ in size: " + n + " vs " + flattened.size());
		}
		if (n < 2) {
			throw new IllegalArgumentException("Need at least two points to compare neighbourhoods");
		}
		final int kk = Math.min(k, n - 1);
		final int[] sample = sample(n, Math.min(sampleSize, n));

		KdTree2D before = new KdTree2D(original);
		KdTree2D after = new KdTree2D(flattened);
		KdTree2D.Neighbours nb = new KdTree2D.Neighbours(kk);
		boolean[] mark = new boolean[n];

		double sum = 0;
		for (int idx : sample) {
			int found = before.nearest(original.x(idx), original.y(idx), kk, idx, nb);
			int[] orig = nb.indices();
			for (int j = 0; j < found; j++) {
				mark[orig[j]] = true;
			}
			found = after.nearest(flattened.x(idx), flattened.y(idx), kk, idx, nb);
			int common = 0;
			for (int j = 0; j < found; j++) {
				if (mark[nb.index(j)]) {
					common++;
				}
			}
			for (int o : orig) {
				mark[o] = false;
			}
			sum += (double) common / kk;
		}
		return sum / sample.length;
	}

	// first m entries of a seeded Fisher-Yates shuffle of [0, n)
	private int[] sample(int n, int m) {
		int[] all = new int[n];
		for (int i = 0; i < n; i++) {
			all[i] = i;
		}
		Random rnd = new Random(seed);
		for (int i = 0; i < m; i++) {
			int j = i + rnd.nextInt(n - i);
			int t = all[i];
			all[i] = all[j];
			all[j] = t;
		}
		return Arrays.copyOf(all, m);
	}
}
