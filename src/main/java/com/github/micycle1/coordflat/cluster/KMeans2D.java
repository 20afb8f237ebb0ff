package com.github.micycle1.coordflat.cluster;

import java.util.Arrays;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.Chunks;
import com.github.micycle1.coordflat.PointSet;

/**
 * Lloyd's k-means on 2D points with k-means++ seeding.
 * <p>
 * Seeding draws from {@code new Random(seed)}, so a given input and seed always
 * yields the same clustering. A cluster that empties keeps its previous
 * centre. Iteration stops when no label changes or after
 * {@code maxIterations} rounds.
 */
public final class KMeans2D {

	private static final Logger LOG = LoggerFactory.getLogger(KMeans2D.class);

	private final long seed;
	private final int maxIterations;
	private final boolean parallel;

	public KMeans2D(long seed, int maxIterations, boolean parallel) {
		if (maxIterations <= 0) {
			throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
		}
		this.seed = seed;
		this.maxIterations = maxIterations;
		this.parallel = parallel;
	}

	/**
	 * Result of one clustering: a label per point, a centre and a size per
	 * cluster.
	 */
	public static final class Clustering {
		public final int[] labels;
		public final double[] centersX;
		public final double[] centersY;
		public final int[] sizes;
		public final int iterations;

		Clustering(int[] labels, double[] centersX, double[] centersY, int[] sizes, int iterations) {
			this.labels = labels;
			this.centersX = centersX;
			this.centersY = centersY;
			this.sizes = sizes;
			this.iterations = iterations;
		}

		public int clusterCount() {
			return sizes.length;
		}

		public int maxSize() {
			int max = 0;
			for (int s : sizes) {
				max = Math.max(max, s);
			}
			return max;
		}

		/** Point indices of cluster {@code c}, ascending. */
		public int[] members(int c) {
			int[] out = new int[sizes[c]];
			int j = 0;
			for (int i = 0; i < labels.length; i++) {
				if (labels[i] == c) {
					out[j++] = i;
				}
			}
			return out;
		}
	}

	public Clustering cluster(PointSet points, int k) {
		final int n = points.size();
		if (k <= 0 || k > n) {
			throw new IllegalArgumentException("k must be in [1, " + n + "], got " + k);
		}
		final double[] cx = new double[k];
		final double[] cy = new double[k];
		seedPlusPlus(points, cx, cy);

		final int[] labels = new int[n];
		Arrays.fill(labels, -1);
		final int[] sizes = new int[k];
		final double[] sumX = new double[k];
		final double[] sumY = new double[k];

		int iter = 0;
		boolean changed = true;
		while (changed && iter < maxIterations) {
			changed = assign(points, cx, cy, labels);
			iter++;

			Arrays.fill(sizes, 0);
			Arrays.fill(sumX, 0.0);
			Arrays.fill(sumY, 0.0);
			for (int i = 0; i < n; i++) {
				int c = labels[i];
				sizes[c]++;
				sumX[c] += points.x(i);
				sumY[c] += points.y(i);
			}
			for (int c = 0; c < k; c++) {
				if (sizes[c] > 0) {
					cx[c] = sumX[c] / sizes[c];
					cy[c] = sumY[c] / sizes[c];
				}
			}
		}
		LOG.debug("k-means k={} finished after {} iterations (converged={})", k, iter, !changed);
		return new Clustering(labels, cx, cy, sizes, iter);
	}

	// k-means++: each further centre is drawn with probability proportional to
	// its squared distance from the nearest centre chosen so far.
	private void seedPlusPlus(PointSet points, double[] cx, double[] cy) {
		final int n = points.size();
		final Random rnd = new Random(seed);
		final double[] d2 = new double[n];
		Arrays.fill(d2, Double.POSITIVE_INFINITY);

		int first = rnd.nextInt(n);
		cx[0] = points.x(first);
		cy[0] = points.y(first);

		for (int c = 1; c < cx.length; c++) {
			double sum = 0;
			for (int i = 0; i < n; i++) {
				double dx = points.x(i) - cx[c - 1];
				double dy = points.y(i) - cy[c - 1];
				double d = dx * dx + dy * dy;
				if (d < d2[i]) {
					d2[i] = d;
				}
				sum += d2[i];
			}
			int pick;
			if (sum <= 0) {
				pick = rnd.nextInt(n);
			} else {
				double r = rnd.nextDouble() * sum;
				pick = n - 1;
				double acc = 0;
				for (int i = 0; i < n; i++) {
					acc += d2[i];
					if (acc > r) {
						pick = i;
						break;
					}
				}
			}
			cx[c] = points.x(pick);
			cy[c] = points.y(pick);
		}
	}

	private boolean assign(PointSet points, double[] cx, double[] cy, int[] labels) {
		final int k = cx.length;
		final boolean[] chunkChanged = new boolean[(points.size() + Chunks.CHUNK - 1) / Chunks.CHUNK];
		Chunks.forEach(points.size(), parallel, (from, to) -> {
			boolean any = false;
			for (int i = from; i < to; i++) {
				double px = points.x(i);
				double py = points.y(i);
				int best = 0;
				double bestD = Double.POSITIVE_INFINITY;
				for (int c = 0; c < k; c++) {
					double dx = px - cx[c];
					double dy = py - cy[c];
					double d = dx * dx + dy * dy;
					if (d < bestD) {
						bestD = d;
						best = c;
					}
				}
				if (labels[i] != best) {
					labels[i] = best;
					any = true;
				}
			}
			chunkChanged[from / Chunks.CHUNK] = any;
		});
		for (boolean b : chunkChanged) {
			if (b) {
				return true;
			}
		}
		return false;
	}
}
