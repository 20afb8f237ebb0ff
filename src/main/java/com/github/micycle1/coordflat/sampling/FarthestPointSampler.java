package com.github.micycle1.coordflat.sampling;

import java.util.Arrays;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.Chunks;
import com.github.micycle1.coordflat.InvalidConfigurationException;
import com.github.micycle1.coordflat.PointSet;

/**
 * Greedy farthest-point sampling.
 * <p>
 * Starts from one point chosen by {@code new Random(seed).nextInt(n)}, then
 * repeatedly adds the unselected point whose squared distance to its nearest
 * selected point is largest (ties go to the lowest index). A running
 * minimum-distance array makes each step O(n), for O(n·m) overall and O(n)
 * memory.
 * <p>
 * The per-step distance update is data-parallel and may run on the fork-join
 * pool; the arg-max scan stays sequential so tie-breaking is fixed.
 */
public final class FarthestPointSampler implements RepresentativeSampler {

	private static final Logger LOG = LoggerFactory.getLogger(FarthestPointSampler.class);

	private final long seed;
	private final boolean parallel;

	public FarthestPointSampler(long seed, boolean parallel) {
		this.seed = seed;
		this.parallel = parallel;
	}

	@Override
	public int[] sample(PointSet points, int m) {
		if (m <= 0) {
			throw new InvalidConfigurationException("Sample size must be positive, got " + m);
		}
		final int n = points.size();
		if (m >= n) {
			int[] all = new int[n];
			for (int i = 0; i < n; i++) {
				all[i] = i;
			}
			return all;
		}

		final int[] selected = new int[m];
		final boolean[] taken = new boolean[n];
		final double[] minDist = new double[n];
		Arrays.fill(minDist, Double.POSITIVE_INFINITY);

		selected[0] = new Random(seed).nextInt(n);

		for (int i = 0; i < m; i++) {
			final int p = selected[i];
			taken[p] = true;
			final double px = points.x(p);
			final double py = points.y(p);

			Chunks.forEach(n, parallel, (from, to) -> {
				for (int j = from; j < to; j++) {
					double dx = points.x(j) - px;
					double dy = points.y(j) - py;
					double d = dx * dx + dy * dy;
					if (d < minDist[j]) {
						minDist[j] = d;
					}
				}
			});

			if (i < m - 1) {
				int best = -1;
				double bestDist = Double.NEGATIVE_INFINITY;
				for (int j = 0; j < n; j++) {
					if (!taken[j] && minDist[j] > bestDist) {
						bestDist = minDist[j];
						best = j;
					}
				}
				selected[i + 1] = best;
			}

			if ((i + 1) % 1000 == 0) {
				LOG.debug("Farthest-point sampling: {}/{}", i + 1, m);
			}
		}
		return selected;
	}
}
