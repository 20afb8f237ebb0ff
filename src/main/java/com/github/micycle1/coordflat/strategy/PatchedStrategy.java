package com.github.micycle1.coordflat.strategy;

import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.FlattenConfig;
import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.assignment.Assignment;
import com.github.micycle1.coordflat.assignment.CostMatrices;
import com.github.micycle1.coordflat.assignment.HungarianSolver;
import com.github.micycle1.coordflat.cluster.CapacitatedTargetAssigner;
import com.github.micycle1.coordflat.cluster.KMeans2D;
import com.github.micycle1.coordflat.field.DisplacementField;
import com.github.micycle1.coordflat.target.HaltonTargets;

/**
 * Field construction without subsampling: every primary point gets its own
 * uniform target.
 * <p>
 * The primary set is partitioned with k-means (K grows by half until no
 * cluster exceeds {@link FlattenConfig#maxClusterSize()}), N Halton targets are
 * shared out so each cluster gets exactly as many as it has points, and each
 * cluster is then matched exactly on its own. K solves of size N/K replace one
 * solve of size N.
 */
public final class PatchedStrategy implements DisplacementStrategy {

	private static final Logger LOG = LoggerFactory.getLogger(PatchedStrategy.class);

	private final HungarianSolver solver = new HungarianSolver();

	@Override
	public String name() {
		return "patched";
	}

	@Override
	public DisplacementField build(PointSet primary, FlattenConfig config) {
		final int n = primary.size();
		final KMeans2D kmeans = new KMeans2D(config.seed(), config.maxKMeansIterations(), config.parallel());

		long t0 = System.nanoTime();
		int k = Math.min(config.clusterCount(), n);
		KMeans2D.Clustering clustering = kmeans.cluster(primary, k);
		while (clustering.maxSize() > config.maxClusterSize() && k < n) {
			int grown = Math.min(n, Math.max(k + 1, (int) (k * 1.5)));
			LOG.info("K={}: largest cluster {} > {}, increasing to K={}", k, clustering.maxSize(), config.maxClusterSize(), grown);
			k = grown;
			clustering = kmeans.cluster(primary, k);
		}
		LOG.info("Clustered {} points into K={} (largest {}) in {} ms", n, k, clustering.maxSize(), SubsampleStrategy.millisSince(t0));

		PointSet targets = new HaltonTargets(config.haltonBaseX(), config.haltonBaseY()).generate(n, config.margin());

		t0 = System.nanoTime();
		int[] targetLabels = CapacitatedTargetAssigner.assign(targets, clustering.centersX, clustering.centersY, clustering.sizes);
		LOG.info("Shared {} targets among {} clusters in {} ms", n, k, SubsampleStrategy.millisSince(t0));

		int[][] targetMembers = membersByLabel(targetLabels, k);

		// largest clusters first
		Integer[] order = new Integer[k];
		for (int c = 0; c < k; c++) {
			order[c] = c;
		}
		final int[] sizes = clustering.sizes;
		Arrays.sort(order, Comparator.<Integer>comparingInt(c -> -sizes[c]).thenComparingInt(c -> c));

		t0 = System.nanoTime();
		final double[] dx = new double[n];
		final double[] dy = new double[n];
		double totalCost = 0;
		int solved = 0;
		for (int c : order) {
			if (sizes[c] == 0) {
				continue;
			}
			int[] src = clustering.members(c);
			int[] dst = targetMembers[c];
			PointSet rows = primary.select("cluster-" + c, src);
			PointSet cols = targets.select("cluster-targets-" + c, dst);
			Assignment a = solver.solve(CostMatrices.euclidean(rows, cols, config.parallel()));
			for (int r = 0; r < src.length; r++) {
				int j = dst[a.columnOf(r)];
				dx[src[r]] = targets.x(j) - primary.x(src[r]);
				dy[src[r]] = targets.y(j) - primary.y(src[r]);
			}
			totalCost += a.totalCost();
			solved++;
			if (solved % 20 == 0) {
				LOG.debug("{}/{} clusters solved", solved, k);
			}
		}
		LOG.info("Solved {} per-cluster assignments in {} ms, total cost {}", solved, SubsampleStrategy.millisSince(t0),
				String.format("%.4f", totalCost));

		return DisplacementField.perPoint(primary, dx, dy, totalCost);
	}

	private static int[][] membersByLabel(int[] labels, int k) {
		int[] counts = new int[k];
		for (int l : labels) {
			counts[l]++;
		}
		int[][] members = new int[k][];
		for (int c = 0; c < k; c++) {
			members[c] = new int[counts[c]];
		}
		int[] fill = new int[k];
		for (int i = 0; i < labels.length; i++) {
			int l = labels[i];
			members[l][fill[l]++] = i;
		}
		return members;
	}
}
