package com.github.micycle1.coordflat.strategy;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.FlattenConfig;
import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.assignment.Assignment;
import com.github.micycle1.coordflat.assignment.CostMatrices;
import com.github.micycle1.coordflat.assignment.HungarianSolver;
import com.github.micycle1.coordflat.field.DisplacementField;
import com.github.micycle1.coordflat.sampling.FarthestPointSampler;
import com.github.micycle1.coordflat.sampling.RepresentativeSampler;
import com.github.micycle1.coordflat.target.HaltonTargets;

/**
 * Default field construction: farthest-point subsample of M primary points,
 * M Halton targets, one exact M x M assignment.
 * <p>
 * Cost is dominated by the assignment, O(M^3) time and O(M^2) memory for the
 * cost matrix, which is released as soon as the solver returns.
 */
public final class SubsampleStrategy implements DisplacementStrategy {

	private static final Logger LOG = LoggerFactory.getLogger(SubsampleStrategy.class);

	private final HungarianSolver solver = new HungarianSolver();

	@Override
	public String name() {
		return "subsample";
	}

	@Override
	public DisplacementField build(PointSet primary, FlattenConfig config) {
		RepresentativeSampler sampler = new FarthestPointSampler(config.seed(), config.parallel());

		long t0 = System.nanoTime();
		int[] idx = sampler.sample(primary, config.sampleSize());
		PointSet reps = primary.select("representatives", idx);
		LOG.info("Selected {} representative points of {} in {} ms", reps.size(), primary.size(), millisSince(t0));

		PointSet targets = new HaltonTargets(config.haltonBaseX(), config.haltonBaseY()).generate(reps.size(), config.margin());

		t0 = System.nanoTime();
		Assignment assignment = assign(reps, targets, config.parallel());
		LOG.info("Solved {}x{} assignment in {} ms, total cost {}", reps.size(), reps.size(), millisSince(t0),
				String.format("%.4f", assignment.totalCost()));

		final int m = reps.size();
		double[] dx = new double[m];
		double[] dy = new double[m];
		for (int i = 0; i < m; i++) {
			int j = assignment.columnOf(i);
			dx[i] = targets.x(j) - reps.x(i);
			dy[i] = targets.y(j) - reps.y(i);
		}
		return new DisplacementField(reps, dx, dy, assignment.totalCost());
	}

	private Assignment assign(PointSet reps, PointSet targets, boolean parallel) {
		DMatrixRMaj cost = CostMatrices.euclidean(reps, targets, parallel);
		LOG.debug("Cost matrix {}x{}, {} MB", cost.numRows, cost.numCols, cost.data.length * 8L / (1024 * 1024));
		return solver.solve(cost);
	}

	static long millisSince(long t0) {
		return (System.nanoTime() - t0) / 1_000_000L;
	}
}
