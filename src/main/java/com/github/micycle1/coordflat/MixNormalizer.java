package com.github.micycle1.coordflat;

import java.util.ArrayList;
import java.util.List;

/**
 * Blends original positions with their interpolated displacements and maps all
 * point sets, jointly, back into the unit square.
 * <p>
 * {@code p' = p + mu * d}; then one bounding box is taken over every set's
 * {@code p'}, each axis is rescaled independently into
 * {@code [margin, 1 - margin]} with that shared box, and any floating-point
 * overshoot is clamped to [0,1]. Using one box keeps primary and secondary
 * sets in the same frame.
 */
public final class MixNormalizer {

	private final double mu;
	private final double margin;

	public MixNormalizer(double mu, double margin) {
		if (!(mu >= 0 && mu <= 1)) {
			throw new InvalidConfigurationException("mu must be in [0,1], got " + mu);
		}
		if (!(margin >= 0 && margin < 0.5)) {
			throw new InvalidConfigurationException("margin must be in [0,0.5), got " + margin);
		}
		this.mu = mu;
		this.margin = margin;
	}

	/**
	 * Outcome of {@link MixNormalizer#apply}: the normalised sets in input order
	 * and the box they were normalised with.
	 */
	public static final class Result {
		public final List<PointSet> sets;
		public final NormalizationBox box;

		Result(List<PointSet> sets, NormalizationBox box) {
			this.sets = sets;
			this.box = box;
		}
	}

	/**
	 * @param sets          original point sets
	 * @param displacements per set, {@code {dx[], dy[]}} matching the set's size
	 */
	public Result apply(List<PointSet> sets, List<double[][]> displacements) {
		if (sets.size() != displacements.size()) {
			throw new IllegalArgumentException(sets.size() + " point sets but " + displacements.size() + " displacement arrays");
		}
		double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;

		List<double[][]> mixed = new ArrayList<>(sets.size());
		for (int s = 0; s < sets.size(); s++) {
			PointSet ps = sets.get(s);
			double[][] d = displacements.get(s);
			if (d[0].length != ps.size() || d[1].length != ps.size()) {
				throw new IllegalArgumentException("Displacements for '" + ps.name() + "' do not match its " + ps.size() + " points");
			}
			double[] fx = new double[ps.size()];
			double[] fy = new double[ps.size()];
			for (int i = 0; i < fx.length; i++) {
				fx[i] = ps.x(i) + mu * d[0][i];
				fy[i] = ps.y(i) + mu * d[1][i];
				if (!Double.isFinite(fx[i]) || !Double.isFinite(fy[i])) {
					throw new NumericalFailureException("Non-finite mixed coordinate for point " + i + " of '" + ps.name() + "'");
				}
				minX = Math.min(minX, fx[i]);
				maxX = Math.max(maxX, fx[i]);
				minY = Math.min(minY, fy[i]);
				maxY = Math.max(maxY, fy[i]);
			}
			mixed.add(new double[][] { fx, fy });
		}

		final double spanX = maxX - minX;
		final double spanY = maxY - minY;
		if (!(spanX > 0) && !(spanY > 0)) {
			throw new NumericalFailureException("All flattened points coincide; cannot renormalise");
		}
		final NormalizationBox box = new NormalizationBox(minX, maxX, minY, maxY);
		final double scale = 1.0 - 2 * margin;

		List<PointSet> out = new ArrayList<>(sets.size());
		for (int s = 0; s < sets.size(); s++) {
			double[] fx = mixed.get(s)[0];
			double[] fy = mixed.get(s)[1];
			for (int i = 0; i < fx.length; i++) {
				// a collapsed axis is centred
				double nx = spanX > 0 ? (fx[i] - minX) / spanX : 0.5;
				double ny = spanY > 0 ? (fy[i] - minY) / spanY : 0.5;
				fx[i] = MathUtil.clamp(nx * scale + margin, 0, 1);
				fy[i] = MathUtil.clamp(ny * scale + margin, 0, 1);
			}
			out.add(PointSet.wrap(sets.get(s).name(), fx, fy));
		}
		return new Result(out, box);
	}
}
