package com.github.micycle1.coordflat.field;

import com.github.micycle1.coordflat.Chunks;
import com.github.micycle1.coordflat.PointSet;

/**
 * Evaluates a {@link DisplacementField} at arbitrary points by inverse-distance
 * weighting of the {@code k} nearest field vectors.
 * <p>
 * Weights are {@code 1 / (d + epsilon)}, normalised to sum to one; a query that
 * coincides with a source therefore takes (almost exactly) that source's
 * displacement. {@code k} is capped at the field size.
 */
public final class DisplacementInterpolator {

	private final DisplacementField field;
	private final int k;
	private final double epsilon;
	private final boolean parallel;

	public DisplacementInterpolator(DisplacementField field, int k, double epsilon, boolean parallel) {
		if (k <= 0) {
			throw new IllegalArgumentException("k must be positive, got " + k);
		}
		if (!(epsilon > 0)) {
			throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
		}
		this.field = field;
		this.k = Math.min(k, field.size());
		this.epsilon = epsilon;
		this.parallel = parallel;
	}

	/** Effective neighbour count after capping at the field size. */
	public int k() {
		return k;
	}

	/**
	 * Displacement at a single point, as {@code {dx, dy}}.
	 */
	public double[] at(double qx, double qy) {
		double[] out = new double[2];
		interpolate(qx, qy, new KdTree2D.Neighbours(k), out);
		return out;
	}

	/**
	 * Displacements for every point of {@code points}, in order, as
	 * {@code {dx[], dy[]}}.
	 */
	public double[][] interpolate(PointSet points) {
		final int n = points.size();
		final double[] dx = new double[n];
		final double[] dy = new double[n];
		Chunks.forEach(n, parallel, (from, to) -> {
			KdTree2D.Neighbours nb = new KdTree2D.Neighbours(k);
			double[] d = new double[2];
			for (int i = from; i < to; i++) {
				interpolate(points.x(i), points.y(i), nb, d);
				dx[i] = d[0];
				dy[i] = d[1];
			}
		});
		return new double[][] { dx, dy };
	}

	private void interpolate(double qx, double qy, KdTree2D.Neighbours nb, double[] out) {
		final int found = field.index().nearest(qx, qy, k, -1, nb);
		double wsum = 0, sx = 0, sy = 0;
		for (int j = 0; j < found; j++) {
			int s = nb.index(j);
			double w = 1.0 / (nb.distance(j) + epsilon);
			wsum += w;
			sx += w * field.dx(s);
			sy += w * field.dy(s);
		}
		out[0] = sx / wsum;
		out[1] = sy / wsum;
	}
}
