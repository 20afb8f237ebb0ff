package com.github.micycle1.coordflat.field;

import java.util.Objects;

import com.github.micycle1.coordflat.MathUtil;
import com.github.micycle1.coordflat.PointSet;

/**
 * Sparse control vectors of the flattening deformation: for each source point,
 * the displacement {@code target - source} chosen by the assignment, plus a
 * {@link KdTree2D} over the sources for neighbour lookups.
 * <p>
 * A {@link #perPoint per-point} field has one vector for every primary point,
 * in primary order. The primary set then moves by its own vectors directly and
 * only secondary sets are interpolated, so coincident primary points keep
 * their distinct targets.
 * <p>
 * Immutable once built and safe to share between interpolation workers.
 */
public final class DisplacementField {

	private final PointSet sources;
	private final double[] dx;
	private final double[] dy;
	private final double assignmentCost;
	private final KdTree2D index;
	private final boolean perPoint;

	public DisplacementField(PointSet sources, double[] dx, double[] dy, double assignmentCost) {
		this(sources, dx, dy, assignmentCost, false);
	}

	/**
	 * Field whose sources are exactly the primary points, in order.
	 */
	public static DisplacementField perPoint(PointSet primary, double[] dx, double[] dy, double assignmentCost) {
		return new DisplacementField(primary, dx, dy, assignmentCost, true);
	}

	private DisplacementField(PointSet sources, double[] dx, double[] dy, double assignmentCost, boolean perPoint) {
		this.sources = Objects.requireNonNull(sources, "sources must not be null");
		if (dx.length != sources.size() || dy.length != sources.size()) {
			throw new IllegalArgumentException("Displacement arrays must match the " + sources.size() + " sources");
		}
		if (sources.isEmpty()) {
			throw new IllegalArgumentException("Displacement field needs at least one source");
		}
		this.dx = dx.clone();
		this.dy = dy.clone();
		this.assignmentCost = assignmentCost;
		this.index = new KdTree2D(sources);
		this.perPoint = perPoint;
	}

	public boolean isPerPoint() {
		return perPoint;
	}

	/** Copies of the vectors as {@code {dx[], dy[]}}, in source order. */
	public double[][] vectors() {
		return new double[][] { dx.clone(), dy.clone() };
	}

	public int size() {
		return dx.length;
	}

	public PointSet sources() {
		return sources;
	}

	public double dx(int i) {
		return dx[i];
	}

	public double dy(int i) {
		return dy[i];
	}

	public KdTree2D index() {
		return index;
	}

	/** Total Euclidean cost of the assignment(s) that produced this field. */
	public double assignmentCost() {
		return assignmentCost;
	}

	public double[] magnitudes() {
		double[] m = new double[dx.length];
		for (int i = 0; i < m.length; i++) {
			m[i] = Math.sqrt(dx[i] * dx[i] + dy[i] * dy[i]);
		}
		return m;
	}

	public double meanMagnitude() {
		double[] m = magnitudes();
		return MathUtil.mean(m, m.length);
	}

	public double medianMagnitude() {
		double[] m = magnitudes();
		return MathUtil.median(m, m.length);
	}

	public double maxMagnitude() {
		double max = 0;
		for (double v : magnitudes()) {
			max = Math.max(max, v);
		}
		return max;
	}
}
