package com.github.micycle1.coordflat;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named, ordered collection of 2D points held as two flat coordinate arrays.
 * <p>
 * Instances are immutable: the constructor copies the supplied arrays and
 * {@link #xs()} / {@link #ys()} return copies. Use {@link #x(int)} and
 * {@link #y(int)} in hot loops.
 * <p>
 * Coordinates must be finite. They are expected to lie in [0,1] but this is
 * not enforced here; {@link #isWithinUnitSquare(double)} lets callers check.
 */
public final class PointSet {

	private final String name;
	private final double[] x;
	private final double[] y;

	public PointSet(String name, double[] x, double[] y) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(x, "x must not be null");
		Objects.requireNonNull(y, "y must not be null");
		if (x.length != y.length) {
			throw new DegenerateInputException("Point set '" + name + "' has " + x.length + " x but " + y.length + " y coordinates");
		}
		for (int i = 0; i < x.length; i++) {
			if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
				throw new DegenerateInputException("Point set '" + name + "' has a non-finite coordinate at index " + i);
			}
		}
		this.x = x.clone();
		this.y = y.clone();
	}

	/**
	 * Builds a point set from an {@code n x 2} array of {@code (x, y)} rows.
	 */
	public static PointSet of(String name, double[][] xy) {
		Objects.requireNonNull(xy, "xy must not be null");
		double[] xs = new double[xy.length];
		double[] ys = new double[xy.length];
		for (int i = 0; i < xy.length; i++) {
			if (xy[i] == null || xy[i].length != 2) {
				throw new DegenerateInputException("Point " + i + " of '" + name + "' is not an (x, y) pair");
			}
			xs[i] = xy[i][0];
			ys[i] = xy[i][1];
		}
		return new PointSet(name, xs, ys);
	}

	// takes ownership of arrays produced inside the engine, no copy
	static PointSet wrap(String name, double[] x, double[] y) {
		return new PointSet(x, y, name);
	}

	private PointSet(double[] x, double[] y, String name) {
		this.name = name;
		this.x = x;
		this.y = y;
	}

	public String name() {
		return name;
	}

	public int size() {
		return x.length;
	}

	public boolean isEmpty() {
		return x.length == 0;
	}

	public double x(int i) {
		return x[i];
	}

	public double y(int i) {
		return y[i];
	}

	public double[] xs() {
		return x.clone();
	}

	public double[] ys() {
		return y.clone();
	}

	/** Rows of {@code (x, y)}. */
	public double[][] toArray() {
		double[][] out = new double[x.length][];
		for (int i = 0; i < x.length; i++) {
			out[i] = new double[] { x[i], y[i] };
		}
		return out;
	}

	/**
	 * @param tolerance allowed overshoot on either side of [0,1]
	 */
	public boolean isWithinUnitSquare(double tolerance) {
		for (int i = 0; i < x.length; i++) {
			if (x[i] < -tolerance || x[i] > 1 + tolerance || y[i] < -tolerance || y[i] > 1 + tolerance) {
				return false;
			}
		}
		return true;
	}

	/** Points at the given indices, in the given order. */
	public PointSet select(String name, int[] indices) {
		double[] sx = new double[indices.length];
		double[] sy = new double[indices.length];
		for (int i = 0; i < indices.length; i++) {
			sx[i] = x[indices[i]];
			sy[i] = y[indices[i]];
		}
		return wrap(name, sx, sy);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PointSet)) {
			return false;
		}
		PointSet other = (PointSet) o;
		return name.equals(other.name) && Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * name.hashCode() + Arrays.hashCode(x)) + Arrays.hashCode(y);
	}

	@Override
	public String toString() {
		return "PointSet{name=" + name + ", size=" + x.length + "}";
	}
}
