package com.github.micycle1.coordflat.target;

import com.github.micycle1.coordflat.InvalidConfigurationException;
import com.github.micycle1.coordflat.PointSet;

/**
 * Quasi-uniform target points from a 2D Halton sequence.
 * <p>
 * Point {@code i} is {@code (phi_bx(i + 1), phi_by(i + 1))} where
 * {@code phi_b} is the radical inverse in base {@code b}; the 1-based index
 * skips the origin. The unit square is then mapped affinely onto
 * {@code [margin, 1 - margin]^2}.
 * <p>
 * The output is a pure function of {@code (count, margin, bases)}.
 */
public final class HaltonTargets {

	private final int baseX;
	private final int baseY;

	public HaltonTargets(int baseX, int baseY) {
		if (baseX < 2 || baseY < 2 || baseX == baseY) {
			throw new InvalidConfigurationException("Halton bases must be distinct and >= 2, got " + baseX + "," + baseY);
		}
		this.baseX = baseX;
		this.baseY = baseY;
	}

	public PointSet generate(int count, double margin) {
		if (count < 0) {
			throw new InvalidConfigurationException("Target count must be non-negative, got " + count);
		}
		if (!(margin >= 0 && margin < 0.5)) {
			throw new InvalidConfigurationException("margin must be in [0,0.5), got " + margin);
		}
		final double scale = 1.0 - 2 * margin;
		double[] x = new double[count];
		double[] y = new double[count];
		for (int i = 0; i < count; i++) {
			x[i] = radicalInverse(i + 1, baseX) * scale + margin;
			y[i] = radicalInverse(i + 1, baseY) * scale + margin;
		}
		return new PointSet("targets", x, y);
	}

	/**
	 * Van der Corput radical inverse: mirrors the base-{@code b} digits of
	 * {@code index} about the radix point.
	 */
	public static double radicalInverse(long index, int base) {
		double f = 1.0;
		double value = 0.0;
		long i = index;
		while (i > 0) {
			f /= base;
			value += f * (i % base);
			i /= base;
		}
		return value;
	}
}
