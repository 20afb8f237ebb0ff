package com.github.micycle1.coordflat.diagnostics;

import java.util.Arrays;

import com.github.micycle1.coordflat.MathUtil;
import com.github.micycle1.coordflat.PointSet;

/**
 * Bins points into a uniform G x G grid over the unit square and summarises
 * cell occupancy. Coordinates are clipped to {@code [0, 1 - 1e-10]} before
 * binning, so out-of-range points land in the border cells.
 */
public final class DensityProfiler {

	private static final double UPPER = 1 - 1e-10;
	// floor(sqrt(Integer.MAX_VALUE))
	private static final int MAX_GRID_SIZE = 46340;

	private final int gridSize;

	public DensityProfiler(int gridSize) {
		if (gridSize <= 0 || gridSize > MAX_GRID_SIZE) {
			throw new IllegalArgumentException("gridSize must be in [1, " + MAX_GRID_SIZE + "], got " + gridSize);
		}
		this.gridSize = gridSize;
	}

	/** Row-major {@code counts[cy * G + cx]}. */
	public int[] counts(PointSet points) {
		final int g = gridSize;
		int[] counts = new int[g * g];
		for (int i = 0; i < points.size(); i++) {
			counts[cell(points.y(i)) * g + cell(points.x(i))]++;
		}
		return counts;
	}

	public DensityStats profile(PointSet points) {
		final int n = points.size();
		int[] counts = counts(points);
		final int cells = counts.length;

		double[] nonEmpty = new double[cells];
		int filled = 0;
		int max = 0;
		for (int c : counts) {
			if (c > 0) {
				nonEmpty[filled++] = c;
				max = Math.max(max, c);
			}
		}

		int[] sorted = counts.clone();
		Arrays.sort(sorted);
		int top = Math.max(1, cells / 10);
		int inTop = 0;
		for (int i = cells - 1; i >= cells - top; i--) {
			inTop += sorted[i];
		}

		double minX = 0, maxX = 0, minY = 0, maxY = 0;
		if (n > 0) {
			minX = maxX = points.x(0);
			minY = maxY = points.y(0);
			for (int i = 1; i < n; i++) {
				minX = Math.min(minX, points.x(i));
				maxX = Math.max(maxX, points.x(i));
				minY = Math.min(minY, points.y(i));
				maxY = Math.max(maxY, points.y(i));
			}
		}

		return new DensityStats(n, gridSize, cells - filled, max, MathUtil.median(nonEmpty, filled), MathUtil.mean(nonEmpty, filled),
				MathUtil.std(nonEmpty, filled), inTop, minX, maxX, minY, maxY);
	}

	private int cell(double c) {
		int i = (int) (MathUtil.clamp(c, 0, UPPER) * gridSize);
		return Math.min(Math.max(i, 0), gridSize - 1);
	}
}
