package com.github.micycle1.coordflat.diagnostics;

/**
 * Grid occupancy statistics of one point set. Counts statistics (median, mean,
 * std) are over non-empty cells only; std is the population deviation.
 */
public final class DensityStats {

	public final int totalPoints;
	public final int gridSize;
	public final int totalCells;
	public final int emptyCells;
	public final double emptyFraction;
	public final int maxCount;
	public final double medianNonEmpty;
	public final double meanNonEmpty;
	public final double stdNonEmpty;
	/** Points in the densest {@code max(1, totalCells / 10)} cells. */
	public final int pointsInTopDecile;
	public final double topDecileFraction;
	public final double minX, maxX, minY, maxY;

	DensityStats(int totalPoints, int gridSize, int emptyCells, int maxCount, double medianNonEmpty, double meanNonEmpty, double stdNonEmpty,
			int pointsInTopDecile, double minX, double maxX, double minY, double maxY) {
		this.totalPoints = totalPoints;
		this.gridSize = gridSize;
		this.totalCells = gridSize * gridSize;
		this.emptyCells = emptyCells;
		this.emptyFraction = (double) emptyCells / totalCells;
		this.maxCount = maxCount;
		this.medianNonEmpty = medianNonEmpty;
		this.meanNonEmpty = meanNonEmpty;
		this.stdNonEmpty = stdNonEmpty;
		this.pointsInTopDecile = pointsInTopDecile;
		this.topDecileFraction = totalPoints == 0 ? 0.0 : (double) pointsInTopDecile / totalPoints;
		this.minX = minX;
		this.maxX = maxX;
		this.minY = minY;
		this.maxY = maxY;
	}

	/** Coefficient of variation of non-empty cell counts. */
	public double stdOverMean() {
		return stdNonEmpty / Math.max(meanNonEmpty, 1.0);
	}

	@Override
	public String toString() {
		return String.format("DensityStats{points=%d, grid=%dx%d, empty=%.1f%%, top10%%Cells=%.1f%%, max=%d, median=%.1f, mean=%.1f, std=%.1f}",
				totalPoints, gridSize, gridSize, 100 * emptyFraction, 100 * topDecileFraction, maxCount, medianNonEmpty, meanNonEmpty, stdNonEmpty);
	}
}
