package com.github.micycle1.coordflat.assignment;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.coordflat.Chunks;
import com.github.micycle1.coordflat.PointSet;

/**
 * Dense pairwise cost matrices for the assignment step.
 */
public final class CostMatrices {

	private CostMatrices() {
	}

	/**
	 * Euclidean distance from every point of {@code rows} to every point of
	 * {@code columns}, row-major. Rows are filled in independent chunks, so the
	 * result does not depend on {@code parallel}.
	 */
	public static DMatrixRMaj euclidean(PointSet rows, PointSet columns, boolean parallel) {
		final int r = rows.size();
		final int c = columns.size();
		final DMatrixRMaj cost = new DMatrixRMaj(r, c);
		final double[] data = cost.data;
		Chunks.forEach(r, parallel, (from, to) -> {
			for (int i = from; i < to; i++) {
				final double xi = rows.x(i);
				final double yi = rows.y(i);
				final int offset = i * c;
				for (int j = 0; j < c; j++) {
					double dx = xi - columns.x(j);
					double dy = yi - columns.y(j);
					data[offset + j] = Math.sqrt(dx * dx + dy * dy);
				}
			}
		});
		return cost;
	}
}
