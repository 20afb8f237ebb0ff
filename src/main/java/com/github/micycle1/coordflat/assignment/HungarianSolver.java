package com.github.micycle1.coordflat.assignment;

import java.util.Arrays;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;

import com.github.micycle1.coordflat.NumericalFailureException;

/**
 * Exact solver for the square linear assignment problem.
 * <p>
 * Shortest augmenting path Hungarian method with row/column dual potentials
 * (the Jonker-Volgenant family): each row is inserted in turn and a
 * Dijkstra-like sweep over reduced costs finds the cheapest augmenting path.
 * O(n^3) time, O(n) extra memory on top of the n x n cost matrix.
 * <p>
 * The cost matrix is read, never modified. Any NaN or infinite entry fails the
 * solve with {@link NumericalFailureException}; there is no fallback matching.
 * Ties are resolved by scan order, so the result is deterministic.
 */
public final class HungarianSolver {

	public Assignment solve(DMatrixRMaj cost) {
		final int n = cost.numRows;
		if (cost.numCols != n) {
			throw new IllegalArgumentException("Cost matrix must be square, got " + cost.numRows + "x" + cost.numCols);
		}
		if (MatrixFeatures_DDRM.hasUncountable(cost)) {
			throw new NumericalFailureException("Cost matrix contains NaN or infinite entries");
		}
		if (n == 0) {
			return new Assignment(new int[0], 0.0);
		}

		final double[] a = cost.data;

		// 1-based: u over rows, v over columns; column 0 is the virtual start
		final double[] u = new double[n + 1];
		final double[] v = new double[n + 1];
		final int[] p = new int[n + 1]; // p[j] = row matched to column j (0 = free)
		final int[] way = new int[n + 1]; // previous column on the alternating path
		final double[] minv = new double[n + 1];
		final boolean[] used = new boolean[n + 1];

		for (int i = 1; i <= n; i++) {
			p[0] = i;
			int j0 = 0;
			Arrays.fill(minv, Double.POSITIVE_INFINITY);
			Arrays.fill(used, false);
			do {
				used[j0] = true;
				final int i0 = p[j0];
				final int rowOffset = (i0 - 1) * n;
				double delta = Double.POSITIVE_INFINITY;
				int j1 = 0;
				for (int j = 1; j <= n; j++) {
					if (!used[j]) {
						double cur = a[rowOffset + j - 1] - u[i0] - v[j];
						if (cur < minv[j]) {
							minv[j] = cur;
							way[j] = j0;
						}
						if (minv[j] < delta) {
							delta = minv[j];
							j1 = j;
						}
					}
				}
				if (j1 == 0) {
					// only reachable if reduced costs went non-finite
					throw new NumericalFailureException("No augmenting path found for row " + (i - 1));
				}
				for (int j = 0; j <= n; j++) {
					if (used[j]) {
						u[p[j]] += delta;
						v[j] -= delta;
					} else {
						minv[j] -= delta;
					}
				}
				j0 = j1;
			} while (p[j0] != 0);

			// augment along the path back to the virtual column
			do {
				int j1 = way[j0];
				p[j0] = p[j1];
				j0 = j1;
			} while (j0 != 0);
		}

		final int[] rowToColumn = new int[n];
		for (int j = 1; j <= n; j++) {
			rowToColumn[p[j] - 1] = j - 1;
		}
		double total = 0;
		for (int i = 0; i < n; i++) {
			total += a[i * n + rowToColumn[i]];
		}
		if (!Double.isFinite(total)) {
			throw new NumericalFailureException("Assignment cost is not finite: " + total);
		}
		return new Assignment(rowToColumn, total);
	}
}
