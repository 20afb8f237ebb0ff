package com.github.micycle1.coordflat.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.MathUtil;
import com.github.micycle1.coordflat.PointSet;

/**
 * Distributes target points among clusters so that every cluster receives
 * exactly as many targets as it has points.
 * <p>
 * Greedy rounds: in round {@code r} each still-unassigned target bids for its
 * {@code r}-th nearest cluster centre. A cluster with enough spare capacity
 * takes all of its bidders, otherwise it takes the bidders closest to its
 * centre up to its capacity. After as many rounds as there are clusters, any
 * leftover target goes to the nearest cluster that still has room.
 * <p>
 * Full per-target cluster rankings are only materialised for targets that
 * lose their first bid; round 0 needs just the nearest centre.
 */
public final class CapacitatedTargetAssigner {

	private static final Logger LOG = LoggerFactory.getLogger(CapacitatedTargetAssigner.class);

	private CapacitatedTargetAssigner() {
	}

	/**
	 * @param targets  points to distribute
	 * @param centersX cluster centres
	 * @param centersY cluster centres
	 * @param capacity required target count per cluster; must sum to
	 *                 {@code targets.size()}
	 * @return cluster label per target
	 */
	public static int[] assign(PointSet targets, double[] centersX, double[] centersY, int[] capacity) {
		final int t = targets.size();
		final int k = capacity.length;
		long total = 0;
		for (int c : capacity) {
			if (c < 0) {
				throw new IllegalArgumentException("Negative cluster capacity " + c);
			}
			total += c;
		}
		if (total != t) {
			throw new IllegalArgumentException("Capacities sum to " + total + " but there are " + t + " targets");
		}

		final int[] labels = new int[t];
		Arrays.fill(labels, -1);
		final int[] remaining = capacity.clone();
		final int[][] ranking = new int[t][];

		int[] unassigned = new int[t];
		for (int i = 0; i < t; i++) {
			unassigned[i] = i;
		}
		int open = t;

		for (int round = 0; round < k && open > 0; round++) {
			// bucket bidders by preferred cluster; buckets stay in ascending target order
			List<List<Integer>> bids = new ArrayList<>(k);
			for (int c = 0; c < k; c++) {
				bids.add(new ArrayList<>());
			}
			for (int u = 0; u < open; u++) {
				int ti = unassigned[u];
				bids.get(choice(targets, centersX, centersY, ranking, ti, round)).add(ti);
			}

			for (int c = 0; c < k; c++) {
				List<Integer> wanting = bids.get(c);
				if (remaining[c] == 0 || wanting.isEmpty()) {
					continue;
				}
				if (wanting.size() <= remaining[c]) {
					for (int ti : wanting) {
						labels[ti] = c;
					}
					remaining[c] -= wanting.size();
				} else {
					final double ccx = centersX[c];
					final double ccy = centersY[c];
					wanting.sort(Comparator.<Integer>comparingDouble(ti -> distSq(targets, ti, ccx, ccy)).thenComparingInt(ti -> ti));
					for (int j = 0; j < remaining[c]; j++) {
						labels[wanting.get(j)] = c;
					}
					remaining[c] = 0;
				}
			}

			int next = 0;
			for (int u = 0; u < open; u++) {
				if (labels[unassigned[u]] < 0) {
					unassigned[next++] = unassigned[u];
				}
			}
			open = next;
			if ((round + 1) % 10 == 0) {
				LOG.debug("Capacitated assignment round {}: {} targets unassigned", round + 1, open);
			}
		}

		if (open > 0) {
			LOG.warn("{} targets still unassigned after {} rounds; assigning to nearest cluster with room", open, k);
			for (int u = 0; u < open; u++) {
				int ti = unassigned[u];
				int[] rank = ranking(targets, centersX, centersY, ranking, ti);
				for (int c : rank) {
					if (remaining[c] > 0) {
						labels[ti] = c;
						remaining[c]--;
						break;
					}
				}
			}
		}

		int[] counts = new int[k];
		for (int label : labels) {
			if (label < 0) {
				throw new IllegalStateException("Target left unassigned");
			}
			counts[label]++;
		}
		if (!Arrays.equals(counts, capacity)) {
			throw new IllegalStateException("Target counts per cluster do not match cluster sizes");
		}
		return labels;
	}

	private static int choice(PointSet targets, double[] cx, double[] cy, int[][] ranking, int ti, int round) {
		if (round == 0 && ranking[ti] == null) {
			int best = 0;
			double bestD = Double.POSITIVE_INFINITY;
			for (int c = 0; c < cx.length; c++) {
				double d = distSq(targets, ti, cx[c], cy[c]);
				if (d < bestD) {
					bestD = d;
					best = c;
				}
			}
			return best;
		}
		return ranking(targets, cx, cy, ranking, ti)[round];
	}

	// clusters ordered by (distance to target, cluster index); cached per target
	private static int[] ranking(PointSet targets, double[] cx, double[] cy, int[][] ranking, int ti) {
		if (ranking[ti] == null) {
			final int k = cx.length;
			final double[] d = new double[k];
			Integer[] order = new Integer[k];
			for (int c = 0; c < k; c++) {
				d[c] = distSq(targets, ti, cx[c], cy[c]);
				order[c] = c;
			}
			Arrays.sort(order, Comparator.<Integer>comparingDouble(c -> d[c]).thenComparingInt(c -> c));
			int[] r = new int[k];
			for (int c = 0; c < k; c++) {
				r[c] = order[c];
			}
			ranking[ti] = r;
		}
		return ranking[ti];
	}

	private static double distSq(PointSet targets, int ti, double x, double y) {
		return MathUtil.distanceSq(targets.x(ti), targets.y(ti), x, y);
	}
}
