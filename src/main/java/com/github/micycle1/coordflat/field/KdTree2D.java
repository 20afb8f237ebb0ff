package com.github.micycle1.coordflat.field;

import java.util.Arrays;

import com.github.micycle1.coordflat.PointSet;

/**
 * Static 2D k-d tree for exact k-nearest-neighbour queries.
 * <p>
 * Stored implicitly: a permutation of point indices where the subtree over
 * {@code perm[lo, hi)} has its splitting point at {@code mid = (lo + hi) >>> 1},
 * everything before it on the low side and everything after on the high side
 * of the split axis. Only the permutation, the per-node split axis and the
 * coordinate arrays are kept, no node objects.
 * <p>
 * Points are ordered by {@code (distance, index)}, both when building and when
 * querying, so query results are exact and independent of the tree layout, and
 * duplicates are returned lowest index first.
 * <p>
 * Immutable after construction; concurrent queries are safe as long as each
 * thread uses its own {@link Neighbours}.
 */
public final class KdTree2D {

	private final double[] x;
	private final double[] y;
	private final int[] perm;
	private final byte[] axis; // split axis of the node whose point sits at perm[i]

	public KdTree2D(PointSet points) {
		this.x = points.xs();
		this.y = points.ys();
		final int n = x.length;
		this.perm = new int[n];
		for (int i = 0; i < n; i++) {
			perm[i] = i;
		}
		this.axis = new byte[n];
		build(0, n);
	}

	public int size() {
		return perm.length;
	}

	/**
	 * Scratch space and result of one query. Reuse across queries on the same
	 * thread to avoid allocation.
	 */
	public static final class Neighbours {
		private final int[] index;
		private final double[] distSq;
		private int size;

		// current query
		private double qx, qy;
		private int k;
		private int exclude;

		public Neighbours(int capacity) {
			this.index = new int[capacity];
			this.distSq = new double[capacity];
		}

		public int size() {
			return size;
		}

		/** Index of the {@code i}-th nearest point (0 = nearest). */
		public int index(int i) {
			return index[i];
		}

		public double distance(int i) {
			return Math.sqrt(distSq[i]);
		}

		public double distanceSq(int i) {
			return distSq[i];
		}

		public int[] indices() {
			return Arrays.copyOf(index, size);
		}

		private boolean accepts(double d) {
			return size < k || d <= distSq[size - 1];
		}

		private void offer(double d, int i) {
			if (i == exclude) {
				return;
			}
			if (size == k) {
				double wd = distSq[size - 1];
				if (d > wd || (d == wd && i > index[size - 1])) {
					return;
				}
				size--;
			}
			int pos = size;
			while (pos > 0 && (distSq[pos - 1] > d || (distSq[pos - 1] == d && index[pos - 1] > i))) {
				distSq[pos] = distSq[pos - 1];
				index[pos] = index[pos - 1];
				pos--;
			}
			distSq[pos] = d;
			index[pos] = i;
			size++;
		}
	}

	/**
	 * Finds the {@code k} points nearest to {@code (qx, qy)}, sorted by ascending
	 * distance, into {@code out}.
	 *
	 * @param exclude point index to skip (e.g. the query point itself), or -1
	 * @return number of neighbours found, {@code min(k, size())} or one less if
	 *         {@code exclude} is a valid index
	 */
	public int nearest(double qx, double qy, int k, int exclude, Neighbours out) {
		if (k > out.index.length) {
			throw new IllegalArgumentException("k=" + k + " exceeds neighbour buffer capacity " + out.index.length);
		}
		out.size = 0;
		out.qx = qx;
		out.qy = qy;
		out.k = k;
		out.exclude = exclude;
		if (k > 0) {
			search(0, perm.length, out);
		}
		return out.size;
	}

	/** Convenience form allocating its own buffer. */
	public int[] nearest(double qx, double qy, int k) {
		Neighbours out = new Neighbours(k);
		nearest(qx, qy, k, -1, out);
		return out.indices();
	}

	private void search(int lo, int hi, Neighbours q) {
		if (lo >= hi) {
			return;
		}
		final int mid = (lo + hi) >>> 1;
		final int p = perm[mid];
		final double dx = q.qx - x[p];
		final double dy = q.qy - y[p];
		q.offer(dx * dx + dy * dy, p);
		if (hi - lo == 1) {
			return;
		}
		final double diff = axis[mid] == 0 ? dx : dy;
		if (diff < 0) {
			search(lo, mid, q);
			if (q.accepts(diff * diff)) {
				search(mid + 1, hi, q);
			}
		} else {
			search(mid + 1, hi, q);
			if (q.accepts(diff * diff)) {
				search(lo, mid, q);
			}
		}
	}

	private void build(int lo, int hi) {
		if (hi - lo <= 1) {
			return;
		}
		// split on the axis with the wider spread
		double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (int i = lo; i < hi; i++) {
			int p = perm[i];
			minX = Math.min(minX, x[p]);
			maxX = Math.max(maxX, x[p]);
			minY = Math.min(minY, y[p]);
			maxY = Math.max(maxY, y[p]);
		}
		final int dim = (maxX - minX) >= (maxY - minY) ? 0 : 1;
		final int mid = (lo + hi) >>> 1;
		select(lo, hi - 1, mid, dim == 0 ? x : y);
		axis[mid] = (byte) dim;
		build(lo, mid);
		build(mid + 1, hi);
	}

	// Quickselect on perm[left..right] so perm[kth] holds the element of rank kth
	// under (coordinate, index) order.
	private void select(int left, int right, int kth, double[] c) {
		while (right > left) {
			int pivot = medianOfThree(left, (left + right) >>> 1, right, c);
			int pivotIndex = partition(left, right, pivot, c);
			if (pivotIndex == kth) {
				return;
			} else if (kth < pivotIndex) {
				right = pivotIndex - 1;
			} else {
				left = pivotIndex + 1;
			}
		}
	}

	private int partition(int left, int right, int pivotPos, double[] c) {
		final int pv = perm[pivotPos];
		swap(pivotPos, right);
		int store = left;
		for (int i = left; i < right; i++) {
			if (less(perm[i], pv, c)) {
				swap(i, store++);
			}
		}
		swap(store, right);
		return store;
	}

	private int medianOfThree(int a, int b, int d, double[] c) {
		int pa = perm[a], pb = perm[b], pd = perm[d];
		if (less(pa, pb, c)) {
			if (less(pb, pd, c)) {
				return b;
			}
			return less(pa, pd, c) ? d : a;
		}
		if (less(pa, pd, c)) {
			return a;
		}
		return less(pb, pd, c) ? d : b;
	}

	private static boolean less(int i, int j, double[] c) {
		return c[i] < c[j] || (c[i] == c[j] && i < j);
	}

	private void swap(int i, int j) {
		int t = perm[i];
		perm[i] = perm[j];
		perm[j] = t;
	}
}
