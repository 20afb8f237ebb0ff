package com.github.micycle1.coordflat;

import java.util.Arrays;

public final class MathUtil {

	private MathUtil() {
	}

	public static double distanceSq(double x1, double y1, double x2, double y2) {
		double dx = x1 - x2;
		double dy = y1 - y2;
		return dx * dx + dy * dy;
	}

	public static double clamp(double v, double lo, double hi) {
		if (v < lo) {
			return lo;
		}
		if (v > hi) {
			return hi;
		}
		return v;
	}

	// Median of values[0..n); sorts a copy, leaves the input untouched.
	public static double median(double[] values, int n) {
		if (n == 0) {
			return 0.0;
		}
		double[] s = Arrays.copyOf(values, n);
		Arrays.sort(s);
		int mid = n >>> 1;
		return (n & 1) == 1 ? s[mid] : 0.5 * (s[mid - 1] + s[mid]);
	}

	public static double mean(double[] values, int n) {
		if (n == 0) {
			return 0.0;
		}
		double sum = 0;
		for (int i = 0; i < n; i++) {
			sum += values[i];
		}
		return sum / n;
	}

	// Population standard deviation (divides by n).
	public static double std(double[] values, int n) {
		if (n == 0) {
			return 0.0;
		}
		double m = mean(values, n);
		double ss = 0;
		for (int i = 0; i < n; i++) {
			double d = values[i] - m;
			ss += d * d;
		}
		return Math.sqrt(ss / n);
	}
}
