package com.github.micycle1.coordflat;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class MathUtilTest {

	@Test
	void summaries() {
		double[] v = { 4, 1, 3, 2, 99 };
		assertEquals(2.5, MathUtil.median(v, 4), 0);
		assertEquals(3.0, MathUtil.median(v, 5), 0);
		assertEquals(2.5, MathUtil.mean(v, 4), 0);
		assertEquals(Math.sqrt(1.25), MathUtil.std(v, 4), 1e-15);
		assertEquals(0.0, MathUtil.median(v, 0), 0);
		// input untouched
		assertEquals(4, v[0], 0);
	}

	@Test
	void clampAndDistance() {
		assertEquals(0.0, MathUtil.clamp(-1, 0, 1), 0);
		assertEquals(1.0, MathUtil.clamp(2, 0, 1), 0);
		assertEquals(0.3, MathUtil.clamp(0.3, 0, 1), 0);
		assertEquals(25.0, MathUtil.distanceSq(0, 0, 3, 4), 0);
	}
}
