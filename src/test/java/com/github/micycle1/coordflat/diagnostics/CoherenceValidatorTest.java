package com.github.micycle1.coordflat.diagnostics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.TestPoints;

public class CoherenceValidatorTest {

	@Test
	void identityScoresOne() {
		PointSet p = TestPoints.uniform("p", 500, 1);
		assertEquals(1.0, new CoherenceValidator(10, 5000, 42).score(p, p), 1e-12);
	}

	@Test
	void similarityTransformScoresOne() {
		PointSet p = TestPoints.uniform("p", 500, 2);
		double[] x = new double[500];
		double[] y = new double[500];
		for (int i = 0; i < 500; i++) {
			x[i] = 0.25 + 0.5 * p.x(i);
			y[i] = 0.25 + 0.5 * p.y(i);
		}
		assertEquals(1.0, new CoherenceValidator(10, 200, 42).score(p, new PointSet("q", x, y)), 1e-12);
	}

	@Test
	void shuffledLayoutScoresLow() {
		PointSet p = TestPoints.uniform("p", 2000, 3);
		int[] perm = new int[2000];
		for (int i = 0; i < perm.length; i++) {
			perm[i] = i;
		}
		Random rnd = new Random(9);
		for (int i = perm.length - 1; i > 0; i--) {
			int j = rnd.nextInt(i + 1);
			int t = perm[i];
			perm[i] = perm[j];
			perm[j] = t;
		}
		double score = new CoherenceValidator(10, 1000, 42).score(p, p.select("shuffled", perm));
		assertTrue(score < 0.05, "score " + score);
	}

	@Test
	void kIsCappedForTinySets() {
		PointSet p = new PointSet("p", new double[] { 0.1, 0.5, 0.9 }, new double[] { 0.1, 0.5, 0.9 });
		assertEquals(1.0, new CoherenceValidator(10, 100, 1).score(p, p), 1e-12);
	}

	@Test
	void sameSeedSameScore() {
		PointSet p = TestPoints.uniform("p", 800, 4);
		PointSet q = TestPoints.uniform("q", 800, 5);
		assertEquals(new CoherenceValidator(10, 100, 7).score(p, q), new CoherenceValidator(10, 100, 7).score(p, q), 0);
	}

	@Test
	void rejectsMismatchedOrTinyLayouts() {
		CoherenceValidator v = new CoherenceValidator(10, 100, 1);
		assertThrows(IllegalArgumentException.class, () -> v.score(TestPoints.uniform("a", 5, 1), TestPoints.uniform("b", 6, 1)));
		PointSet one = TestPoints.uniform("a", 1, 1);
		assertThrows(IllegalArgumentException.class, () -> v.score(one, one));
	}
}
