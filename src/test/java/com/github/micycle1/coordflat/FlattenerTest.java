package com.github.micycle1.coordflat;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.coordflat.diagnostics.DensityStats;
import com.github.micycle1.coordflat.diagnostics.RunDiagnostics;
import com.github.micycle1.coordflat.field.DisplacementField;
import com.github.micycle1.coordflat.strategy.DisplacementStrategy;

public class FlattenerTest {

	private static FlattenConfig small() {
		return FlattenConfig.builder().sampleSize(200).densityGridSize(20).build();
	}

	@Test
	void preservesCountOrderAndNames() {
		PointSet primary = TestPoints.cornerCluster("articles", 900, 100, 0.1, 7);
		PointSet secondary = TestPoints.uniform("queries", 37, 2);
		FlattenResult r = Flattener.flatten(List.of(primary, secondary), small());
		assertEquals(2, r.sets().size());
		assertEquals("articles", r.primary().name());
		assertEquals("queries", r.get(1).name());
		assertEquals(1000, r.primary().size());
		assertEquals(37, r.get(1).size());
	}

	@ParameterizedTest
	@ValueSource(doubles = { 0.0, 0.5, 0.75, 1.0 })
	void outputInsideMarginBox(double mu) {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 3);
		FlattenConfig config = small().toBuilder().mu(mu).margin(0.05).build();
		FlattenResult r = Flattener.flatten(List.of(primary, TestPoints.uniform("s", 50, 4)), config);
		double minX = 1, maxX = 0;
		for (PointSet s : r.sets()) {
			for (int i = 0; i < s.size(); i++) {
				assertTrue(s.x(i) >= 0.05 - 1e-12 && s.x(i) <= 0.95 + 1e-12);
				assertTrue(s.y(i) >= 0.05 - 1e-12 && s.y(i) <= 0.95 + 1e-12);
				minX = Math.min(minX, s.x(i));
				maxX = Math.max(maxX, s.x(i));
			}
		}
		// the joint box spans the full margin range
		assertEquals(0.05, minX, 1e-12);
		assertEquals(0.95, maxX, 1e-12);
	}

	@Test
	void zeroMuOnlyRescales() {
		PointSet primary = TestPoints.cornerCluster("p", 400, 100, 0.2, 5);
		PointSet out = Flattener.flatten(List.of(primary), small().toBuilder().mu(0).build()).primary();
		double[] xs = primary.xs();
		double min = Arrays.stream(xs).min().getAsDouble();
		double max = Arrays.stream(xs).max().getAsDouble();
		for (int i = 0; i < primary.size(); i++) {
			assertEquals((xs[i] - min) / (max - min) * 0.96 + 0.02, out.x(i), 1e-12);
		}
	}

	@Test
	void flattensCornerCluster() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 7);
		FlattenConfig config = FlattenConfig.builder().mu(0.9).sampleSize(200).neighbours(8).margin(0.02).seed(42).densityGridSize(20).build();
		FlattenResult r = Flattener.flatten(List.of(primary), config);
		RunDiagnostics d = r.diagnostics();

		assertTrue(d.densityBefore.emptyFraction > 0.6, "before " + d.densityBefore.emptyFraction);
		assertTrue(d.densityAfter.emptyFraction < 0.5, "after " + d.densityAfter.emptyFraction);
		assertTrue(d.densityAfter.emptyFraction < d.densityBefore.emptyFraction);
		assertTrue(d.densityAfter.topDecileFraction < d.densityBefore.topDecileFraction);
		assertNotNull(d.coherence);
		assertTrue(d.coherence > 0.1 && d.coherence < 0.9, "coherence " + d.coherence);
	}

	@Test
	void largerSampleFlattensFurther() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 7);
		FlattenConfig config = FlattenConfig.builder().mu(0.9).sampleSize(400).densityGridSize(20).build();
		RunDiagnostics d = Flattener.flatten(List.of(primary), config).diagnostics();
		assertTrue(d.densityAfter.emptyFraction < 0.3, "after " + d.densityAfter.emptyFraction);
		assertEquals(400, d.fieldSize);
	}

	@Test
	void secondaryPointsFollowPrimaryNeighbours() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 8);
		int[] picks = { 3, 150, 899, 901, 990 };
		PointSet secondary = primary.select("copies", picks);
		FlattenResult r = Flattener.flatten(List.of(primary, secondary), small());
		for (int i = 0; i < picks.length; i++) {
			assertEquals(r.primary().x(picks[i]), r.get(1).x(i), 0);
			assertEquals(r.primary().y(picks[i]), r.get(1).y(i), 0);
		}
	}

	@Test
	void nearbyPointsStayNearby() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 9);
		PointSet pair = new PointSet("pair", new double[] { 0.05, 0.05 + 1e-6 }, new double[] { 0.05, 0.05 });
		PointSet out = Flattener.flatten(List.of(primary, pair), small()).get(1);
		assertTrue(Math.hypot(out.x(0) - out.x(1), out.y(0) - out.y(1)) < 1e-3);
	}

	@Test
	void deterministicAndParallelInvariant() {
		PointSet primary = TestPoints.cornerCluster("p", 5500, 500, 0.15, 10);
		FlattenConfig config = FlattenConfig.builder().sampleSize(150).build();
		FlattenResult a = Flattener.flatten(List.of(primary), config);
		FlattenResult b = Flattener.flatten(List.of(primary), config);
		FlattenResult c = Flattener.flatten(List.of(primary), config.toBuilder().parallel(false).build());
		assertEquals(a.primary(), b.primary());
		assertEquals(a.primary(), c.primary());
		assertEquals(a.diagnostics().coherence, c.diagnostics().coherence);
	}

	@Test
	void seedChangesResult() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 7);
		PointSet a = Flattener.flatten(List.of(primary), small()).primary();
		PointSet b = Flattener.flatten(List.of(primary), small().toBuilder().seed(43).build()).primary();
		assertNotEquals(a, b);
	}

	@Test
	void patchedStrategyFlattens() {
		PointSet primary = TestPoints.cornerCluster("p", 700, 100, 0.1, 11);
		FlattenConfig config = small().toBuilder().strategy(FlattenConfig.Strategy.PATCHED).clusterCount(6).maxClusterSize(250).build();
		RunDiagnostics d = Flattener.flatten(List.of(primary), config).diagnostics();
		assertEquals("patched", d.strategy);
		assertEquals(800, d.fieldSize);
		assertTrue(d.densityAfter.emptyFraction < d.densityBefore.emptyFraction);
	}

	@Test
	void patchedKeepsCoincidentPrimaryPointsApart() {
		Random random = new Random(17);
		double[] x = new double[500];
		double[] y = new double[500];
		for (int i = 0; i < 480; i++) {
			x[i] = random.nextDouble() * 0.1;
			y[i] = random.nextDouble() * 0.1;
		}
		for (int i = 480; i < 500; i++) {
			x[i] = x[0];
			y[i] = y[0];
		}
		PointSet primary = new PointSet("p", x, y);
		PointSet secondary = primary.select("copies", new int[] { 0, 480 });
		FlattenConfig config = small().toBuilder().strategy(FlattenConfig.Strategy.PATCHED).mu(1).clusterCount(5).maxClusterSize(200).build();
		FlattenResult r = Flattener.flatten(List.of(primary, secondary), config);

		Set<String> distinct = new HashSet<>();
		distinct.add(r.primary().x(0) + "," + r.primary().y(0));
		for (int i = 480; i < 500; i++) {
			distinct.add(r.primary().x(i) + "," + r.primary().y(i));
		}
		assertEquals(21, distinct.size());
		// secondary points are still interpolated, so coincident ones agree
		assertEquals(r.get(1).x(0), r.get(1).x(1), 0);
		assertEquals(r.get(1).y(0), r.get(1).y(1), 0);
	}

	@Test
	void diagnosticsArePopulated() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 12);
		RunDiagnostics d = Flattener.flatten(List.of(primary), small()).diagnostics();
		assertEquals("subsample", d.strategy);
		assertEquals(200, d.fieldSize);
		assertTrue(d.assignmentCost > 0);
		assertTrue(d.maxDisplacement >= d.meanDisplacement && d.meanDisplacement > 0);
		assertEquals(1000, d.densityBefore.totalPoints);
		assertNotNull(d.normalization);
		assertTrue(d.normalization.maxX > d.normalization.minX);
		assertEquals(List.of("densityBefore", "field", "interpolate", "mixNormalize", "densityAfter", "coherence"),
				List.copyOf(d.stageMillis.keySet()));
		assertThrows(UnsupportedOperationException.class, () -> d.stageMillis.put("x", 1L));
	}

	@Test
	void customStrategyIsUsed() {
		DisplacementStrategy still = new DisplacementStrategy() {
			@Override
			public String name() {
				return "still";
			}

			@Override
			public DisplacementField build(PointSet primary, FlattenConfig config) {
				return new DisplacementField(primary, new double[primary.size()], new double[primary.size()], 0);
			}
		};
		PointSet primary = new PointSet("p", new double[] { 0, 0.5, 1 }, new double[] { 0, 0.25, 1 });
		FlattenResult r = new Flattener(FlattenConfig.builder().mu(1).margin(0).build(), still).flatten(List.of(primary));
		assertEquals(primary.x(1), r.primary().x(1), 1e-12);
		assertEquals(primary.y(1), r.primary().y(1), 1e-12);
		assertEquals("still", r.diagnostics().strategy);
	}

	@Test
	void toleratesCoordinatesOutsideUnitSquare() {
		PointSet primary = TestPoints.cornerCluster("p", 200, 50, 0.1, 13);
		PointSet odd = new PointSet("odd", new double[] { 1.3, -0.2 }, new double[] { 0.5, 1.1 });
		FlattenResult r = Flattener.flatten(List.of(primary, odd), small());
		assertTrue(r.get(1).isWithinUnitSquare(0));
	}

	@Test
	void rejectsDegenerateInput() {
		Flattener f = new Flattener(small());
		assertThrows(DegenerateInputException.class, () -> f.flatten(Collections.emptyList()));
		assertThrows(DegenerateInputException.class, () -> f.flatten(null));
		PointSet one = new PointSet("one", new double[] { 0.5 }, new double[] { 0.5 });
		assertThrows(DegenerateInputException.class, () -> f.flatten(List.of(one)));
		PointSet same = new PointSet("same", new double[] { 0.3, 0.3, 0.3 }, new double[] { 0.7, 0.7, 0.7 });
		assertThrows(DegenerateInputException.class, () -> f.flatten(List.of(same)));
		assertThrows(DegenerateInputException.class, () -> f.flatten(Arrays.asList(TestPoints.uniform("p", 10, 1), null)));
	}

	@Test
	void emptySecondaryIsFine() {
		PointSet primary = TestPoints.uniform("p", 100, 1);
		FlattenResult r = Flattener.flatten(List.of(primary, new PointSet("none", new double[0], new double[0])), small());
		assertEquals(0, r.get(1).size());
	}

	@Test
	void twoPointPrimary() {
		PointSet primary = new PointSet("two", new double[] { 0.1, 0.9 }, new double[] { 0.2, 0.7 });
		FlattenResult r = Flattener.flatten(List.of(primary), small());
		assertEquals(2, r.primary().size());
		assertTrue(r.primary().isWithinUnitSquare(0));
	}

	@Test
	void profileMatchesDiagnostics() {
		PointSet primary = TestPoints.cornerCluster("p", 900, 100, 0.1, 7);
		Flattener f = new Flattener(small());
		DensityStats s = f.profile(primary);
		assertEquals(f.flatten(List.of(primary)).diagnostics().densityBefore.emptyCells, s.emptyCells);
	}
}
