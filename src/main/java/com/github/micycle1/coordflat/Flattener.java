package com.github.micycle1.coordflat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.diagnostics.CoherenceValidator;
import com.github.micycle1.coordflat.diagnostics.DensityProfiler;
import com.github.micycle1.coordflat.diagnostics.DensityStats;
import com.github.micycle1.coordflat.diagnostics.RunDiagnostics;
import com.github.micycle1.coordflat.field.DisplacementField;
import com.github.micycle1.coordflat.field.DisplacementInterpolator;
import com.github.micycle1.coordflat.strategy.DisplacementStrategy;

/**
 * <p>
 * Density flattening of 2D layouts by approximate optimal transport.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>Builds a displacement field from the primary point set (by default:
 * farthest-point subsample, Halton targets, exact assignment).</li>
 * <li>Interpolates the field at every point of every set by inverse-distance
 * weighting of nearest field vectors; a per-point field (patched strategy)
 * moves the primary set by its own vectors and is interpolated for secondary
 * sets only.</li>
 * <li>Mixes {@code p + mu * d} and renormalises all sets jointly into
 * {@code [margin, 1 - margin]^2}.</li>
 * <li>Reports grid density before and after and a neighbourhood coherence
 * score.</li>
 * </ul>
 *
 * <p>
 * Key usage pattern:
 * </p>
 * <ol>
 * <li>Build a {@link FlattenConfig}.</li>
 * <li>Call {@link #flatten(List)} with the primary set first and any secondary
 * sets after it.</li>
 * <li>Read the flattened sets (same order, names, lengths) and the
 * {@link RunDiagnostics} from the {@link FlattenResult}.</li>
 * </ol>
 *
 * <p>
 * Notes:
 * </p>
 * <ul>
 * <li>The run is all-or-nothing: invalid configuration, degenerate input or a
 * numerical failure throws and no partial output is returned.</li>
 * <li>Diagnostics never fail a run; a diagnostic that cannot be computed is
 * logged and left {@code null}.</li>
 * <li>Identical inputs and config give identical output, with or without
 * {@link FlattenConfig#parallel()}.</li>
 * <li>Instances hold no state between calls and may be shared.</li>
 * </ul>
 */
public final class Flattener {

	private static final Logger LOG = LoggerFactory.getLogger(Flattener.class);

	// input overshoot beyond [0,1] tolerated silently
	private static final double RANGE_TOLERANCE = 1e-6;

	private final FlattenConfig config;
	private final DisplacementStrategy strategy;

	public Flattener(FlattenConfig config) {
		this(config, DisplacementStrategy.forConfig(config));
	}

	public Flattener(FlattenConfig config, DisplacementStrategy strategy) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
	}

	public static FlattenResult flatten(List<PointSet> sets, FlattenConfig config) {
		return new Flattener(config).flatten(sets);
	}

	public FlattenConfig config() {
		return config;
	}

	/**
	 * Flattens {@code sets}; {@code sets.get(0)} is the primary set.
	 */
	public FlattenResult flatten(List<PointSet> sets) {
		validate(sets);
		final PointSet primary = sets.get(0);
		final Map<String, Long> timings = new LinkedHashMap<>();

		LOG.info("Flattening {} primary and {} secondary sets with {}", primary.size(), sets.size() - 1, config);

		long t0 = System.nanoTime();
		DensityStats before = profileQuietly(primary, "before");
		timings.put("densityBefore", millisSince(t0));
		if (before != null) {
			LOG.info("Density before: {}", before);
		}

		t0 = System.nanoTime();
		DisplacementField field = strategy.build(primary, config);
		timings.put("field", millisSince(t0));
		if (field.isPerPoint() && field.size() != primary.size()) {
			throw new IllegalStateException("Per-point field has " + field.size() + " vectors for " + primary.size() + " primary points");
		}
		final double meanDisp = field.meanMagnitude();
		final double medianDisp = field.medianMagnitude();
		final double maxDisp = field.maxMagnitude();
		LOG.info("Displacement field ({}): {} vectors, mean={}, max={}", strategy.name(), field.size(), String.format("%.4f", meanDisp),
				String.format("%.4f", maxDisp));

		t0 = System.nanoTime();
		DisplacementInterpolator interpolator = new DisplacementInterpolator(field, config.neighbours(), config.idwEpsilon(), config.parallel());
		List<double[][]> displacements = new ArrayList<>(sets.size());
		for (int i = 0; i < sets.size(); i++) {
			if (i == 0 && field.isPerPoint()) {
				displacements.add(field.vectors());
			} else {
				displacements.add(interpolator.interpolate(sets.get(i)));
			}
		}
		timings.put("interpolate", millisSince(t0));

		t0 = System.nanoTime();
		MixNormalizer.Result mixed = new MixNormalizer(config.mu(), config.margin()).apply(sets, displacements);
		timings.put("mixNormalize", millisSince(t0));
		LOG.info("Renormalised from joint box {}", mixed.box);

		final PointSet flatPrimary = mixed.sets.get(0);

		t0 = System.nanoTime();
		DensityStats after = profileQuietly(flatPrimary, "after");
		timings.put("densityAfter", millisSince(t0));
		if (before != null && after != null) {
			LOG.info("Density after: {} (empty cells {}% -> {}%)", after, String.format("%.1f", 100 * before.emptyFraction),
					String.format("%.1f", 100 * after.emptyFraction));
		}

		t0 = System.nanoTime();
		Double coherence = coherenceQuietly(primary, flatPrimary);
		timings.put("coherence", millisSince(t0));

		RunDiagnostics diagnostics = new RunDiagnostics(strategy.name(), field.size(), field.assignmentCost(), meanDisp, medianDisp, maxDisp, before,
				after, coherence, mixed.box, timings);
		return new FlattenResult(mixed.sets, diagnostics);
	}

	/**
	 * Density statistics of {@code points} alone, without flattening.
	 */
	public DensityStats profile(PointSet points) {
		return new DensityProfiler(config.densityGridSize()).profile(points);
	}

	private void validate(List<PointSet> sets) {
		if (sets == null || sets.isEmpty()) {
			throw new DegenerateInputException("No point sets given; the first set is the primary");
		}
		for (int i = 0; i < sets.size(); i++) {
			if (sets.get(i) == null) {
				throw new DegenerateInputException("Point set " + i + " is null");
			}
		}
		PointSet primary = sets.get(0);
		if (primary.size() < 2) {
			throw new DegenerateInputException("Primary set '" + primary.name() + "' needs at least 2 points, has " + primary.size());
		}
		boolean distinct = false;
		for (int i = 1; i < primary.size() && !distinct; i++) {
			distinct = primary.x(i) != primary.x(0) || primary.y(i) != primary.y(0);
		}
		if (!distinct) {
			throw new DegenerateInputException("All points of primary set '" + primary.name() + "' coincide");
		}
		for (PointSet set : sets) {
			if (!set.isWithinUnitSquare(RANGE_TOLERANCE)) {
				LOG.warn("Point set '{}' has coordinates outside [0,1]; they are clamped only after flattening", set.name());
			}
		}
		if (config.sampleSize() >= primary.size() && config.strategy() == FlattenConfig.Strategy.SUBSAMPLE) {
			LOG.info("Sample size {} >= {} primary points; using every point", config.sampleSize(), primary.size());
		}
	}

	private DensityStats profileQuietly(PointSet points, String label) {
		try {
			return profile(points);
		} catch (RuntimeException e) {
			LOG.warn("Could not compute density statistics ({}); omitting them", label, e);
			return null;
		}
	}

	private Double coherenceQuietly(PointSet original, PointSet flattened) {
		try {
			double score = new CoherenceValidator(config.coherenceK(), config.coherenceSampleSize(), config.seed()).score(original, flattened);
			if (score < 0.3) {
				LOG.warn("Coherence {} (k={}) is low; mu={} may be too aggressive", String.format("%.3f", score), config.coherenceK(), config.mu());
			} else if (score > 0.8) {
				LOG.info("Coherence {} (k={}) is very high; density may not be flattened enough", String.format("%.3f", score), config.coherenceK());
			} else {
				LOG.info("Coherence {} (k={})", String.format("%.3f", score), config.coherenceK());
			}
			return score;
		} catch (RuntimeException e) {
			LOG.warn("Could not compute coherence; omitting it", e);
			return null;
		}
	}

	private static long millisSince(long t0) {
		return (System.nanoTime() - t0) / 1_000_000L;
	}
}
