package com.github.micycle1.coordflat.strategy;

import com.github.micycle1.coordflat.FlattenConfig;
import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.field.DisplacementField;

/**
 * Builds the displacement field for a primary point set: a pairing of a way to
 * choose source points with a way to match them to uniform targets.
 * <p>
 * Everything downstream (interpolation, mixing, diagnostics) only sees the
 * resulting {@link DisplacementField}, so strategies are interchangeable.
 */
public interface DisplacementStrategy {

	/** Short name recorded in the run diagnostics. */
	String name();

	DisplacementField build(PointSet primary, FlattenConfig config);

	/** The strategy selected by {@link FlattenConfig#strategy()}. */
	static DisplacementStrategy forConfig(FlattenConfig config) {
		switch (config.strategy()) {
			case PATCHED:
				return new PatchedStrategy();
			case SUBSAMPLE:
			default:
				return new SubsampleStrategy();
		}
	}
}
