package com.github.micycle1.coordflat.sampling;

import com.github.micycle1.coordflat.PointSet;

/**
 * Picks a subset of a point set that stands in for the whole cloud in the
 * assignment step.
 * <p>
 * Conventions:
 * <ul>
 * <li>Returned indices are distinct and index into {@code points}.</li>
 * <li>If {@code m >= points.size()} every index is returned, in order.</li>
 * <li>The result is deterministic for a given sampler instance and input.</li>
 * </ul>
 */
public interface RepresentativeSampler {

	int[] sample(PointSet points, int m);
}
