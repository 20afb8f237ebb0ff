package com.github.micycle1.coordflat.diagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.micycle1.coordflat.NormalizationBox;

/**
 * Summary of one flattening run, produced once and never modified.
 * <p>
 * Displacement figures are over the field vectors, before mixing. The density
 * and coherence entries are best-effort and {@code null} when they could not
 * be computed.
 */
public final class RunDiagnostics {

	public final String strategy;
	public final int fieldSize;
	public final double assignmentCost;
	public final double meanDisplacement;
	public final double medianDisplacement;
	public final double maxDisplacement;
	public final DensityStats densityBefore;
	public final DensityStats densityAfter;
	public final Double coherence;
	public final NormalizationBox normalization;
	/** Wall-clock milliseconds per stage, in execution order. */
	public final Map<String, Long> stageMillis;

	public RunDiagnostics(String strategy, int fieldSize, double assignmentCost, double meanDisplacement, double medianDisplacement,
			double maxDisplacement, DensityStats densityBefore, DensityStats densityAfter, Double coherence, NormalizationBox normalization,
			Map<String, Long> stageMillis) {
		this.strategy = strategy;
		this.fieldSize = fieldSize;
		this.assignmentCost = assignmentCost;
		this.meanDisplacement = meanDisplacement;
		this.medianDisplacement = medianDisplacement;
		this.maxDisplacement = maxDisplacement;
		this.densityBefore = densityBefore;
		this.densityAfter = densityAfter;
		this.coherence = coherence;
		this.normalization = normalization;
		this.stageMillis = Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
	}

	@Override
	public String toString() {
		return "RunDiagnostics{strategy=" + strategy + ", fieldSize=" + fieldSize + ", assignmentCost=" + assignmentCost + ", meanDisplacement="
				+ meanDisplacement + ", medianDisplacement=" + medianDisplacement + ", maxDisplacement=" + maxDisplacement + ", densityBefore="
				+ densityBefore + ", densityAfter=" + densityAfter + ", coherence=" + coherence + ", normalization=" + normalization + "}";
	}
}
