package com.github.micycle1.coordflat;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.coordflat.diagnostics.RunDiagnostics;

/**
 * Flattened point sets, in the order and with the names of the input, plus
 * the run's diagnostics.
 */
public final class FlattenResult {

	private final List<PointSet> sets;
	private final RunDiagnostics diagnostics;

	FlattenResult(List<PointSet> sets, RunDiagnostics diagnostics) {
		this.sets = Collections.unmodifiableList(sets);
		this.diagnostics = diagnostics;
	}

	public List<PointSet> sets() {
		return sets;
	}

	public PointSet primary() {
		return sets.get(0);
	}

	public PointSet get(int i) {
		return sets.get(i);
	}

	public RunDiagnostics diagnostics() {
		return diagnostics;
	}
}
