package com.github.micycle1.coordflat;

/**
 * A stage produced values it cannot continue from (non-finite assignment
 * costs, a collapsed bounding box). Fatal for the run; never retried.
 */
public class NumericalFailureException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public NumericalFailureException(String message) {
		super(message);
	}
}
