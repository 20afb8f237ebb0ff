package com.github.micycle1.coordflat;

/**
 * The input point collections cannot be flattened meaningfully: missing or
 * too small primary set, coincident points, or non-finite coordinates.
 */
public class DegenerateInputException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public DegenerateInputException(String message) {
		super(message);
	}
}
