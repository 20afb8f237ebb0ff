package com.github.micycle1.coordflat;

/**
 * A {@link FlattenConfig} parameter is outside its valid range.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidConfigurationException(String message) {
		super(message);
	}
}
