package com.github.micycle1.coordflat;

/**
 * Joint bounding box of all mixed coordinates, before rescaling.
 */
public final class NormalizationBox {

	public final double minX;
	public final double maxX;
	public final double minY;
	public final double maxY;

	public NormalizationBox(double minX, double maxX, double minY, double maxY) {
		this.minX = minX;
		this.maxX = maxX;
		this.minY = minY;
		this.maxY = maxY;
	}

	@Override
	public String toString() {
		return String.format("x=[%.4f, %.4f], y=[%.4f, %.4f]", minX, maxX, minY, maxY);
	}
}
