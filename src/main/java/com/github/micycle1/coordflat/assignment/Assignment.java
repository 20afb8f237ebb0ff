package com.github.micycle1.coordflat.assignment;

/**
 * A one-to-one matching of rows (sources) to columns (targets) and its total
 * cost. {@code rowToColumn[i]} is the column matched to row {@code i}.
 */
public final class Assignment {

	private final int[] rowToColumn;
	private final double totalCost;

	public Assignment(int[] rowToColumn, double totalCost) {
		this.rowToColumn = rowToColumn.clone();
		this.totalCost = totalCost;
	}

	public int size() {
		return rowToColumn.length;
	}

	public int columnOf(int row) {
		return rowToColumn[row];
	}

	public int[] rowToColumn() {
		return rowToColumn.clone();
	}

	public double totalCost() {
		return totalCost;
	}

	/** True if every column in {@code [0, size)} appears exactly once. */
	public boolean isPermutation() {
		boolean[] seen = new boolean[rowToColumn.length];
		for (int c : rowToColumn) {
			if (c < 0 || c >= seen.length || seen[c]) {
				return false;
			}
			seen[c] = true;
		}
		return true;
	}
}
