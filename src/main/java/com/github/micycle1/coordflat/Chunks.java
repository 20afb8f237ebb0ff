package com.github.micycle1.coordflat;

import java.util.stream.IntStream;

/**
 * Splits {@code [0, n)} into fixed-size index ranges and runs a task on each,
 * optionally on the common fork-join pool. Chunk boundaries depend only on
 * {@code n}, so tasks that write disjoint output slots give identical results
 * in either mode.
 */
public final class Chunks {

	/** Range size; below this a stage runs on the calling thread regardless. */
	public static final int CHUNK = 4096;

	@FunctionalInterface
	public interface RangeTask {
		void run(int from, int to);
	}

	private Chunks() {
	}

	public static void forEach(int n, boolean parallel, RangeTask task) {
		if (n <= 0) {
			return;
		}
		int chunks = (n + CHUNK - 1) / CHUNK;
		if (!parallel || chunks == 1) {
			for (int c = 0; c < chunks; c++) {
				task.run(c * CHUNK, Math.min(n, (c + 1) * CHUNK));
			}
			return;
		}
		IntStream.range(0, chunks).parallel().forEach(c -> task.run(c * CHUNK, Math.min(n, (c + 1) * CHUNK)));
	}
}
