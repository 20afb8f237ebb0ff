package com.github.micycle1.coordflat;

import java.util.Locale;
import java.util.Properties;

/**
 * Immutable parameters for one {@link Flattener} run.
 * <p>
 * Obtain instances through {@link #builder()}; {@link Builder#build()}
 * validates every parameter and throws {@link InvalidConfigurationException}
 * on the first violation. Defaults reproduce the values the flattening was
 * tuned with on a ~250k point map; they are starting points, not derived
 * constants, and should be checked against the coherence score on new data.
 * <p>
 * Only {@link #sampleSize()} has superlinear cost (the assignment is cubic in
 * it), so it is the knob for bounding wall-clock time and memory.
 */
public final class FlattenConfig {

	/**
	 * How the displacement field is built from the primary points.
	 */
	public enum Strategy {
		/** Farthest-point subsample + one exact assignment on M points. */
		SUBSAMPLE,
		/** k-means partition + one exact assignment per cluster over all points. */
		PATCHED
	}

	/** Prefix of the keys read by {@link Builder#properties(Properties)}. */
	public static final String PROPERTY_PREFIX = "coordflat.";

	/** Largest accepted {@link #densityGridSize()}; G x G cells must fit an int array. */
	public static final int MAX_DENSITY_GRID_SIZE = 4096;

	private final double mu;
	private final int sampleSize;
	private final int neighbours;
	private final double margin;
	private final long seed;
	private final int haltonBaseX;
	private final int haltonBaseY;
	private final double idwEpsilon;
	private final int densityGridSize;
	private final int coherenceK;
	private final int coherenceSampleSize;
	private final Strategy strategy;
	private final int clusterCount;
	private final int maxClusterSize;
	private final int maxKMeansIterations;
	private final boolean parallel;

	private FlattenConfig(Builder b) {
		this.mu = b.mu;
		this.sampleSize = b.sampleSize;
		this.neighbours = b.neighbours;
		this.margin = b.margin;
		this.seed = b.seed;
		this.haltonBaseX = b.haltonBaseX;
		this.haltonBaseY = b.haltonBaseY;
		this.idwEpsilon = b.idwEpsilon;
		this.densityGridSize = b.densityGridSize;
		this.coherenceK = b.coherenceK;
		this.coherenceSampleSize = b.coherenceSampleSize;
		this.strategy = b.strategy;
		this.clusterCount = b.clusterCount;
		this.maxClusterSize = b.maxClusterSize;
		this.maxKMeansIterations = b.maxKMeansIterations;
		this.parallel = b.parallel;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Config with every parameter at its default. */
	public static FlattenConfig defaults() {
		return builder().build();
	}

	/** A builder pre-filled with this config's values. */
	public Builder toBuilder() {
		Builder b = new Builder();
		b.mu = mu;
		b.sampleSize = sampleSize;
		b.neighbours = neighbours;
		b.margin = margin;
		b.seed = seed;
		b.haltonBaseX = haltonBaseX;
		b.haltonBaseY = haltonBaseY;
		b.idwEpsilon = idwEpsilon;
		b.densityGridSize = densityGridSize;
		b.coherenceK = coherenceK;
		b.coherenceSampleSize = coherenceSampleSize;
		b.strategy = strategy;
		b.clusterCount = clusterCount;
		b.maxClusterSize = maxClusterSize;
		b.maxKMeansIterations = maxKMeansIterations;
		b.parallel = parallel;
		return b;
	}

	/** Mixing factor in [0,1]: 0 keeps the input, 1 applies the full displacement. */
	public double mu() {
		return mu;
	}

	/** Representative subsample size M for {@link Strategy#SUBSAMPLE}. */
	public int sampleSize() {
		return sampleSize;
	}

	/** k for displacement interpolation. */
	public int neighbours() {
		return neighbours;
	}

	/** Inset of targets and of the final layout from the unit square edges. */
	public double margin() {
		return margin;
	}

	/** Seeds the farthest-point start, k-means seeding and coherence sampling. */
	public long seed() {
		return seed;
	}

	public int haltonBaseX() {
		return haltonBaseX;
	}

	public int haltonBaseY() {
		return haltonBaseY;
	}

	/** Added to neighbour distances before inverting them. */
	public double idwEpsilon() {
		return idwEpsilon;
	}

	public int densityGridSize() {
		return densityGridSize;
	}

	public int coherenceK() {
		return coherenceK;
	}

	public int coherenceSampleSize() {
		return coherenceSampleSize;
	}

	public Strategy strategy() {
		return strategy;
	}

	/** Initial k-means cluster count for {@link Strategy#PATCHED}. */
	public int clusterCount() {
		return clusterCount;
	}

	/** Largest cluster a single {@link Strategy#PATCHED} assignment may solve. */
	public int maxClusterSize() {
		return maxClusterSize;
	}

	public int maxKMeansIterations() {
		return maxKMeansIterations;
	}

	/** Whether data-parallel stages may use the common fork-join pool. */
	public boolean parallel() {
		return parallel;
	}

	@Override
	public String toString() {
		return "FlattenConfig{mu=" + mu + ", sampleSize=" + sampleSize + ", neighbours=" + neighbours + ", margin=" + margin + ", seed=" + seed
				+ ", haltonBases=(" + haltonBaseX + "," + haltonBaseY + "), idwEpsilon=" + idwEpsilon + ", densityGridSize=" + densityGridSize
				+ ", coherenceK=" + coherenceK + ", coherenceSampleSize=" + coherenceSampleSize + ", strategy=" + strategy + ", clusterCount="
				+ clusterCount + ", maxClusterSize=" + maxClusterSize + ", maxKMeansIterations=" + maxKMeansIterations + ", parallel=" + parallel
				+ "}";
	}

	public static final class Builder {

		private double mu = 0.75;
		private int sampleSize = 5000;
		private int neighbours = 8;
		private double margin = 0.02;
		private long seed = 42L;
		private int haltonBaseX = 2;
		private int haltonBaseY = 3;
		private double idwEpsilon = 1e-10;
		private int densityGridSize = 50;
		private int coherenceK = 10;
		private int coherenceSampleSize = 5000;
		private Strategy strategy = Strategy.SUBSAMPLE;
		private int clusterCount = 100;
		private int maxClusterSize = 2000;
		private int maxKMeansIterations = 50;
		private boolean parallel = true;

		private Builder() {
		}

		public Builder mu(double mu) {
			this.mu = mu;
			return this;
		}

		public Builder sampleSize(int sampleSize) {
			this.sampleSize = sampleSize;
			return this;
		}

		public Builder neighbours(int neighbours) {
			this.neighbours = neighbours;
			return this;
		}

		public Builder margin(double margin) {
			this.margin = margin;
			return this;
		}

		public Builder seed(long seed) {
			this.seed = seed;
			return this;
		}

		public Builder haltonBases(int baseX, int baseY) {
			this.haltonBaseX = baseX;
			this.haltonBaseY = baseY;
			return this;
		}

		public Builder idwEpsilon(double idwEpsilon) {
			this.idwEpsilon = idwEpsilon;
			return this;
		}

		public Builder densityGridSize(int densityGridSize) {
			this.densityGridSize = densityGridSize;
			return this;
		}

		public Builder coherenceK(int coherenceK) {
			this.coherenceK = coherenceK;
			return this;
		}

		public Builder coherenceSampleSize(int coherenceSampleSize) {
			this.coherenceSampleSize = coherenceSampleSize;
			return this;
		}

		public Builder strategy(Strategy strategy) {
			this.strategy = strategy;
			return this;
		}

		public Builder clusterCount(int clusterCount) {
			this.clusterCount = clusterCount;
			return this;
		}

		public Builder maxClusterSize(int maxClusterSize) {
			this.maxClusterSize = maxClusterSize;
			return this;
		}

		public Builder maxKMeansIterations(int maxKMeansIterations) {
			this.maxKMeansIterations = maxKMeansIterations;
			return this;
		}

		public Builder parallel(boolean parallel) {
			this.parallel = parallel;
			return this;
		}

		/**
		 * Overrides fields from {@code coordflat.*} keys, e.g.
		 * {@code coordflat.mu=0.6}, {@code coordflat.sampleSize=3000},
		 * {@code coordflat.haltonBases=2,3}, {@code coordflat.strategy=patched}.
		 * Absent keys leave the current value untouched.
		 */
		public Builder properties(Properties props) {
			String v;
			if ((v = value(props, "mu")) != null) {
				mu = parseDouble("mu", v);
			}
			if ((v = value(props, "sampleSize")) != null) {
				sampleSize = parseInt("sampleSize", v);
			}
			if ((v = value(props, "neighbours")) != null) {
				neighbours = parseInt("neighbours", v);
			}
			if ((v = value(props, "margin")) != null) {
				margin = parseDouble("margin", v);
			}
			if ((v = value(props, "seed")) != null) {
				try {
					seed = Long.parseLong(v);
				} catch (NumberFormatException e) {
					throw new InvalidConfigurationException("seed is not an integer: " + v);
				}
			}
			if ((v = value(props, "haltonBases")) != null) {
				String[] parts = v.split(",");
				if (parts.length != 2) {
					throw new InvalidConfigurationException("haltonBases must be two comma-separated integers: " + v);
				}
				haltonBaseX = parseInt("haltonBases", parts[0]);
				haltonBaseY = parseInt("haltonBases", parts[1]);
			}
			if ((v = value(props, "idwEpsilon")) != null) {
				idwEpsilon = parseDouble("idwEpsilon", v);
			}
			if ((v = value(props, "densityGridSize")) != null) {
				densityGridSize = parseInt("densityGridSize", v);
			}
			if ((v = value(props, "coherenceK")) != null) {
				coherenceK = parseInt("coherenceK", v);
			}
			if ((v = value(props, "coherenceSampleSize")) != null) {
				coherenceSampleSize = parseInt("coherenceSampleSize", v);
			}
			if ((v = value(props, "strategy")) != null) {
				try {
					strategy = Strategy.valueOf(v.toUpperCase(Locale.ROOT));
				} catch (IllegalArgumentException e) {
					throw new InvalidConfigurationException("Unknown strategy: " + v);
				}
			}
			if ((v = value(props, "clusterCount")) != null) {
				clusterCount = parseInt("clusterCount", v);
			}
			if ((v = value(props, "maxClusterSize")) != null) {
				maxClusterSize = parseInt("maxClusterSize", v);
			}
			if ((v = value(props, "maxKMeansIterations")) != null) {
				maxKMeansIterations = parseInt("maxKMeansIterations", v);
			}
			if ((v = value(props, "parallel")) != null) {
				parallel = Boolean.parseBoolean(v);
			}
			return this;
		}

		public FlattenConfig build() {
			if (!Double.isFinite(mu) || mu < 0 || mu > 1) {
				throw new InvalidConfigurationException("mu must be in [0,1], got " + mu);
			}
			if (sampleSize <= 0) {
				throw new InvalidConfigurationException("sampleSize must be positive, got " + sampleSize);
			}
			if (neighbours <= 0) {
				throw new InvalidConfigurationException("neighbours must be positive, got " + neighbours);
			}
			if (!Double.isFinite(margin) || margin < 0 || margin >= 0.5) {
				throw new InvalidConfigurationException("margin must be in [0,0.5), got " + margin);
			}
			if (haltonBaseX < 2 || haltonBaseY < 2 || gcd(haltonBaseX, haltonBaseY) != 1) {
				throw new InvalidConfigurationException("Halton bases must be coprime integers >= 2, got " + haltonBaseX + "," + haltonBaseY);
			}
			if (!Double.isFinite(idwEpsilon) || idwEpsilon <= 0) {
				throw new InvalidConfigurationException("idwEpsilon must be positive, got " + idwEpsilon);
			}
			if (densityGridSize <= 0 || densityGridSize > MAX_DENSITY_GRID_SIZE) {
				throw new InvalidConfigurationException(
						"densityGridSize must be in [1, " + MAX_DENSITY_GRID_SIZE + "], got " + densityGridSize);
			}
			if (coherenceK <= 0 || coherenceSampleSize <= 0) {
				throw new InvalidConfigurationException("coherenceK and coherenceSampleSize must be positive");
			}
			if (strategy == null) {
				throw new InvalidConfigurationException("strategy must not be null");
			}
			if (clusterCount <= 0 || maxClusterSize <= 0 || maxKMeansIterations <= 0) {
				throw new InvalidConfigurationException("clusterCount, maxClusterSize and maxKMeansIterations must be positive");
			}
			return new FlattenConfig(this);
		}

		private static String value(Properties props, String key) {
			String v = props.getProperty(PROPERTY_PREFIX + key);
			return v == null ? null : v.trim();
		}

		private static double parseDouble(String key, String v) {
			try {
				return Double.parseDouble(v.trim());
			} catch (NumberFormatException e) {
				throw new InvalidConfigurationException(key + " is not a number: " + v);
			}
		}

		private static int parseInt(String key, String v) {
			try {
				return Integer.parseInt(v.trim());
			} catch (NumberFormatException e) {
				throw new InvalidConfigurationException(key + " is not an integer: " + v);
			}
		}

		private static int gcd(int a, int b) {
			while (b != 0) {
				int t = a % b;
				a = b;
				b = t;
			}
			return a;
		}
	}
}
