package com.github.micycle1.coordflat.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.coordflat.FlattenConfig;
import com.github.micycle1.coordflat.FlattenResult;
import com.github.micycle1.coordflat.Flattener;
import com.github.micycle1.coordflat.InvalidConfigurationException;
import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.diagnostics.DensityStats;
import com.github.micycle1.coordflat.io.PointSetJson;

/**
 * Command-line front end.
 *
 * <pre>
 * coordflat [options] primary.json [secondary.json ...]
 *
 *   --mu X                mixing factor in [0,1]            (0.75)
 *   --sample-size M       representative subsample size     (5000)
 *   --knn K               interpolation neighbours          (8)
 *   --margin X            output margin in [0,0.5)          (0.02)
 *   --seed N              random seed                       (42)
 *   --grid G              density grid size                 (50)
 *   --strategy S          subsample | patched               (subsample)
 *   --clusters K          initial clusters for patched      (100)
 *   --max-cluster-size N  cluster size cap for patched      (2000)
 *   --config FILE         properties file with coordflat.* keys
 *   --sequential          disable data-parallel stages
 *   --out DIR             output directory                  (input dir)
 *   --stats-only          print density of the primary set and exit
 * </pre>
 *
 * Writes {@code <name>_flat.json} per input and {@code diagnostics.json}.
 * Exit codes: 0 success, 1 flattening or I/O failure, 2 usage error.
 */
public final class FlattenCommand {

	private static final Logger LOG = LoggerFactory.getLogger(FlattenCommand.class);

	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private static final Map<String, String> VALUE_FLAGS = new HashMap<>();

	static {
		VALUE_FLAGS.put("--mu", "mu");
		VALUE_FLAGS.put("--sample-size", "sampleSize");
		VALUE_FLAGS.put("--knn", "neighbours");
		VALUE_FLAGS.put("--margin", "margin");
		VALUE_FLAGS.put("--seed", "seed");
		VALUE_FLAGS.put("--grid", "densityGridSize");
		VALUE_FLAGS.put("--strategy", "strategy");
		VALUE_FLAGS.put("--clusters", "clusterCount");
		VALUE_FLAGS.put("--max-cluster-size", "maxClusterSize");
	}

	private final PrintStream out;
	private final PrintStream err;
	private final PointSetJson json = new PointSetJson();

	FlattenCommand(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		System.exit(new FlattenCommand(System.out, System.err).run(args));
	}

	int run(String[] args) {
		Properties props = new Properties();
		List<Path> inputs = new ArrayList<>();
		Path outDir = null;
		Path configFile = null;
		boolean statsOnly = false;

		for (int i = 0; i < args.length; i++) {
			String a = args[i];
			if (VALUE_FLAGS.containsKey(a) || "--out".equals(a) || "--config".equals(a)) {
				if (i + 1 >= args.length) {
					return usage("Missing value for " + a);
				}
				String v = args[++i];
				if ("--out".equals(a)) {
					outDir = Paths.get(v);
				} else if ("--config".equals(a)) {
					configFile = Paths.get(v);
				} else {
					props.setProperty(FlattenConfig.PROPERTY_PREFIX + VALUE_FLAGS.get(a), v);
				}
			} else if ("--sequential".equals(a)) {
				props.setProperty(FlattenConfig.PROPERTY_PREFIX + "parallel", "false");
			} else if ("--stats-only".equals(a)) {
				statsOnly = true;
			} else if ("--help".equals(a) || "-h".equals(a)) {
				printUsage(out);
				return OK;
			} else if (a.startsWith("--")) {
				return usage("Unknown option " + a);
			} else {
				inputs.add(Paths.get(a));
			}
		}
		if (inputs.isEmpty()) {
			return usage("No input files given");
		}

		FlattenConfig config;
		try {
			FlattenConfig.Builder builder = FlattenConfig.builder();
			if (configFile != null) {
				builder.properties(load(configFile));
			}
			// command-line flags win over the config file
			config = builder.properties(props).build();
		} catch (InvalidConfigurationException e) {
			return usage(e.getMessage());
		} catch (UncheckedIOException e) {
			err.println("error: " + e.getMessage());
			return FAILED;
		}

		try {
			List<PointSet> sets = new ArrayList<>(inputs.size());
			for (Path p : inputs) {
				sets.add(json.read(p, baseName(p)));
			}
			Set<String> names = new HashSet<>();
			for (PointSet set : sets) {
				if (!names.add(set.name())) {
					return usage("Duplicate point set name '" + set.name() + "', output files would collide");
				}
			}
			Flattener flattener = new Flattener(config);

			if (statsOnly) {
				DensityStats stats = flattener.profile(sets.get(0));
				out.println(json.toJson(stats));
				return OK;
			}

			FlattenResult result = flattener.flatten(sets);
			Path dir = outDir != null ? outDir : parentOf(inputs.get(0));
			Files.createDirectories(dir);
			for (PointSet flat : result.sets()) {
				Path target = dir.resolve(flat.name() + "_flat.json");
				json.write(flat, target);
				LOG.info("Wrote {} points to {}", flat.size(), target);
			}
			json.writeDiagnostics(result.diagnostics(), dir.resolve("diagnostics.json"));
			out.println("Flattened " + result.sets().size() + " point sets with mu=" + config.mu() + " into " + dir);
			return OK;
		} catch (IllegalArgumentException | IllegalStateException | IOException | UncheckedIOException e) {
			err.println("error: " + e.getMessage());
			return FAILED;
		}
	}

	private static Properties load(Path file) {
		Properties p = new Properties();
		try (InputStream in = Files.newInputStream(file)) {
			p.load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read config file " + file, e);
		}
		return p;
	}

	private static String baseName(Path p) {
		String name = p.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private static Path parentOf(Path p) {
		Path parent = p.toAbsolutePath().getParent();
		return parent != null ? parent : Paths.get(".");
	}

	private int usage(String message) {
		err.println("error: " + message);
		printUsage(err);
		return USAGE;
	}

	private static void printUsage(PrintStream s) {
		s.println("usage: coordflat [options] primary.json [secondary.json ...]");
		s.println("  --mu X --sample-size M --knn K --margin X --seed N --grid G");
		s.println("  --strategy subsample|patched --clusters K --max-cluster-size N");
		s.println("  --config FILE --sequential --out DIR --stats-only");
	}
}
