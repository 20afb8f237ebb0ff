package com.github.micycle1.coordflat.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.micycle1.coordflat.PointSet;
import com.github.micycle1.coordflat.diagnostics.RunDiagnostics;

/**
 * JSON codec for point sets and run diagnostics.
 *
 * Point set shape:
 *
 * <pre>
 * { "name": "articles", "points": [ [0.12, 0.80], [0.13, 0.79], ... ] }
 * </pre>
 *
 * Unknown fields are skipped. If {@code name} is absent the caller's default
 * is used. Points are streamed, so large files are read without building a
 * tree.
 */
public final class PointSetJson {

	private final ObjectMapper mapper;

	public PointSetJson() {
		this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	}

	public PointSet read(Path file, String defaultName) {
		try (InputStream in = Files.newInputStream(file)) {
			return read(in, defaultName);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read point set from " + file, e);
		}
	}

	public PointSet read(InputStream in, String defaultName) throws IOException {
		JsonFactory factory = mapper.getFactory();
		try (JsonParser p = factory.createParser(in)) {
			if (p.nextToken() != JsonToken.START_OBJECT) {
				throw new IllegalArgumentException("Point set JSON must be an object with a 'points' array");
			}
			String name = defaultName;
			double[] xs = null;
			double[] ys = null;
			while (p.nextToken() != JsonToken.END_OBJECT) {
				String field = p.currentName();
				p.nextToken(); // move to value
				if ("name".equals(field)) {
					name = p.getValueAsString(defaultName);
				} else if ("points".equals(field)) {
					double[][] xy = readPoints(p);
					xs = xy[0];
					ys = xy[1];
				} else {
					p.skipChildren();
				}
			}
			if (xs == null) {
				throw new IllegalArgumentException("Missing 'points' array in point set '" + name + "'");
			}
			return new PointSet(name, xs, ys);
		}
	}

	private static double[][] readPoints(JsonParser p) throws IOException {
		if (p.currentToken() != JsonToken.START_ARRAY) {
			throw new IllegalArgumentException("'points' must be an array of [x, y] pairs");
		}
		int capacity = 1024;
		double[] xs = new double[capacity];
		double[] ys = new double[capacity];
		int size = 0;
		while (p.nextToken() != JsonToken.END_ARRAY) {
			if (p.currentToken() != JsonToken.START_ARRAY) {
				throw new IllegalArgumentException("Point " + size + " is not an [x, y] array");
			}
			double x = readNumber(p, size);
			double y = readNumber(p, size);
			if (p.nextToken() != JsonToken.END_ARRAY) {
				throw new IllegalArgumentException("Point " + size + " has more than two coordinates");
			}
			if (size == capacity) {
				capacity *= 2;
				xs = Arrays.copyOf(xs, capacity);
				ys = Arrays.copyOf(ys, capacity);
			}
			xs[size] = x;
			ys[size] = y;
			size++;
		}
		return new double[][] { Arrays.copyOf(xs, size), Arrays.copyOf(ys, size) };
	}

	private static double readNumber(JsonParser p, int point) throws IOException {
		JsonToken t = p.nextToken();
		if (t == null || !t.isNumeric()) {
			throw new IllegalArgumentException("Point " + point + " must hold two numbers");
		}
		return p.getDoubleValue();
	}

	public void write(PointSet points, Path file) {
		try (OutputStream out = Files.newOutputStream(file)) {
			write(points, out);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write point set to " + file, e);
		}
	}

	public void write(PointSet points, OutputStream out) throws IOException {
		try (JsonGenerator g = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
			g.writeStartObject();
			g.writeStringField("name", points.name());
			g.writeNumberField("size", points.size());
			g.writeArrayFieldStart("points");
			for (int i = 0; i < points.size(); i++) {
				g.writeStartArray();
				g.writeNumber(points.x(i));
				g.writeNumber(points.y(i));
				g.writeEndArray();
			}
			g.writeEndArray();
			g.writeEndObject();
		}
	}

	public void writeDiagnostics(RunDiagnostics diagnostics, Path file) {
		try {
			mapper.writeValue(file.toFile(), diagnostics);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write diagnostics to " + file, e);
		}
	}

	public String toJson(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to serialise " + value.getClass().getSimpleName(), e);
		}
	}
}
