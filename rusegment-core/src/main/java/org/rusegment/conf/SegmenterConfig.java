package org.rusegment.conf;

/*
 * This file is part of RuSegment.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * RuSegment is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * RuSegment is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with RuSegment.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.rusegment.util.Logger;

/**
 * Loads engine configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/rusegment.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>rusegment.config</code> to a readable path, or by using the
 * {@link #SegmenterConfig(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Every key is optional; getters fall back to the defaults the rule
 * engine was tuned with.</li>
 * <li>Malformed or non-positive integers are logged and replaced by the
 * default.</li>
 * <li>Files are read as UTF-8, so Cyrillic abbreviations can be written
 * as-is.</li>
 * <li>Use {@link #validate()} to list problems without failing.</li>
 * </ul>
 */
public final class SegmenterConfig {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/rusegment.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "rusegment.config";

	public static final int DEFAULT_ABBREVIATION_LOOKBACK = 10;
	public static final int DEFAULT_INITIALS_WINDOW = 20;

	// ---- Property keys --------------------------------------------------------
	static final String K_ABBREVIATION_LOOKBACK = "ABBREVIATION_LOOKBACK";
	static final String K_INITIALS_WINDOW = "INITIALS_WINDOW";
	static final String K_ABBREVIATION_REQUIRE_WORD_START = "ABBREVIATION_REQUIRE_WORD_START";
	static final String K_EXTRA_ABBREVIATIONS = "EXTRA_ABBREVIATIONS";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a config that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If the system property
	 * {@value #SYS_PROP_CONFIG_PATH} names a readable file, that file is used
	 * instead.
	 */
	public SegmenterConfig() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a config that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public SegmenterConfig(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	private SegmenterConfig(Properties source) {
		if (source != null) {
			properties.putAll(source);
		}
	}

	/** Config backed by in-memory properties; missing keys use defaults. */
	public static SegmenterConfig of(Properties source) {
		return new SegmenterConfig(source);
	}

	/** Config with every key at its default. */
	public static SegmenterConfig defaults() {
		return new SegmenterConfig(new Properties());
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Lists configuration problems as human-readable strings. Does not throw;
	 * an empty list means every present key parsed cleanly.
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		requirePositiveInt(K_ABBREVIATION_LOOKBACK, issues);
		requirePositiveInt(K_INITIALS_WINDOW, issues);

		String flag = getOptional(K_ABBREVIATION_REQUIRE_WORD_START, null);
		if (flag != null && !"true".equalsIgnoreCase(flag) && !"false".equalsIgnoreCase(flag)) {
			issues.add(K_ABBREVIATION_REQUIRE_WORD_START + " must be true or false, found '" + flag + "'.");
		}
		for (String abbr : getExtraAbbreviations()) {
			if (abbr.endsWith(".")) {
				issues.add("Extra abbreviation '" + abbr + "' should be listed without its trailing period.");
			}
		}
		return issues;
	}

	/** Longest substring, in code points, tried against the abbreviation set. */
	public int getAbbreviationLookback() {
		return getPositiveInt(K_ABBREVIATION_LOOKBACK, DEFAULT_ABBREVIATION_LOOKBACK);
	}

	/** Half-width, in code points, of the initials context window. */
	public int getInitialsWindow() {
		return getPositiveInt(K_INITIALS_WINDOW, DEFAULT_INITIALS_WINDOW);
	}

	public boolean isAbbreviationRequireWordStart() {
		return Boolean.parseBoolean(getOptional(K_ABBREVIATION_REQUIRE_WORD_START, "false"));
	}

	/** Abbreviations added on top of the bundled lexicon, in file order. */
	public Set<String> getExtraAbbreviations() {
		String raw = getOptional(K_EXTRA_ABBREVIATIONS, "");
		Set<String> out = new LinkedHashSet<>();
		Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(out::add);
		return out;
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getPositiveInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			int val = Integer.parseInt(raw);
			if (val <= 0) {
				Logger.warn("Non-positive value for {}: {}. Using default {}", key, val, defaultVal);
				return defaultVal;
			}
			return val;
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private void requirePositiveInt(String key, List<String> issues) {
		String raw = getOptional(key, null);
		if (raw == null)
			return;
		try {
			if (Integer.parseInt(raw) <= 0) {
				issues.add(key + " must be a positive integer, found " + raw + ".");
			}
		} catch (NumberFormatException nfe) {
			issues.add(key + " is not an integer: '" + raw + "'.");
		}
	}
}
