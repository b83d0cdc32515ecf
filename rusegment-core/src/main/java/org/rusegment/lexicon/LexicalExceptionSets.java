package org.rusegment.lexicon;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.rusegment.util.Logger;

/**
 * The three lexical exception sets consulted by the segmenter: abbreviations
 * (blocking), honorific titles and speech-reporting verbs.
 * <p>
 * Each set ships as a UTF-8 classpath resource under {@code lexicon/}, one
 * entry per line. Lines starting with '#' and blank lines are ignored.
 * Instances are immutable; every engine builds its own.
 */
public final class LexicalExceptionSets {

	public static final String ABBREVIATIONS_RESOURCE = "lexicon/abbreviations.txt";
	public static final String TITLES_RESOURCE = "lexicon/titles.txt";
	public static final String SPEECH_VERBS_RESOURCE = "lexicon/speech_verbs.txt";

	private final LexicalExceptionSet abbreviations;
	private final LexicalExceptionSet titles;
	private final LexicalExceptionSet speechVerbs;

	public LexicalExceptionSets(LexicalExceptionSet abbreviations, LexicalExceptionSet titles,
			LexicalExceptionSet speechVerbs) {
		if (abbreviations == null || titles == null || speechVerbs == null) {
			throw new IllegalArgumentException("Lexical exception sets must not be null");
		}
		this.abbreviations = abbreviations;
		this.titles = titles;
		this.speechVerbs = speechVerbs;
	}

	/**
	 * Loads the bundled lexicon.
	 *
	 * @throws IllegalStateException if a bundled resource is missing
	 */
	public static LexicalExceptionSets loadDefault() {
		LexicalExceptionSets sets = new LexicalExceptionSets(
				LexicalExceptionSet.of("abbreviations", readResource(ABBREVIATIONS_RESOURCE)),
				LexicalExceptionSet.of("titles", readResource(TITLES_RESOURCE)),
				LexicalExceptionSet.of("speech_verbs", readResource(SPEECH_VERBS_RESOURCE)));
		Logger.debug("Lexicon loaded: {} abbreviations, {} titles, {} speech verbs", sets.abbreviations.size(),
				sets.titles.size(), sets.speechVerbs.size());
		return sets;
	}

	/** A copy whose abbreviation set also holds {@code extra}. */
	public LexicalExceptionSets withAdditionalAbbreviations(Collection<String> extra) {
		LexicalExceptionSet merged = abbreviations.union(extra);
		if (merged == abbreviations)
			return this;
		return new LexicalExceptionSets(merged, titles, speechVerbs);
	}

	public LexicalExceptionSet getAbbreviations() {
		return abbreviations;
	}

	public LexicalExceptionSet getTitles() {
		return titles;
	}

	public LexicalExceptionSet getSpeechVerbs() {
		return speechVerbs;
	}

	public boolean isAbbreviation(String s) {
		return abbreviations.contains(s);
	}

	public boolean isTitle(String s) {
		return titles.contains(s);
	}

	public boolean isSpeechVerb(String s) {
		return speechVerbs.contains(s);
	}

	// -------------------------- Internals --------------------------------------

	static List<String> readResource(String resource) {
		ClassLoader cl = Thread.currentThread().getContextClassLoader();
		if (cl == null)
			cl = LexicalExceptionSets.class.getClassLoader();

		try (InputStream in = cl.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Lexicon resource not found on classpath: " + resource);
			}
			try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
				return readEntries(br);
			}
		} catch (IOException ioe) {
			throw new UncheckedIOException("Failed to read lexicon resource " + resource, ioe);
		}
	}

	static List<String> readEntries(BufferedReader reader) throws IOException {
		List<String> out = new ArrayList<>();
		String line;
		while ((line = reader.readLine()) != null) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			out.add(trimmed);
		}
		return out;
	}
}
