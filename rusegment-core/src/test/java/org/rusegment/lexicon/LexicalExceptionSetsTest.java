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

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class LexicalExceptionSetsTest {

	private static List<String> fileAbbreviations;
	private static LexicalExceptionSets sets;

	@BeforeAll
	static void loadLexiconFile() throws Exception {
		Path p = Path.of("src/main/resources/lexicon/abbreviations.txt");
		assertTrue(Files.exists(p), "abbreviations.txt must exist at " + p.toAbsolutePath());

		fileAbbreviations = Files.readAllLines(p, StandardCharsets.UTF_8).stream().map(String::trim)
				.filter(s -> !s.isEmpty() && !s.startsWith("#")).collect(Collectors.toList());
		assertFalse(fileAbbreviations.isEmpty(), "abbreviations.txt should contain at least one entry");

		sets = LexicalExceptionSets.loadDefault();
	}

	@Test
	void every_file_entry_is_an_abbreviation() {
		for (String abbr : fileAbbreviations) {
			assertTrue(sets.isAbbreviation(abbr), "Expected abbreviation from file: " + abbr);
		}
		Set<String> distinct = fileAbbreviations.stream().map(LexicalExceptionSet::normalize).collect(Collectors.toSet());
		assertEquals(distinct.size(), sets.getAbbreviations().size());
	}

	@Test
	void membership_is_exact_after_normalization() {
		assertTrue(sets.isAbbreviation(" Г "));
		assertTrue(sets.isAbbreviation("И Т.Д"));
		assertTrue(sets.isAbbreviation("проф"));
		assertFalse(sets.isAbbreviation("г."), "Entries are stored without the trailing period");
		assertFalse(sets.isAbbreviation("профессор"));
		assertFalse(sets.isAbbreviation(null));
		assertFalse(sets.isAbbreviation("   "));
	}

	@Test
	void titles_and_speech_verbs_are_loaded() {
		assertTrue(sets.isTitle("Профессор"));
		assertTrue(sets.isTitle("господин"));
		assertFalse(sets.isTitle("проф"));

		assertTrue(sets.isSpeechVerb("сказала"));
		assertTrue(sets.isSpeechVerb("Уточнил"));
		assertFalse(sets.isSpeechVerb("сказать"));
	}

	@Test
	void additional_abbreviations_produce_a_new_instance() {
		LexicalExceptionSets extended = sets.withAdditionalAbbreviations(List.of("сб", " Изд "));

		assertNotSame(sets, extended);
		assertTrue(extended.isAbbreviation("сб"));
		assertTrue(extended.isAbbreviation("изд"));
		assertFalse(sets.isAbbreviation("сб"), "The shared lexicon must not change");
		assertSame(sets.getTitles(), extended.getTitles());
		assertSame(sets.getSpeechVerbs(), extended.getSpeechVerbs());

		assertSame(sets, sets.withAdditionalAbbreviations(List.of()));
	}

	@Test
	void sets_are_read_only() {
		assertThrows(UnsupportedOperationException.class, () -> sets.getAbbreviations().asSet().add("xyz"));
	}

	@Test
	void reader_skips_comments_and_blank_lines() throws Exception {
		BufferedReader br = new BufferedReader(new StringReader("# comment\n\nг\n  гг  \n#\n"));
		assertEquals(List.of("г", "гг"), LexicalExceptionSets.readEntries(br));
	}

	@Test
	void missing_resource_fails_fast() {
		assertThrows(IllegalStateException.class, () -> LexicalExceptionSets.readResource("lexicon/missing.txt"));
		assertThrows(IllegalArgumentException.class, () -> new LexicalExceptionSets(null, null, null));
	}
}
