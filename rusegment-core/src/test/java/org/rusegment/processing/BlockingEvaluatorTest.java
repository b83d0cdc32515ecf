package org.rusegment.processing;

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

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.rusegment.lexicon.LexicalExceptionSet;
import org.rusegment.lexicon.LexicalExceptionSets;

class BlockingEvaluatorTest {

	private static LexicalExceptionSet abbreviations;
	private static BlockingEvaluator evaluator;

	@BeforeAll
	static void setup() {
		abbreviations = LexicalExceptionSets.loadDefault().getAbbreviations();
		evaluator = new BlockingEvaluator(abbreviations, 10, 20, false);
	}

	// ---------------- abbreviation --------------------------------------------

	@Test
	void abbreviation_before_period_blocks() {
		String text = "Живу в г. Москва";
		assertEquals(BlockReason.ABBREVIATION, evaluator.evaluate(text, 8, 10));
	}

	@Test
	void multi_word_abbreviation_is_found_by_backward_scan() {
		BlockingEvaluator onlyEtc = new BlockingEvaluator(LexicalExceptionSet.of("t", List.of("и т.д")), 10, 20, false);
		String text = "Книги, журналы и т.д. Далее";

		assertEquals(BlockReason.ABBREVIATION, onlyEtc.evaluate(text, 20, 22));
	}

	@Test
	void lookback_limits_abbreviation_length() {
		LexicalExceptionSet longOne = LexicalExceptionSet.of("t", List.of("абвгдежзийк"));
		String text = "абвгдежзийк. Дальше";

		assertEquals(BlockReason.NONE, new BlockingEvaluator(longOne, 10, 20, false).evaluate(text, 11, 13));
		assertEquals(BlockReason.ABBREVIATION, new BlockingEvaluator(longOne, 11, 20, false).evaluate(text, 11, 13));
	}

	@Test
	void single_letter_abbreviations_match_word_endings_unless_word_start_required() {
		// "т" (том) is an abbreviation, so "Привет!" looks like one by default
		String text = "Привет! Как";

		assertEquals(BlockReason.ABBREVIATION, evaluator.evaluate(text, 6, 8));
		BlockingEvaluator strict = new BlockingEvaluator(abbreviations, 10, 20, true);
		assertTrue(strict.isRequireWordStart());
		assertEquals(BlockReason.NONE, strict.evaluate(text, 6, 8));
	}

	@Test
	void word_start_mode_still_blocks_standalone_abbreviations() {
		BlockingEvaluator strict = new BlockingEvaluator(abbreviations, 10, 20, true);
		assertEquals(BlockReason.ABBREVIATION, strict.evaluate("Лекцию читал проф. Иванов", 17, 19));
	}

	// ---------------- initials ------------------------------------------------

	@Test
	void initials_and_surname_block() {
		String text = "Автор А. Пушкин прибыл.";
		assertEquals(BlockReason.INITIALS, evaluator.evaluate(text, 7, 9));
	}

	@Test
	void initials_are_searched_anywhere_in_the_window() {
		String text = "Ю. Гагарин летал туда! Это правда";

		// 20 code points back from the candidate cuts "Ю. " off
		assertEquals(BlockReason.NONE, evaluator.evaluate(text, 21, 23));
		assertEquals(BlockReason.INITIALS, new BlockingEvaluator(abbreviations, 10, 30, false).evaluate(text, 21, 23));
	}

	// ---------------- decimal -------------------------------------------------

	@Test
	void offset_between_digits_blocks() {
		String text = "Число 3.14 больше";
		assertEquals(BlockReason.DECIMAL, evaluator.evaluate(text, 7, 9));
	}

	// ---------------- totality ------------------------------------------------

	@Test
	void out_of_range_positions_never_throw() {
		assertEquals(BlockReason.NONE, evaluator.evaluate("", 0, 0));
		assertEquals(BlockReason.NONE, evaluator.evaluate(null, 0, 0));
		assertEquals(BlockReason.NONE, evaluator.evaluate("abc", -5, 99));
		assertFalse(evaluator.isBlocked("Итого. Начало", 5, 7));
	}

	@Test
	void settings_are_clamped() {
		BlockingEvaluator odd = new BlockingEvaluator(abbreviations, 0, -4, false);
		assertEquals(1, odd.getLookback());
		assertEquals(0, odd.getInitialsWindow());
		assertFalse(odd.isRequireWordStart());
	}
}
