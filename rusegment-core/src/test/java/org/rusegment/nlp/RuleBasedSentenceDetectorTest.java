package org.rusegment.nlp;

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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.rusegment.SegmentationEngine;
import org.rusegment.conf.SegmenterConfig;
import org.rusegment.om.Sentence;

import opennlp.tools.util.Span;

class RuleBasedSentenceDetectorTest {

	private static RuleBasedSentenceDetector detector;

	@BeforeAll
	static void setup() {
		detector = new RuleBasedSentenceDetector(new SegmentationEngine(SegmenterConfig.defaults()));
	}

	@Test
	void detects_sentences() {
		assertArrayEquals(new String[] { "Лекцию читал проф. Иванов из МГУ.", "Было интересно." },
				detector.sentDetect("Лекцию читал проф. Иванов из МГУ. Было интересно."));
	}

	@Test
	void spans_are_char_indices() {
		String text = "Привет 😀. Пока.";
		Span[] spans = detector.sentPosDetect(text);

		assertEquals(2, spans.length);
		assertEquals(new Span(0, 10), spans[0]);
		assertEquals(new Span(11, 16), spans[1]);
		assertEquals("Привет 😀.", spans[0].getCoveredText(text).toString());
		assertEquals("Пока.", spans[1].getCoveredText(text).toString());
	}

	@Test
	void empty_input() {
		assertEquals(0, detector.sentPosDetect(null).length);
		assertEquals(0, detector.sentDetect("").length);
		assertEquals(0, detector.sentDetect("   ").length);
	}

	@Test
	void delegates_to_the_engine() {
		SegmentationEngine engine = mock(SegmentationEngine.class);
		String text = "раз два";
		when(engine.sentenize(text)).thenReturn(List.of(new Sentence(0, 3, "раз"), new Sentence(4, 7, "два")));

		RuleBasedSentenceDetector d = new RuleBasedSentenceDetector(engine);

		assertArrayEquals(new String[] { "раз", "два" }, d.sentDetect(text));
		assertEquals(0, d.sentDetect("").length);
		verify(engine, never()).sentenize("");
	}

	@Test
	void requires_engine() {
		assertThrows(IllegalArgumentException.class, () -> new RuleBasedSentenceDetector(null));
	}
}
