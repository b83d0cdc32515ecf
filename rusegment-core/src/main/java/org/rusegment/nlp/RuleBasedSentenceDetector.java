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

import java.util.List;

import org.rusegment.SegmentationEngine;
import org.rusegment.om.Sentence;
import org.rusegment.util.CodePoints;

import opennlp.tools.util.Span;

/**
 * Sentence detector with the same shape as OpenNLP's
 * {@code SentenceDetectorME}, backed by the rule engine instead of a trained
 * model. Spans use UTF-16 char indices, as everywhere in OpenNLP, so
 * {@link Span#getCoveredText(CharSequence)} works on the original string.
 */
public class RuleBasedSentenceDetector {

	private final SegmentationEngine engine;

	/** Detector over the shared engine. */
	public RuleBasedSentenceDetector() {
		this(SegmentationEngine.getInstance());
	}

	public RuleBasedSentenceDetector(SegmentationEngine engine) {
		if (engine == null)
			throw new IllegalArgumentException("Engine must not be null");
		this.engine = engine;
	}

	/** Sentence spans, trimmed, in char indices. Empty for null or blank text. */
	public Span[] sentPosDetect(String text) {
		if (text == null || text.isEmpty())
			return new Span[0];

		List<Sentence> sentences = engine.sentenize(text);
		Span[] spans = new Span[sentences.size()];
		for (int i = 0; i < spans.length; i++) {
			Sentence s = sentences.get(i);
			spans[i] = new Span(CodePoints.toCharIndex(text, s.getStart()), CodePoints.toCharIndex(text, s.getStop()));
		}
		return spans;
	}

	/** Sentence strings, trimmed. */
	public String[] sentDetect(String text) {
		if (text == null || text.isEmpty())
			return new String[0];
		return Span.spansToStrings(sentPosDetect(text), text);
	}
}
