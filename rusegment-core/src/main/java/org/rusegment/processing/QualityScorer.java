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

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.rusegment.lexicon.LexicalExceptionSet;
import org.rusegment.om.Sentence;

/**
 * Heuristic confidence for a finished segmentation. Diagnostic only; the
 * scanner never consults it.
 * <p>
 * Starting from 1.0, each sentence adds a penalty when it is very short,
 * starts lower-case, or is short and contains "abbreviation + period". The
 * result is clamped at 0.0. An empty boundary list scores 0.0 regardless of
 * the text, even for a correct single-sentence text.
 */
public class QualityScorer {

	static final int SHORT_SENTENCE = 3;
	static final int ABBREVIATION_ONLY_SENTENCE = 10;

	static final double SHORT_PENALTY = 0.1;
	static final double LOWERCASE_PENALTY = 0.15;
	static final double ABBREVIATION_PENALTY = 0.2;

	private final Pattern abbreviationPattern;

	public QualityScorer(LexicalExceptionSet abbreviations) {
		this.abbreviationPattern = compileAbbreviationPattern(abbreviations);
	}

	/** {@code \b(abbr1|abbr2|...)\.}, longest alternatives first. */
	static Pattern compileAbbreviationPattern(LexicalExceptionSet abbreviations) {
		List<String> entries = abbreviations.longestFirst();
		if (entries.isEmpty()) {
			// never matches
			return Pattern.compile("(?!)");
		}
		String alternation = entries.stream().map(Pattern::quote).collect(Collectors.joining("|"));
		return Pattern.compile("\\b(" + alternation + ")\\.", Pattern.UNICODE_CHARACTER_CLASS);
	}

	/**
	 * @param text       the segmented text
	 * @param boundaries code point offsets, normally from the same engine
	 * @return score in {@code [0.0, 1.0]}
	 */
	public double score(String text, Collection<Integer> boundaries) {
		if (boundaries == null || boundaries.isEmpty())
			return 0.0;

		double penalties = 0.0;
		for (Sentence sentence : SentenceSplitter.split(text, boundaries)) {
			penalties += penalty(sentence);
		}
		return Math.max(0.0, 1.0 - penalties);
	}

	double penalty(Sentence sentence) {
		String s = sentence.getText();
		int len = sentence.length();
		double p = 0.0;

		if (len < SHORT_SENTENCE)
			p += SHORT_PENALTY;

		if (!s.isEmpty() && Character.isLowerCase(s.codePointAt(0)))
			p += LOWERCASE_PENALTY;

		if (len < ABBREVIATION_ONLY_SENTENCE && abbreviationPattern.matcher(s).find())
			p += ABBREVIATION_PENALTY;

		return p;
	}
}
