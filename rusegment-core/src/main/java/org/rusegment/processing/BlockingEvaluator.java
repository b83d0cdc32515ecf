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

import java.util.regex.Pattern;

import org.rusegment.conf.SegmenterConfig;
import org.rusegment.lexicon.LexicalExceptionSet;
import org.rusegment.util.CodePoints;

/**
 * Decides whether a boundary candidate is a false positive.
 * <p>
 * Three checks run in order and the first that fires wins:
 * <ol>
 * <li><b>Abbreviation</b>: every substring of 1..lookback code points ending
 * right before the triggering punctuation is lower-cased, stripped and looked
 * up in the abbreviation set.</li>
 * <li><b>Initials</b>: the window of {@code initialsWindow} code points on
 * each side of the candidate contains "Х. Х. Фамилия" or "Х. Фамилия"
 * anywhere.</li>
 * <li><b>Decimal</b>: the characters on both sides of the candidate are
 * digits.</li>
 * </ol>
 * Positions are UTF-16 char indices into {@code text}; window sizes are
 * counted in code points. No check throws: positions outside the text simply
 * do not block.
 */
public class BlockingEvaluator {

	/** Initial, optional second initial, capitalized surname. */
	static final Pattern INITIALS = Pattern.compile("\\b[А-ЯЁ]\\.\\s*(?:[А-ЯЁ]\\.\\s*)?[А-ЯЁ][а-яё]+\\b",
			Pattern.UNICODE_CHARACTER_CLASS);

	private final LexicalExceptionSet abbreviations;
	private final int lookback;
	private final int initialsWindow;
	private final boolean requireWordStart;

	public BlockingEvaluator(LexicalExceptionSet abbreviations, int lookback, int initialsWindow,
			boolean requireWordStart) {
		if (abbreviations == null)
			throw new IllegalArgumentException("Abbreviation set must not be null");
		this.abbreviations = abbreviations;
		this.lookback = Math.max(1, lookback);
		this.initialsWindow = Math.max(0, initialsWindow);
		this.requireWordStart = requireWordStart;
	}

	public BlockingEvaluator(LexicalExceptionSet abbreviations, SegmenterConfig config) {
		this(abbreviations, config.getAbbreviationLookback(), config.getInitialsWindow(),
				config.isAbbreviationRequireWordStart());
	}

	/**
	 * @param text               the full text being segmented
	 * @param punctuationIndex   char index of the first punctuation mark of the
	 *                           match that proposed the candidate
	 * @param candidateIndex     char index of the proposed boundary
	 * @return the first check that blocks, or {@link BlockReason#NONE}
	 */
	public BlockReason evaluate(String text, int punctuationIndex, int candidateIndex) {
		if (text == null || text.isEmpty())
			return BlockReason.NONE;
		if (isAbbreviation(text, punctuationIndex))
			return BlockReason.ABBREVIATION;
		if (isInitialsContext(text, candidateIndex))
			return BlockReason.INITIALS;
		if (isDecimal(text, candidateIndex))
			return BlockReason.DECIMAL;
		return BlockReason.NONE;
	}

	public boolean isBlocked(String text, int punctuationIndex, int candidateIndex) {
		return evaluate(text, punctuationIndex, candidateIndex).blocks();
	}

	/** True if the text right before {@code punctuationIndex} ends with an abbreviation. */
	boolean isAbbreviation(String text, int punctuationIndex) {
		if (punctuationIndex <= 0 || punctuationIndex > text.length())
			return false;

		int from = punctuationIndex;
		for (int n = 1; n <= lookback && from > 0; n++) {
			from -= Character.charCount(text.codePointBefore(from));
			if (requireWordStart && from > 0 && Character.isLetter(text.codePointBefore(from)))
				continue;
			if (abbreviations.contains(text.substring(from, punctuationIndex)))
				return true;
		}
		return false;
	}

	/** True if an initials-plus-surname shape occurs near {@code candidateIndex}. */
	boolean isInitialsContext(String text, int candidateIndex) {
		if (candidateIndex < 0 || candidateIndex > text.length())
			return false;
		int lo = CodePoints.retreat(text, candidateIndex, initialsWindow);
		int hi = CodePoints.advance(text, candidateIndex, initialsWindow);
		if (lo >= hi)
			return false;
		// opaque bounds: the window behaves like a standalone substring
		return INITIALS.matcher(text).region(lo, hi).find();
	}

	/** True if the candidate sits between two digits. */
	boolean isDecimal(String text, int candidateIndex) {
		if (candidateIndex <= 0 || candidateIndex >= text.length())
			return false;
		return Character.isDigit(text.codePointBefore(candidateIndex))
				&& Character.isDigit(text.codePointAt(candidateIndex));
	}

	public int getLookback() {
		return lookback;
	}

	public int getInitialsWindow() {
		return initialsWindow;
	}

	public boolean isRequireWordStart() {
		return requireWordStart;
	}
}
