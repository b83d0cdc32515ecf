package org.rusegment.util;

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

/**
 * Offset arithmetic between UTF-16 char indices (what {@link String} and
 * {@link java.util.regex.Matcher} use) and code point offsets (what the
 * engine reports). All methods clamp instead of throwing.
 */
public final class CodePoints {

	private CodePoints() {
	}

	/** Number of code points in {@code text}; 0 for null. */
	public static int length(String text) {
		return text == null ? 0 : text.codePointCount(0, text.length());
	}

	/** Code point offset of the given char index. */
	public static int toCodePointOffset(String text, int charIndex) {
		int idx = clamp(charIndex, 0, text.length());
		return text.codePointCount(0, idx);
	}

	/** Char index of the given code point offset, clamped to the text. */
	public static int toCharIndex(String text, int codePointOffset) {
		if (codePointOffset <= 0)
			return 0;
		int cpLen = length(text);
		if (codePointOffset >= cpLen)
			return text.length();
		return text.offsetByCodePoints(0, codePointOffset);
	}

	/** Moves {@code charIndex} back by up to {@code count} code points. */
	public static int retreat(String text, int charIndex, int count) {
		int idx = clamp(charIndex, 0, text.length());
		for (int i = 0; i < count && idx > 0; i++) {
			idx -= Character.charCount(text.codePointBefore(idx));
		}
		return idx;
	}

	/** Moves {@code charIndex} forward by up to {@code count} code points. */
	public static int advance(String text, int charIndex, int count) {
		int idx = clamp(charIndex, 0, text.length());
		for (int i = 0; i < count && idx < text.length(); i++) {
			idx += Character.charCount(text.codePointAt(idx));
		}
		return idx;
	}

	/** White space as the segmenter trims it, including no-break spaces. */
	public static boolean isSpace(int codePoint) {
		return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
	}

	private static int clamp(int v, int lo, int hi) {
		return Math.max(lo, Math.min(hi, v));
	}
}
