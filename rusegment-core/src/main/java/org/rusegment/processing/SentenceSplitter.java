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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import org.rusegment.om.Sentence;
import org.rusegment.util.CodePoints;

/**
 * Cuts a text at a set of boundaries. Each piece is stripped of surrounding
 * white space and empty pieces are dropped; offsets stay relative to the
 * original text.
 */
public final class SentenceSplitter {

	private SentenceSplitter() {
	}

	/**
	 * @param text       source text
	 * @param boundaries code point offsets; out-of-range values are clamped,
	 *                   duplicates and ordering do not matter
	 */
	public static List<Sentence> split(String text, Collection<Integer> boundaries) {
		List<Sentence> out = new ArrayList<>();
		if (text == null || text.isEmpty())
			return out;

		TreeSet<Integer> cuts = new TreeSet<>();
		if (boundaries != null) {
			for (Integer b : boundaries) {
				if (b != null)
					cuts.add(CodePoints.toCharIndex(text, b));
			}
		}
		cuts.add(text.length());

		int start = 0;
		for (int cut : cuts) {
			if (cut <= start)
				continue;
			addPiece(text, start, cut, out);
			start = cut;
		}
		return out;
	}

	private static void addPiece(String text, int from, int to, List<Sentence> out) {
		int s = from;
		int e = to;
		while (s < e && CodePoints.isSpace(text.charAt(s)))
			s++;
		while (e > s && CodePoints.isSpace(text.charAt(e - 1)))
			e--;
		if (s == e)
			return;
		out.add(new Sentence(CodePoints.toCodePointOffset(text, s), CodePoints.toCodePointOffset(text, e),
				text.substring(s, e)));
	}
}
