package org.rusegment.om;

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

import lombok.Data;

/**
 * A materialized sentence: trimmed text plus its {@code [start, stop)} code
 * point offsets in the source text.
 */
@Data
public class Sentence {

	private final int start;
	private final int stop;
	private final String text;

	/** Length in code points. */
	public int length() {
		return stop - start;
	}
}
