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

import java.util.regex.Pattern;

import lombok.Data;
import lombok.NonNull;

/**
 * One pattern of the rule table. A match of a boundary rule proposes a
 * sentence boundary at the match end; a match of a non-boundary rule
 * suppresses lower-priority candidates at (or next to) its end.
 */
@Data
public class SegmentationRule {

	/** Flags every rule pattern is compiled with. */
	public static final int PATTERN_FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

	/** Unique within a rule table; used in diagnostics. */
	@NonNull
	private final String name;

	@NonNull
	private final Pattern pattern;

	private final boolean boundary;

	/** Higher runs first. */
	private final int priority;

	/** Rationale for humans; not read at runtime. */
	@NonNull
	private final String description;

	public static SegmentationRule boundary(String name, String regex, int priority, String description) {
		return new SegmentationRule(name, Pattern.compile(regex, PATTERN_FLAGS), true, priority, description);
	}

	public static SegmentationRule suppressive(String name, String regex, int priority, String description) {
		return new SegmentationRule(name, Pattern.compile(regex, PATTERN_FLAGS), false, priority, description);
	}
}
