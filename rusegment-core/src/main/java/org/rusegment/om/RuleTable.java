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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, priority-ordered list of segmentation rules.
 * <p>
 * Rules are kept highest priority first. The sort is stable, so rules of equal
 * priority keep their declaration order.
 */
public final class RuleTable {

	public static final String SENTENCE_END_CAPITAL = "sentence_end_capital";
	public static final String PARAGRAPH_END = "paragraph_end";
	public static final String QUESTION_EXCLAMATION = "question_exclamation";

	private final List<SegmentationRule> rules;

	/**
	 * @throws IllegalArgumentException on a null rule or a duplicate rule name
	 */
	public RuleTable(List<SegmentationRule> declared) {
		if (declared == null)
			throw new IllegalArgumentException("Rule list must not be null");

		Set<String> names = new HashSet<>();
		for (SegmentationRule r : declared) {
			if (r == null)
				throw new IllegalArgumentException("Rule list contains null");
			if (!names.add(r.getName()))
				throw new IllegalArgumentException("Duplicate rule name: " + r.getName());
		}

		List<SegmentationRule> sorted = new ArrayList<>(declared);
		sorted.sort(Comparator.comparingInt(SegmentationRule::getPriority).reversed());
		this.rules = List.copyOf(sorted);
	}

	/** The three boundary rules the engine ships with. */
	public static RuleTable defaults() {
		List<SegmentationRule> rules = new ArrayList<>();

		// strong boundary: terminal punctuation, space, then something that opens a sentence
		rules.add(SegmentationRule.boundary(SENTENCE_END_CAPITAL, "[.!?]+\\s+(?=[А-ЯЁ«\"'(])", 50,
				"Sentence end + capital letter"));

		rules.add(SegmentationRule.boundary(PARAGRAPH_END, "[.!?]+\\s*\\n\\s*\\n", 45,
				"Sentence end + paragraph break"));

		rules.add(SegmentationRule.boundary(QUESTION_EXCLAMATION, "[!?]+\\s+", 40,
				"Question or exclamation mark"));

		return new RuleTable(rules);
	}

	/** Rules, highest priority first. */
	public List<SegmentationRule> getRules() {
		return rules;
	}

	public Optional<SegmentationRule> find(String name) {
		return rules.stream().filter(r -> r.getName().equals(name)).findFirst();
	}

	public int size() {
		return rules.size();
	}
}
