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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;

import org.rusegment.om.RuleTable;
import org.rusegment.om.SegmentationRule;
import org.rusegment.util.CodePoints;
import org.rusegment.util.Logger;

/**
 * Applies a {@link RuleTable} to a text and collects the accepted sentence
 * boundaries.
 * <p>
 * Rules run highest priority first. Every match of a boundary rule proposes
 * its end as a candidate, which is dropped if a higher-priority suppressive
 * rule ended at the same or an adjacent position, or if the
 * {@link BlockingEvaluator} blocks it. Accepted candidates are deduplicated
 * and returned ascending, as code point offsets.
 */
public class BoundaryScanner {

	/** Max distance between a suppressive match end and the candidate it cancels. */
	static final int SUPPRESSION_REACH = 1;

	private final RuleTable ruleTable;
	private final BlockingEvaluator evaluator;

	public BoundaryScanner(RuleTable ruleTable, BlockingEvaluator evaluator) {
		if (ruleTable == null || evaluator == null)
			throw new IllegalArgumentException("Rule table and evaluator are required");
		this.ruleTable = ruleTable;
		this.evaluator = evaluator;
	}

	/**
	 * @return ascending, distinct code point offsets; empty for null or empty text
	 */
	public List<Integer> scan(String text) {
		if (text == null || text.isEmpty())
			return List.of();

		SortedSet<Integer> accepted = new TreeSet<>();
		// char index -> highest priority of a suppressive rule ending there
		Map<Integer, Integer> suppressed = new HashMap<>();

		for (SegmentationRule rule : ruleTable.getRules()) {
			Matcher m = rule.getPattern().matcher(text);
			while (m.find()) {
				int end = m.end();

				if (!rule.isBoundary()) {
					suppressed.merge(end, rule.getPriority(), Math::max);
					continue;
				}
				if (accepted.contains(end))
					continue;
				if (isSuppressed(suppressed, end, rule.getPriority())) {
					if (Logger.isEnabled(Logger.Level.TRACE))
						Logger.trace("{} suppressed by a higher-priority rule", describeCandidate(text, end, rule));
					continue;
				}

				BlockReason reason = evaluator.evaluate(text, m.start(), end);
				if (reason.blocks()) {
					if (Logger.isEnabled(Logger.Level.TRACE))
						Logger.trace("{} blocked: {}", describeCandidate(text, end, rule), reason);
					continue;
				}
				accepted.add(end);
			}
		}

		List<Integer> out = new ArrayList<>(accepted.size());
		for (int charIndex : accepted) {
			out.add(CodePoints.toCodePointOffset(text, charIndex));
		}
		return out;
	}

	/** Diagnostic label; the offset is in code points like the scan result. */
	static String describeCandidate(String text, int charIndex, SegmentationRule rule) {
		return "Candidate " + CodePoints.toCodePointOffset(text, charIndex) + " from " + rule.getName();
	}

	private static boolean isSuppressed(Map<Integer, Integer> suppressed, int end, int priority) {
		if (suppressed.isEmpty())
			return false;
		for (int d = -SUPPRESSION_REACH; d <= SUPPRESSION_REACH; d++) {
			Integer p = suppressed.get(end + d);
			if (p != null && p > priority)
				return true;
		}
		return false;
	}

	public RuleTable getRuleTable() {
		return ruleTable;
	}
}
