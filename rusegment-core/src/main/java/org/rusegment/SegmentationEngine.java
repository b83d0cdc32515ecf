package org.rusegment;

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

import org.rusegment.conf.SegmenterConfig;
import org.rusegment.lexicon.LexicalExceptionSets;
import org.rusegment.om.RuleTable;
import org.rusegment.om.Sentence;
import org.rusegment.processing.BlockingEvaluator;
import org.rusegment.processing.BoundaryScanner;
import org.rusegment.processing.QualityScorer;
import org.rusegment.processing.SentenceSplitter;
import org.rusegment.util.Logger;

/**
 * Rule-based sentence segmentation for Russian text.
 * <p>
 * An engine owns its rule table, lexicon and evaluator, all immutable after
 * construction, so one instance can serve any number of threads. Offsets in
 * and out are code point offsets into the text.
 *
 * <pre>
 * SegmentationEngine engine = SegmentationEngine.getInstance();
 * List&lt;Integer&gt; cuts = engine.findSentenceBoundaries(text);
 * double q = engine.getQualityScore(text, cuts);
 * </pre>
 */
public class SegmentationEngine {

	// Shared instance
	private static volatile SegmentationEngine instance;

	private final RuleTable ruleTable;
	private final LexicalExceptionSets lexicon;
	private final BoundaryScanner scanner;
	private final QualityScorer scorer;

	/** Engine configured from the default {@link SegmenterConfig} sources. */
	public SegmentationEngine() {
		this(new SegmenterConfig());
	}

	public SegmentationEngine(SegmenterConfig config) {
		this(RuleTable.defaults(), LexicalExceptionSets.loadDefault(), config);
	}

	/**
	 * @param ruleTable rules to scan with
	 * @param lexicon   exception sets; {@code EXTRA_ABBREVIATIONS} from the
	 *                  config are merged into its abbreviations
	 * @param config    evaluator settings
	 */
	public SegmentationEngine(RuleTable ruleTable, LexicalExceptionSets lexicon, SegmenterConfig config) {
		if (ruleTable == null || lexicon == null || config == null)
			throw new IllegalArgumentException("Rule table, lexicon and config are required");

		for (String issue : config.validate()) {
			Logger.warn("Config: {}", issue);
		}

		this.ruleTable = ruleTable;
		this.lexicon = lexicon.withAdditionalAbbreviations(config.getExtraAbbreviations());

		BlockingEvaluator evaluator = new BlockingEvaluator(this.lexicon.getAbbreviations(), config);
		this.scanner = new BoundaryScanner(ruleTable, evaluator);
		this.scorer = new QualityScorer(this.lexicon.getAbbreviations());

		Logger.info("Segmentation engine ready: {} rules, {} abbreviations (lookback {}, initials window {})",
				ruleTable.size(), this.lexicon.getAbbreviations().size(), evaluator.getLookback(),
				evaluator.getInitialsWindow());
	}

	/** Get the shared engine, built on first use. */
	public static SegmentationEngine getInstance() {
		if (instance == null) {
			synchronized (SegmentationEngine.class) {
				if (instance == null) {
					instance = new SegmentationEngine();
				}
			}
		}
		return instance;
	}

	/**
	 * Finds the positions where a new sentence starts.
	 *
	 * @param text any text, null treated as empty
	 * @return ascending, distinct code point offsets; the end of the text is
	 *         implicit and never listed
	 */
	public List<Integer> findSentenceBoundaries(String text) {
		return scanner.scan(text);
	}

	/**
	 * Heuristic quality of a segmentation, in {@code [0.0, 1.0]}. Boundaries
	 * should come from {@link #findSentenceBoundaries(String)} on the same text.
	 */
	public double getQualityScore(String text, List<Integer> boundaries) {
		return scorer.score(text, boundaries);
	}

	/** Splits {@code text} into trimmed sentences with their offsets. */
	public List<Sentence> sentenize(String text) {
		return SentenceSplitter.split(text, findSentenceBoundaries(text));
	}

	public RuleTable getRuleTable() {
		return ruleTable;
	}

	public LexicalExceptionSets getLexicon() {
		return lexicon;
	}
}
