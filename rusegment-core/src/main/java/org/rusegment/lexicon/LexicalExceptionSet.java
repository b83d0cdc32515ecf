package org.rusegment.lexicon;

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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable set of normalized (lower-cased, stripped) entries. Membership is
 * exact equality after the same normalization; null and blank queries are
 * never members.
 */
public final class LexicalExceptionSet {

	private final String name;
	private final Set<String> entries;

	private LexicalExceptionSet(String name, Set<String> entries) {
		this.name = name;
		this.entries = Collections.unmodifiableSet(entries);
	}

	/** Builds a set from raw entries; blanks are skipped. */
	public static LexicalExceptionSet of(String name, Collection<String> raw) {
		Set<String> normalized = new TreeSet<>();
		if (raw != null) {
			for (String s : raw) {
				String n = normalize(s);
				if (!n.isEmpty())
					normalized.add(n);
			}
		}
		return new LexicalExceptionSet(name, normalized);
	}

	/** A new set holding these entries plus {@code extra}. */
	public LexicalExceptionSet union(Collection<String> extra) {
		if (extra == null || extra.isEmpty())
			return this;
		Set<String> merged = new TreeSet<>(entries);
		for (String s : extra) {
			String n = normalize(s);
			if (!n.isEmpty())
				merged.add(n);
		}
		return new LexicalExceptionSet(name, merged);
	}

	/** Lower-case with {@link Locale#ROOT} and strip surrounding white space. */
	public static String normalize(String s) {
		return StringUtils.lowerCase(StringUtils.strip(StringUtils.defaultString(s)), Locale.ROOT);
	}

	public boolean contains(String candidate) {
		if (StringUtils.isBlank(candidate))
			return false;
		return entries.contains(normalize(candidate));
	}

	public String getName() {
		return name;
	}

	public int size() {
		return entries.size();
	}

	/** Entries in natural order; read-only view. */
	public Set<String> asSet() {
		return entries;
	}

	/** Entries ordered longest first, ties in natural order. */
	public List<String> longestFirst() {
		return entries.stream()
				.sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
				.collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return name + "[" + entries.size() + "]";
	}
}
