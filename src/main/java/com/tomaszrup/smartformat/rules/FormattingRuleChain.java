////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.smartformat.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.tomaszrup.smartformat.engine.LayoutContext;

/**
 * Immutable, ordered sequence of {@link FormattingRule}s. Chains are composed
 * only by concatenation; position in the chain is the only thing that relates
 * one rule to another.
 */
public final class FormattingRuleChain implements Iterable<FormattingRule> {

	private static final FormattingRuleChain EMPTY = new FormattingRuleChain(Collections.emptyList());

	private final List<FormattingRule> rules;

	private FormattingRuleChain(List<FormattingRule> rules) {
		this.rules = rules;
	}

	public static FormattingRuleChain empty() {
		return EMPTY;
	}

	public static FormattingRuleChain of(FormattingRule... rules) {
		return of(Arrays.asList(rules));
	}

	public static FormattingRuleChain of(List<? extends FormattingRule> rules) {
		if (rules == null || rules.isEmpty()) {
			return EMPTY;
		}
		List<FormattingRule> copy = new ArrayList<>(rules.size());
		for (FormattingRule rule : rules) {
			copy.add(Objects.requireNonNull(rule, "rule"));
		}
		return new FormattingRuleChain(Collections.unmodifiableList(copy));
	}

	/**
	 * Returns a chain with this chain's rules followed by {@code tail}'s.
	 */
	public FormattingRuleChain concat(FormattingRuleChain tail) {
		if (tail.rules.isEmpty()) {
			return this;
		}
		if (rules.isEmpty()) {
			return tail;
		}
		List<FormattingRule> joined = new ArrayList<>(rules.size() + tail.rules.size());
		joined.addAll(rules);
		joined.addAll(tail.rules);
		return new FormattingRuleChain(Collections.unmodifiableList(joined));
	}

	/**
	 * Returns a chain with {@code head} in front of this chain's rules.
	 */
	public FormattingRuleChain prepend(FormattingRule head) {
		return of(head).concat(this);
	}

	/**
	 * Applies every rule to {@code context}, first to last.
	 */
	public void applyTo(LayoutContext context) {
		for (FormattingRule rule : rules) {
			rule.applyTo(context);
		}
	}

	public List<FormattingRule> getRules() {
		return rules;
	}

	public int size() {
		return rules.size();
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}

	@Override
	public Iterator<FormattingRule> iterator() {
		return rules.iterator();
	}

	@Override
	public String toString() {
		return "FormattingRuleChain" + rules;
	}
}
