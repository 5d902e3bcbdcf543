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
package com.tomaszrup.smartformat.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.smartformat.engine.FormattingRangeResolver;
import com.tomaszrup.smartformat.engine.LayoutEngine;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.engine.TokenRange;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Calls the {@link LayoutEngine} with either a token range or a single token
 * and returns its edits as one immutable list.
 */
public class FormattingDispatcher {
	private static final Logger logger = LoggerFactory.getLogger(FormattingDispatcher.class);

	private final LayoutEngine layoutEngine;
	private final FormattingRangeResolver rangeResolver;

	public FormattingDispatcher(LayoutEngine layoutEngine, FormattingRangeResolver rangeResolver) {
		this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine");
		this.rangeResolver = Objects.requireNonNull(rangeResolver, "rangeResolver");
	}

	/**
	 * Formats the range ending at {@code token}; when that yields nothing,
	 * formats the token alone.
	 */
	public CompletableFuture<List<TextChange>> formatRangeOrToken(FormattingContext context, SyntaxToken token) {
		return formatRange(context, token).thenCompose(changes -> {
			if (!changes.isEmpty()) {
				return CompletableFuture.completedFuture(changes);
			}
			logger.debug("Range format produced no edits, formatting token {}", token);
			return formatToken(context, token);
		});
	}

	/**
	 * Formats the smallest construct that {@code endToken} completes, as
	 * found by the {@link FormattingRangeResolver}. Produces no edits when
	 * {@code endToken} cannot end a range, when no range is found, when both
	 * bounds are the same token, or when either bound has an invalid kind.
	 */
	public CompletableFuture<List<TextChange>> formatRange(FormattingContext context, SyntaxToken endToken) {
		if (!FormattingEligibility.isEndToken(endToken)) {
			return noEdits();
		}
		TokenRange range = rangeResolver.findAppropriateRange(context.getTree(), endToken);
		if (range == null || range.isDegenerate()) {
			logger.debug("No range to format ending at {}", endToken);
			return noEdits();
		}
		if (FormattingEligibility.isInvalidTokenKind(range.getStartToken())
				|| FormattingEligibility.isInvalidTokenKind(range.getEndToken())) {
			logger.debug("Rejected range with invalid bound {}", range);
			return noEdits();
		}
		return formatSpan(context, range.toSpan());
	}

	/**
	 * Formats every token inside {@code span}.
	 */
	public CompletableFuture<List<TextChange>> formatSpan(FormattingContext context, TextSpan span) {
		context.checkCanceled();
		return collect(context, layoutEngine.formatSpans(context.getTree(), Collections.singletonList(span),
				context.getOptions(), context.getRules(), context.getCancelChecker()));
	}

	/**
	 * Adjusts only the whitespace in front of {@code token}.
	 */
	public CompletableFuture<List<TextChange>> formatToken(FormattingContext context, SyntaxToken token) {
		context.checkCanceled();
		return collect(context, layoutEngine.formatToken(context.getTree(), token,
				context.getOptions(), context.getRules(), context.getCancelChecker()));
	}

	private static CompletableFuture<List<TextChange>> collect(FormattingContext context,
			CompletableFuture<List<TextChange>> engineResult) {
		if (engineResult == null) {
			return noEdits();
		}
		return engineResult.thenApply(changes -> {
			context.checkCanceled();
			if (changes == null || changes.isEmpty()) {
				return Collections.<TextChange>emptyList();
			}
			return Collections.unmodifiableList(new ArrayList<>(changes));
		});
	}

	static CompletableFuture<List<TextChange>> noEdits() {
		return CompletableFuture.completedFuture(Collections.emptyList());
	}
}
