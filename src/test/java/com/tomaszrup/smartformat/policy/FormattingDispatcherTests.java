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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.smartformat.IndentingLayoutEngine;
import com.tomaszrup.smartformat.StatementRangeResolver;
import com.tomaszrup.smartformat.TestEdits;
import com.tomaszrup.smartformat.TestSyntaxTree;
import com.tomaszrup.smartformat.engine.FormattingRangeResolver;
import com.tomaszrup.smartformat.engine.LayoutEngine;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.engine.TokenRange;
import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.rules.FormattingRuleChain;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Unit tests for {@link FormattingDispatcher}: range resolution checks,
 * fallback to single-token formatting and handling of engine results.
 */
class FormattingDispatcherTests {

	private static final String SOURCE = "void M()\n{\n  Foo()  ;\n    }";

	private TestSyntaxTree tree;
	private IndentingLayoutEngine engine;
	private StatementRangeResolver resolver;
	private FormattingContext context;

	@BeforeEach
	void setup() {
		tree = TestSyntaxTree.parse(SOURCE);
		engine = new IndentingLayoutEngine();
		resolver = new StatementRangeResolver();
		context = new FormattingContext(tree, EditorFormattingOptions.defaults(), FormattingRuleChain.empty(),
				TestEdits.NOT_CANCELLED);
	}

	// ------------------------------------------------------------------
	// formatRange()
	// ------------------------------------------------------------------

	@Test
	void testOpenBraceSkipsRangeResolution() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, resolver);
		List<TextChange> changes = dispatcher.formatRange(context, tree.findTokenByText("{")).join();
		Assertions.assertTrue(changes.isEmpty());
		Assertions.assertEquals(0, resolver.getCalls());
		Assertions.assertEquals(0, engine.getTotalCalls());
	}

	@Test
	void testNoRangeMeansNoEdits() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, FormattingRangeResolver.NONE);
		List<TextChange> changes = dispatcher.formatRange(context, tree.findTokenByText(";")).join();
		Assertions.assertTrue(changes.isEmpty());
		Assertions.assertEquals(0, engine.getTotalCalls());
	}

	@Test
	void testDegenerateRangeMeansNoEdits() {
		FormattingRangeResolver degenerate = (t, endToken) -> new TokenRange(endToken, endToken);
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, degenerate);
		List<TextChange> changes = dispatcher.formatRange(context, tree.findTokenByText(";")).join();
		Assertions.assertTrue(changes.isEmpty());
		Assertions.assertEquals(0, engine.getTotalCalls());
	}

	@Test
	void testRangeEndingAtEndOfFileIsRejected() {
		SyntaxToken endOfFile = tree.getTokens().get(tree.getTokens().size() - 1);
		FormattingRangeResolver toEnd = (t, endToken) -> new TokenRange(t.findToken(0, false), endOfFile);
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, toEnd);
		List<TextChange> changes = dispatcher.formatRange(context, tree.findTokenByText(";")).join();
		Assertions.assertTrue(changes.isEmpty());
		Assertions.assertEquals(0, engine.getTotalCalls());
	}

	@Test
	void testRangeEditsArePassedThrough() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, resolver);
		SyntaxToken semicolon = tree.findTokenByText(";");
		List<TextChange> changes = dispatcher.formatRange(context, semicolon).join();

		TextSpan statement = TextSpan.fromBounds(tree.findTokenByText("Foo").getSpanStart(),
				semicolon.getSpan().getEnd());
		List<TextChange> expected = new IndentingLayoutEngine().formatSpans(tree,
				Collections.singletonList(statement), EditorFormattingOptions.defaults(), FormattingRuleChain.empty(),
				TestEdits.NOT_CANCELLED).join();
		Assertions.assertEquals(expected, changes);
		Assertions.assertEquals("void M()\n{\n    Foo();\n    }", TestEdits.apply(SOURCE, changes));
	}

	// ------------------------------------------------------------------
	// formatRangeOrToken()
	// ------------------------------------------------------------------

	@Test
	void testFallsBackToTokenWhenRangeIsEmpty() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, FormattingRangeResolver.NONE);
		SyntaxToken closeBrace = tree.findTokenByText("}");
		List<TextChange> changes = dispatcher.formatRangeOrToken(context, closeBrace).join();
		Assertions.assertEquals(1, engine.getTokenCalls());
		Assertions.assertEquals(closeBrace, engine.getLastToken());
		Assertions.assertEquals("void M()\n{\n  Foo()  ;\n}", TestEdits.apply(SOURCE, changes));
	}

	@Test
	void testNoTokenFallbackWhenRangeHasEdits() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, resolver);
		List<TextChange> changes = dispatcher.formatRangeOrToken(context, tree.findTokenByText(";")).join();
		Assertions.assertFalse(changes.isEmpty());
		Assertions.assertEquals(1, engine.getSpanCalls());
		Assertions.assertEquals(0, engine.getTokenCalls());
	}

	// ------------------------------------------------------------------
	// engine results
	// ------------------------------------------------------------------

	@Test
	void testMissingEngineResultMeansNoEdits() {
		LayoutEngine silent = new LayoutEngine() {
			@Override
			public CompletableFuture<List<TextChange>> formatSpans(SyntaxTree t, List<TextSpan> spans,
					EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
				return null;
			}

			@Override
			public CompletableFuture<List<TextChange>> formatToken(SyntaxTree t, SyntaxToken token,
					EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
				return CompletableFuture.completedFuture(null);
			}
		};
		FormattingDispatcher dispatcher = new FormattingDispatcher(silent, FormattingRangeResolver.NONE);
		Assertions.assertTrue(dispatcher.formatSpan(context, new TextSpan(0, SOURCE.length())).join().isEmpty());
		Assertions.assertTrue(dispatcher.formatToken(context, tree.findTokenByText("}")).join().isEmpty());
	}

	@Test
	void testResultIsImmutable() {
		FormattingDispatcher dispatcher = new FormattingDispatcher(engine, resolver);
		List<TextChange> changes = dispatcher.formatSpan(context, new TextSpan(0, SOURCE.length())).join();
		Assertions.assertFalse(changes.isEmpty());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> changes.clear());
	}

	@Test
	void testCancellationWhileEngineRuns() {
		AtomicBoolean cancelled = new AtomicBoolean();
		CancelChecker checker = () -> {
			if (cancelled.get()) {
				throw new CancellationException();
			}
		};
		CompletableFuture<List<TextChange>> pending = new CompletableFuture<>();
		LayoutEngine slow = new LayoutEngine() {
			@Override
			public CompletableFuture<List<TextChange>> formatSpans(SyntaxTree t, List<TextSpan> spans,
					EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
				return pending;
			}

			@Override
			public CompletableFuture<List<TextChange>> formatToken(SyntaxTree t, SyntaxToken token,
					EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
				return pending;
			}
		};
		FormattingContext cancellable = new FormattingContext(tree, EditorFormattingOptions.defaults(),
				FormattingRuleChain.empty(), checker);
		CompletableFuture<List<TextChange>> result = new FormattingDispatcher(slow, resolver)
				.formatSpan(cancellable, new TextSpan(0, SOURCE.length()));

		cancelled.set(true);
		pending.complete(Collections.singletonList(new TextChange(new TextSpan(0, 0), " ")));
		TestEdits.assertCancelled(result);
	}
}
