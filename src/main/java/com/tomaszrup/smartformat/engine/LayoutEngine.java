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
package com.tomaszrup.smartformat.engine;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;

import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.rules.FormattingRuleChain;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * The layout algorithm that computes whitespace and indentation edits. The
 * formatting service only decides when to call it and over what.
 *
 * <p>Implementations must not mutate the tree and should call
 * {@link CancelChecker#checkCanceled()} while they work.</p>
 */
public interface LayoutEngine {

	/**
	 * Lays out every token inside {@code spans}.
	 */
	CompletableFuture<List<TextChange>> formatSpans(SyntaxTree tree, List<TextSpan> spans,
			EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker);

	/**
	 * Adjusts only the whitespace in front of {@code token}, typically its
	 * indentation.
	 */
	CompletableFuture<List<TextChange>> formatToken(SyntaxTree tree, SyntaxToken token,
			EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker);
}
