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

import java.util.Objects;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;

import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.rules.FormattingRuleChain;
import com.tomaszrup.smartformat.syntax.SyntaxTree;

/**
 * Everything one formatting evaluation needs, captured once when the
 * evaluation starts and never modified.
 */
public final class FormattingContext {
	private final SyntaxTree tree;
	private final EditorFormattingOptions options;
	private final FormattingRuleChain rules;
	private final CancelChecker cancelChecker;

	public FormattingContext(SyntaxTree tree, EditorFormattingOptions options, FormattingRuleChain rules,
			CancelChecker cancelChecker) {
		this.tree = Objects.requireNonNull(tree, "tree");
		this.options = Objects.requireNonNull(options, "options");
		this.rules = Objects.requireNonNull(rules, "rules");
		this.cancelChecker = Objects.requireNonNull(cancelChecker, "cancelChecker");
	}

	public SyntaxTree getTree() {
		return tree;
	}

	public EditorFormattingOptions getOptions() {
		return options;
	}

	public FormattingRuleChain getRules() {
		return rules;
	}

	public CancelChecker getCancelChecker() {
		return cancelChecker;
	}

	public void checkCanceled() {
		cancelChecker.checkCanceled();
	}
}
