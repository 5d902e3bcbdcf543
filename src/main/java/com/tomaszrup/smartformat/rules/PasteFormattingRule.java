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

import com.tomaszrup.smartformat.engine.LayoutContext;
import com.tomaszrup.smartformat.syntax.SyntaxKind;
import com.tomaszrup.smartformat.syntax.SyntaxNode;
import com.tomaszrup.smartformat.syntax.SyntaxToken;

/**
 * Rule placed in front of the defaults when formatting pasted code: the
 * brace that opens a pasted lambda or anonymous method body stays on
 * whatever line the user pasted it on.
 */
public final class PasteFormattingRule implements FormattingRule {

	public static final PasteFormattingRule INSTANCE = new PasteFormattingRule();

	private PasteFormattingRule() {
	}

	@Override
	public void applyTo(LayoutContext context) {
		context.preserveLineBreaksBefore(PasteFormattingRule::opensAnonymousFunctionBody);
	}

	static boolean opensAnonymousFunctionBody(SyntaxToken token) {
		if (!token.isKind(SyntaxKind.OPEN_BRACE_TOKEN) || token.getParent() == null) {
			return false;
		}
		SyntaxNode grandParent = token.getParent().getParent();
		return grandParent != null && grandParent.getKind().isAnonymousFunction();
	}

	@Override
	public String toString() {
		return "PasteFormattingRule";
	}
}
