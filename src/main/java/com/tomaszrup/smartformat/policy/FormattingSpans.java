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

import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Widens a requested span so the layout engine sees one token of context on
 * each side.
 */
public final class FormattingSpans {

	private FormattingSpans() {
	}

	/**
	 * Returns the span from the start of the token before the first token of
	 * {@code span} (or the document start) to the end of the token after the
	 * last token of {@code span} (or the end of the document). A {@code null}
	 * span means the whole document. Offsets outside the document are
	 * clamped.
	 */
	public static TextSpan getFormattingSpan(SyntaxTree tree, TextSpan span) {
		int length = tree.getText().getLength();
		if (span == null) {
			span = new TextSpan(0, length);
		}
		int requestedStart = Math.min(span.getStart(), length);
		int requestedEnd = Math.min(span.getEnd(), length);

		SyntaxToken firstToken = tree.findToken(requestedStart, false);
		SyntaxToken previous = firstToken.isMissing() ? SyntaxToken.MISSING : tree.getPreviousToken(firstToken);
		int startPosition = previous.isMissing() ? 0 : previous.getSpanStart();

		SyntaxToken lastToken = tree.findToken(requestedEnd > 0 ? requestedEnd - 1 : 0, false);
		SyntaxToken next = lastToken.isMissing() ? SyntaxToken.MISSING : tree.getNextToken(lastToken);
		int endPosition = next.isMissing() ? length : next.getSpan().getEnd();

		return TextSpan.fromBounds(startPosition, Math.max(startPosition, endPosition));
	}
}
