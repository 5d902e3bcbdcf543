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

/**
 * Finds the token the user just finished typing.
 */
public final class TokenLocator {

	private TokenLocator() {
	}

	/**
	 * Returns the nearest token that starts before {@code caretOffset}.
	 *
	 * <p>The lookup starts at the character before the caret and searches
	 * inside trivia, so a caret in whitespace or a comment still resolves to
	 * the token in front of it. Returns {@link SyntaxToken#MISSING} when no
	 * token precedes the caret, e.g. at the start of the document.</p>
	 */
	public static SyntaxToken locateTokenBeforeCaret(SyntaxTree tree, int caretOffset) {
		if (tree == null) {
			return SyntaxToken.MISSING;
		}
		int position = Math.max(0, caretOffset - 1);
		SyntaxToken token = tree.findToken(position, true);
		while (token != null && !token.isMissing() && token.getSpanStart() >= caretOffset) {
			token = tree.getPreviousToken(token);
		}
		return token != null ? token : SyntaxToken.MISSING;
	}
}
