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
package com.tomaszrup.smartformat.syntax;

/**
 * Immutable parsed snapshot of one document, supplied by the host's parser.
 *
 * <p>Token lookups never return {@code null}; they return
 * {@link SyntaxToken#MISSING} when there is no such token.</p>
 */
public interface SyntaxTree {

	SourceText getText();

	SyntaxNode getRoot();

	/**
	 * Finds the token whose full span (including leading and trailing trivia)
	 * contains {@code position}. Trailing trivia runs up to and including the
	 * first line break after a token; everything else is leading trivia of the
	 * next token.
	 *
	 * @param findInsideTrivia when {@code true}, tokens inside structured
	 *                         trivia such as preprocessor directives are
	 *                         returned instead of the token owning the trivia
	 */
	SyntaxToken findToken(int position, boolean findInsideTrivia);

	SyntaxToken getPreviousToken(SyntaxToken token);

	SyntaxToken getNextToken(SyntaxToken token);
}
