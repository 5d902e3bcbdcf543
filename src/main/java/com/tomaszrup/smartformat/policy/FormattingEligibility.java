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

import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.syntax.SourceText;
import com.tomaszrup.smartformat.syntax.SyntaxKind;
import com.tomaszrup.smartformat.syntax.SyntaxNode;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;

/**
 * Pure predicates deciding whether a token or typed character may anchor an
 * automatic format.
 */
public final class FormattingEligibility {

	/** Every character that can trigger formatting when typed. */
	public static final String SUPPORTED_CHARACTERS = ";{}#nte:)";

	private FormattingEligibility() {
	}

	public static boolean isSupportedCharacter(char ch) {
		return SUPPORTED_CHARACTERS.indexOf(ch) >= 0;
	}

	/**
	 * Cheap pre-check combining the supported character set with the session
	 * options: '}' needs format-on-close-brace or smart indent, ';' needs
	 * format-on-semicolon, and '#' and 'n' need smart indent.
	 */
	public static boolean supportsTypedCharacter(EditorFormattingOptions options, char ch) {
		boolean smartIndentOn = options.isSmartIndent();
		if ((ch == '}' && !options.isFormatOnCloseBrace() && !smartIndentOn)
				|| (ch == ';' && !options.isFormatOnSemicolon())) {
			return false;
		}
		if ((ch == '#' || ch == 'n') && !smartIndentOn) {
			return false;
		}
		return isSupportedCharacter(ch);
	}

	/**
	 * {@code n}, {@code t} and {@code e} also occur inside identifiers, so
	 * they only count as the last character of a specific keyword.
	 */
	public static boolean isKeywordSuffixCharacter(char ch) {
		return ch == 'n' || ch == 't' || ch == 'e';
	}

	public static boolean isValidKindForTypedCharacter(char typedChar, SyntaxKind kind) {
		switch (typedChar) {
			case 'n':
				return kind == SyntaxKind.REGION_KEYWORD || kind == SyntaxKind.END_REGION_KEYWORD;
			case 't':
				return kind == SyntaxKind.SELECT_KEYWORD;
			case 'e':
				return kind == SyntaxKind.WHERE_KEYWORD;
			default:
				return true;
		}
	}

	/** None, end-of-directive and end-of-file tokens never anchor a format. */
	public static boolean isInvalidTokenKind(SyntaxToken token) {
		return token.isKind(SyntaxKind.NONE, SyntaxKind.END_OF_DIRECTIVE_TOKEN, SyntaxKind.END_OF_FILE_TOKEN);
	}

	/**
	 * Whether {@code token} can anchor a single-character format: its kind is
	 * valid and its text is exactly one character.
	 */
	public static boolean isSingleCharacterToken(SyntaxToken token) {
		return !isInvalidTokenKind(token) && token.getText().length() == 1;
	}

	/**
	 * Whether {@code token} is exactly the character the user typed. Guards
	 * against a keystroke that landed in trivia next to an unrelated token.
	 */
	public static boolean matchesTypedCharacter(SyntaxToken token, char typedChar) {
		return isSingleCharacterToken(token) && token.getText().charAt(0) == typedChar;
	}

	/**
	 * Range formatting ends at the token the user typed; an open brace starts
	 * a construct rather than finishing one.
	 */
	public static boolean isEndToken(SyntaxToken token) {
		return !token.isKind(SyntaxKind.OPEN_BRACE_TOKEN);
	}

	/**
	 * Context exclusions for the typed-character trigger:
	 * <ul>
	 *   <li>{@code )} only when it closes the head of a {@code using} statement</li>
	 *   <li>{@code :} only after a statement label or a switch label</li>
	 *   <li>'{' only when it is the first token on its line</li>
	 * </ul>
	 */
	public static boolean shouldNotFormatOnTypedCharacter(SyntaxToken token, SyntaxTree tree) {
		if (token.isKind(SyntaxKind.CLOSE_PAREN_TOKEN) && !token.hasParentOfKind(SyntaxKind.USING_STATEMENT)) {
			return true;
		}
		if (token.isKind(SyntaxKind.COLON_TOKEN) && !isLabelColon(token)) {
			return true;
		}
		return token.isKind(SyntaxKind.OPEN_BRACE_TOKEN) && !isFirstTokenOnLine(tree, token);
	}

	/**
	 * Whether no other token ends on the line where {@code token} starts.
	 * Comments and whitespace in front of it do not count.
	 */
	public static boolean isFirstTokenOnLine(SyntaxTree tree, SyntaxToken token) {
		if (token.isMissing()) {
			return false;
		}
		SyntaxToken previous = tree.getPreviousToken(token);
		if (previous.isMissing()) {
			return true;
		}
		SourceText text = tree.getText();
		return text.getLineStart(previous.getSpan().getEnd()) < text.getLineStart(token.getSpanStart());
	}

	/**
	 * Return only reformats after the {@code )} that closes the head of a
	 * {@code using} statement.
	 */
	public static boolean shouldNotFormatOnReturn(SyntaxToken token) {
		return !token.isKind(SyntaxKind.CLOSE_PAREN_TOKEN) || !token.hasParentOfKind(SyntaxKind.USING_STATEMENT);
	}

	private static boolean isLabelColon(SyntaxToken token) {
		SyntaxNode parent = token.getParent();
		return parent != null
				&& (parent.isKind(SyntaxKind.LABELED_STATEMENT) || parent.getKind().isSwitchLabel());
	}
}
