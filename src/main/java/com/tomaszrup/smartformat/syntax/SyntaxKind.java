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
 * Kinds of tokens and nodes that the formatting decision logic needs to
 * distinguish. Parsers map their own categories onto these; anything the
 * policy does not care about can use {@link #IDENTIFIER_TOKEN},
 * {@link #OTHER_TOKEN} or {@link #OTHER_NODE}.
 */
public enum SyntaxKind {
	NONE,

	// --- tokens ---
	SEMICOLON_TOKEN,
	OPEN_BRACE_TOKEN,
	CLOSE_BRACE_TOKEN,
	OPEN_PAREN_TOKEN,
	CLOSE_PAREN_TOKEN,
	COLON_TOKEN,
	HASH_TOKEN,
	QUESTION_TOKEN,
	COMMA_TOKEN,
	DOT_TOKEN,
	EQUALS_TOKEN,
	IDENTIFIER_TOKEN,
	NUMERIC_LITERAL_TOKEN,
	STRING_LITERAL_TOKEN,
	USING_KEYWORD,
	CASE_KEYWORD,
	DEFAULT_KEYWORD,
	REGION_KEYWORD,
	END_REGION_KEYWORD,
	SELECT_KEYWORD,
	WHERE_KEYWORD,
	END_OF_DIRECTIVE_TOKEN,
	END_OF_FILE_TOKEN,
	OTHER_TOKEN,

	// --- nodes ---
	COMPILATION_UNIT,
	BLOCK,
	USING_STATEMENT,
	LABELED_STATEMENT,
	CASE_SWITCH_LABEL,
	CASE_PATTERN_SWITCH_LABEL,
	DEFAULT_SWITCH_LABEL,
	EXPRESSION_STATEMENT,
	ARGUMENT_LIST,
	CONDITIONAL_EXPRESSION,
	BASE_LIST,
	SIMPLE_LAMBDA_EXPRESSION,
	PARENTHESIZED_LAMBDA_EXPRESSION,
	ANONYMOUS_METHOD_EXPRESSION,
	REGION_DIRECTIVE_TRIVIA,
	END_REGION_DIRECTIVE_TRIVIA,
	QUERY_BODY,
	OTHER_NODE;

	public boolean isSwitchLabel() {
		return this == CASE_SWITCH_LABEL
				|| this == CASE_PATTERN_SWITCH_LABEL
				|| this == DEFAULT_SWITCH_LABEL;
	}

	public boolean isAnonymousFunction() {
		return this == SIMPLE_LAMBDA_EXPRESSION
				|| this == PARENTHESIZED_LAMBDA_EXPRESSION
				|| this == ANONYMOUS_METHOD_EXPRESSION;
	}
}
