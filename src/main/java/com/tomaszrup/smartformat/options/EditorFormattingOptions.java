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
package com.tomaszrup.smartformat.options;

import java.util.Objects;

/**
 * Immutable set of session options that gate automatic formatting.
 *
 * <p>{@code indentSize} and {@code useTabs} are not read by the trigger
 * policy; they are handed to the layout engine unchanged.</p>
 */
public final class EditorFormattingOptions {

	public static final int DEFAULT_INDENT_SIZE = 4;

	private static final EditorFormattingOptions DEFAULTS =
			new EditorFormattingOptions(IndentStyle.SMART, true, true, DEFAULT_INDENT_SIZE, false);

	private final IndentStyle indentStyle;
	private final boolean formatOnCloseBrace;
	private final boolean formatOnSemicolon;
	private final int indentSize;
	private final boolean useTabs;

	public EditorFormattingOptions(IndentStyle indentStyle, boolean formatOnCloseBrace,
			boolean formatOnSemicolon, int indentSize, boolean useTabs) {
		this.indentStyle = Objects.requireNonNull(indentStyle, "indentStyle");
		if (indentSize <= 0) {
			throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
		}
		this.formatOnCloseBrace = formatOnCloseBrace;
		this.formatOnSemicolon = formatOnSemicolon;
		this.indentSize = indentSize;
		this.useTabs = useTabs;
	}

	public static EditorFormattingOptions defaults() {
		return DEFAULTS;
	}

	public IndentStyle getIndentStyle() {
		return indentStyle;
	}

	public boolean isSmartIndent() {
		return indentStyle == IndentStyle.SMART;
	}

	public boolean isFormatOnCloseBrace() {
		return formatOnCloseBrace;
	}

	public boolean isFormatOnSemicolon() {
		return formatOnSemicolon;
	}

	public int getIndentSize() {
		return indentSize;
	}

	public boolean isUseTabs() {
		return useTabs;
	}

	public EditorFormattingOptions withIndentStyle(IndentStyle value) {
		return new EditorFormattingOptions(value, formatOnCloseBrace, formatOnSemicolon, indentSize, useTabs);
	}

	public EditorFormattingOptions withFormatOnCloseBrace(boolean value) {
		return new EditorFormattingOptions(indentStyle, value, formatOnSemicolon, indentSize, useTabs);
	}

	public EditorFormattingOptions withFormatOnSemicolon(boolean value) {
		return new EditorFormattingOptions(indentStyle, formatOnCloseBrace, value, indentSize, useTabs);
	}

	public EditorFormattingOptions withIndentation(int size, boolean tabs) {
		return new EditorFormattingOptions(indentStyle, formatOnCloseBrace, formatOnSemicolon, size, tabs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof EditorFormattingOptions)) {
			return false;
		}
		EditorFormattingOptions other = (EditorFormattingOptions) obj;
		return indentStyle == other.indentStyle
				&& formatOnCloseBrace == other.formatOnCloseBrace
				&& formatOnSemicolon == other.formatOnSemicolon
				&& indentSize == other.indentSize
				&& useTabs == other.useTabs;
	}

	@Override
	public int hashCode() {
		return Objects.hash(indentStyle, formatOnCloseBrace, formatOnSemicolon, indentSize, useTabs);
	}

	@Override
	public String toString() {
		return "EditorFormattingOptions{indentStyle=" + indentStyle
				+ ", formatOnCloseBrace=" + formatOnCloseBrace
				+ ", formatOnSemicolon=" + formatOnSemicolon
				+ ", indentSize=" + indentSize
				+ ", useTabs=" + useTabs + "}";
	}
}
