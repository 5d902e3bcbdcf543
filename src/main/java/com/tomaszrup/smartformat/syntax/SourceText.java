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

import java.util.Objects;

/**
 * Immutable document text with line lookups. Recognizes {@code \n},
 * {@code \r\n} and lone {@code \r} as line breaks.
 */
public final class SourceText {
	private final String text;

	public SourceText(String text) {
		this.text = Objects.requireNonNull(text, "text");
	}

	public int getLength() {
		return text.length();
	}

	public char charAt(int position) {
		return text.charAt(position);
	}

	public String substring(TextSpan span) {
		return text.substring(span.getStart(), span.getEnd());
	}

	/**
	 * Offset of the first character of the line containing {@code position}.
	 */
	public int getLineStart(int position) {
		int clamped = Math.max(0, Math.min(position, text.length()));
		for (int i = clamped - 1; i >= 0; i--) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				return i + 1;
			}
		}
		return 0;
	}

	@Override
	public String toString() {
		return text;
	}
}
