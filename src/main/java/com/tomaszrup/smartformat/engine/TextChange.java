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

import java.util.Objects;

import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * A proposed replacement of {@code span} with {@code newText}. Produced by a
 * {@link LayoutEngine}; spans refer to the snapshot the engine was given.
 */
public final class TextChange {
	private final TextSpan span;
	private final String newText;

	public TextChange(TextSpan span, String newText) {
		this.span = Objects.requireNonNull(span, "span");
		this.newText = Objects.requireNonNull(newText, "newText");
	}

	public TextSpan getSpan() {
		return span;
	}

	public String getNewText() {
		return newText;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof TextChange)) {
			return false;
		}
		TextChange other = (TextChange) obj;
		return span.equals(other.span) && newText.equals(other.newText);
	}

	@Override
	public int hashCode() {
		return Objects.hash(span, newText);
	}

	@Override
	public String toString() {
		return "TextChange" + span + " -> '" + newText.replace("\n", "\\n").replace("\t", "\\t") + "'";
	}
}
