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
 * Immutable handle to a leaf token of a syntax tree snapshot.
 *
 * <p>Two tokens are equal when they have the same kind and span; the parent
 * is a back-reference into the tree and takes no part in equality. The
 * {@link #MISSING} sentinel stands for "no token" and is what lookups return
 * instead of {@code null}.</p>
 */
public final class SyntaxToken {

	public static final SyntaxToken MISSING = new SyntaxToken(SyntaxKind.NONE, new TextSpan(0, 0), "", null, true);

	private final SyntaxKind kind;
	private final TextSpan span;
	private final String text;
	private final SyntaxNode parent;
	private final boolean missing;

	public SyntaxToken(SyntaxKind kind, TextSpan span, String text, SyntaxNode parent) {
		this(kind, span, text, parent, false);
	}

	private SyntaxToken(SyntaxKind kind, TextSpan span, String text, SyntaxNode parent, boolean missing) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.span = Objects.requireNonNull(span, "span");
		this.text = Objects.requireNonNull(text, "text");
		this.parent = parent;
		this.missing = missing;
	}

	/**
	 * Creates a token the parser synthesized for error recovery. It has a
	 * position but no text and is treated like {@link #MISSING}.
	 */
	public static SyntaxToken missing(SyntaxKind kind, int position, SyntaxNode parent) {
		return new SyntaxToken(kind, new TextSpan(position, 0), "", parent, true);
	}

	public SyntaxKind getKind() {
		return kind;
	}

	public TextSpan getSpan() {
		return span;
	}

	public int getSpanStart() {
		return span.getStart();
	}

	public String getText() {
		return text;
	}

	public SyntaxNode getParent() {
		return parent;
	}

	public boolean isMissing() {
		return missing;
	}

	public boolean isKind(SyntaxKind expected) {
		return kind == expected;
	}

	public boolean isKind(SyntaxKind first, SyntaxKind... others) {
		if (kind == first) {
			return true;
		}
		for (SyntaxKind other : others) {
			if (kind == other) {
				return true;
			}
		}
		return false;
	}

	public boolean hasParentOfKind(SyntaxKind parentKind) {
		return parent != null && parent.getKind() == parentKind;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SyntaxToken)) {
			return false;
		}
		SyntaxToken other = (SyntaxToken) obj;
		return kind == other.kind && missing == other.missing && span.equals(other.span);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, span, missing);
	}

	@Override
	public String toString() {
		if (missing) {
			return "<missing " + kind + ">";
		}
		return kind + span.toString() + " '" + text + "'";
	}
}
