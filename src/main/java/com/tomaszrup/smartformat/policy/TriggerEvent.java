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

import java.util.Objects;

import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * An editor event that may cause a format. Create instances with the static
 * factories and dispatch on {@link #getKind()}.
 */
public abstract class TriggerEvent {

	public enum Kind {
		TYPED_CHARACTER,
		RETURN,
		PASTE,
		ON_DEMAND
	}

	private final Kind kind;

	private TriggerEvent(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	public static TypedCharacter typedCharacter(char character, int caretOffset) {
		return new TypedCharacter(character, caretOffset);
	}

	public static Return returnKey(int caretOffset) {
		return new Return(caretOffset);
	}

	public static Paste paste(TextSpan span) {
		return new Paste(span);
	}

	/**
	 * @param span the selection to format, or {@code null} for the whole
	 *             document
	 */
	public static OnDemand onDemand(TextSpan span) {
		return new OnDemand(span);
	}

	private static int checkCaret(int caretOffset) {
		if (caretOffset < 0) {
			throw new IllegalArgumentException("caret offset must not be negative: " + caretOffset);
		}
		return caretOffset;
	}

	public static final class TypedCharacter extends TriggerEvent {
		private final char character;
		private final int caretOffset;

		private TypedCharacter(char character, int caretOffset) {
			super(Kind.TYPED_CHARACTER);
			this.character = character;
			this.caretOffset = checkCaret(caretOffset);
		}

		public char getCharacter() {
			return character;
		}

		public int getCaretOffset() {
			return caretOffset;
		}

		@Override
		public String toString() {
			return "TypedCharacter{'" + character + "' at " + caretOffset + "}";
		}
	}

	public static final class Return extends TriggerEvent {
		private final int caretOffset;

		private Return(int caretOffset) {
			super(Kind.RETURN);
			this.caretOffset = checkCaret(caretOffset);
		}

		public int getCaretOffset() {
			return caretOffset;
		}

		@Override
		public String toString() {
			return "Return{at " + caretOffset + "}";
		}
	}

	public static final class Paste extends TriggerEvent {
		private final TextSpan span;

		private Paste(TextSpan span) {
			super(Kind.PASTE);
			this.span = Objects.requireNonNull(span, "span");
		}

		public TextSpan getSpan() {
			return span;
		}

		@Override
		public String toString() {
			return "Paste{" + span + "}";
		}
	}

	public static final class OnDemand extends TriggerEvent {
		private final TextSpan span;

		private OnDemand(TextSpan span) {
			super(Kind.ON_DEMAND);
			this.span = span;
		}

		/** The selection, or {@code null} for the whole document. */
		public TextSpan getSpan() {
			return span;
		}

		public boolean isWholeDocument() {
			return span == null;
		}

		@Override
		public String toString() {
			return isWholeDocument() ? "OnDemand{document}" : "OnDemand{" + span + "}";
		}
	}
}
