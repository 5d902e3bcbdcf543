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
 * Immutable half-open character range {@code [start, end)} in a document.
 */
public final class TextSpan {
	private final int start;
	private final int length;

	public TextSpan(int start, int length) {
		if (start < 0) {
			throw new IllegalArgumentException("start must not be negative: " + start);
		}
		if (length < 0) {
			throw new IllegalArgumentException("length must not be negative: " + length);
		}
		this.start = start;
		this.length = length;
	}

	public static TextSpan fromBounds(int start, int end) {
		if (end < start) {
			throw new IllegalArgumentException("end " + end + " is before start " + start);
		}
		return new TextSpan(start, end - start);
	}

	public int getStart() {
		return start;
	}

	public int getLength() {
		return length;
	}

	public int getEnd() {
		return start + length;
	}

	public boolean isEmpty() {
		return length == 0;
	}

	public boolean contains(int position) {
		return position >= start && position < getEnd();
	}

	public boolean contains(TextSpan other) {
		return other.start >= start && other.getEnd() <= getEnd();
	}

	public boolean intersectsWith(TextSpan other) {
		return other.start <= getEnd() && other.getEnd() >= start;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof TextSpan)) {
			return false;
		}
		TextSpan other = (TextSpan) obj;
		return start == other.start && length == other.length;
	}

	@Override
	public int hashCode() {
		return 31 * start + length;
	}

	@Override
	public String toString() {
		return "[" + start + ".." + getEnd() + ")";
	}
}
