////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.smartformat.syntax.TextSpan;

public class Ranges {
	private Ranges() {
	}

	/**
	 * Converts an LSP range to a character span of {@code text}.
	 *
	 * @return the span, or {@code null} if either end is not a valid position
	 *         in {@code text} or the range is reversed
	 */
	public static TextSpan toSpan(String text, Range range) {
		if (range == null) {
			return null;
		}
		int start = Positions.getOffset(text, range.getStart());
		int end = Positions.getOffset(text, range.getEnd());
		if (start < 0 || end < start) {
			return null;
		}
		return TextSpan.fromBounds(start, end);
	}

	public static Range fromSpan(String text, TextSpan span) {
		return new Range(Positions.fromOffset(text, span.getStart()), Positions.fromOffset(text, span.getEnd()));
	}
}
