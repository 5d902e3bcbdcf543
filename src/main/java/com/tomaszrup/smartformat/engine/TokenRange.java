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

import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Pair of tokens bounding a range to reformat, both inclusive.
 */
public final class TokenRange {
	private final SyntaxToken startToken;
	private final SyntaxToken endToken;

	public TokenRange(SyntaxToken startToken, SyntaxToken endToken) {
		this.startToken = Objects.requireNonNull(startToken, "startToken");
		this.endToken = Objects.requireNonNull(endToken, "endToken");
		if (startToken.getSpanStart() > endToken.getSpanStart()) {
			throw new IllegalArgumentException("start token " + startToken + " is after end token " + endToken);
		}
	}

	public SyntaxToken getStartToken() {
		return startToken;
	}

	public SyntaxToken getEndToken() {
		return endToken;
	}

	/** A range whose two bounds are the same token has nothing to format. */
	public boolean isDegenerate() {
		return startToken.equals(endToken);
	}

	/** Span from the start of the first token to the end of the last. */
	public TextSpan toSpan() {
		return TextSpan.fromBounds(startToken.getSpanStart(), endToken.getSpan().getEnd());
	}

	@Override
	public String toString() {
		return "TokenRange{" + startToken + " .. " + endToken + "}";
	}
}
