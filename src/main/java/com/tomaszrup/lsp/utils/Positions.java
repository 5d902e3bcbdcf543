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

import org.eclipse.lsp4j.Position;

/**
 * Conversions between LSP {@link Position}s and character offsets. A line
 * ends at {@code \n}, {@code \r\n} or a lone {@code \r}.
 */
public class Positions {
	private Positions() {
	}

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * @return the offset of {@code position} in {@code string}, or -1 if the
	 *         line does not exist or the character is past the end of the line
	 */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || !valid(position)) {
			return -1;
		}
		int lineStartOffset = findLineStartOffset(string, position.getLine());
		if (lineStartOffset < 0) {
			return -1;
		}
		int lineLength = findLineEndOffset(string, lineStartOffset) - lineStartOffset;
		if (position.getCharacter() > lineLength) {
			return -1;
		}
		return lineStartOffset + position.getCharacter();
	}

	/**
	 * Position of {@code offset} in {@code string}; offsets outside the text
	 * are clamped to its bounds.
	 */
	public static Position fromOffset(String string, int offset) {
		int clamped = Math.max(0, Math.min(offset, string.length()));
		int line = 0;
		int lineStart = 0;
		for (int i = 0; i < clamped; i++) {
			char c = string.charAt(i);
			if (c == '\r' && i + 1 < string.length() && string.charAt(i + 1) == '\n') {
				if (i + 1 == clamped) {
					// offset sits between \r and \n
					break;
				}
				i++;
				line++;
				lineStart = i + 1;
			} else if (c == '\n' || c == '\r') {
				line++;
				lineStart = i + 1;
			}
		}
		return new Position(line, clamped - lineStart);
	}

	private static int findLineStartOffset(String string, int line) {
		if (line == 0) {
			return 0;
		}
		int currentLine = 0;
		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\r' && i + 1 < string.length() && string.charAt(i + 1) == '\n') {
				i++;
			} else if (c != '\n' && c != '\r') {
				continue;
			}
			currentLine++;
			if (currentLine == line) {
				return i + 1;
			}
		}
		return -1;
	}

	private static int findLineEndOffset(String string, int lineStartOffset) {
		for (int i = lineStartOffset; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return string.length();
	}
}
