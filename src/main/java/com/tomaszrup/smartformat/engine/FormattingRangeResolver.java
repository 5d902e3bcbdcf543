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

import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;

/**
 * Finds the smallest enclosing construct worth reformatting after the user
 * finished typing {@code endToken}, such as the statement or block it closes.
 */
@FunctionalInterface
public interface FormattingRangeResolver {

	/** Resolver that never finds a range. */
	FormattingRangeResolver NONE = (tree, endToken) -> null;

	/**
	 * @return the bounding tokens, or {@code null} when there is no suitable
	 *         range
	 */
	TokenRange findAppropriateRange(SyntaxTree tree, SyntaxToken endToken);
}
