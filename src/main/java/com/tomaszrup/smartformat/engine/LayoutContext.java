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

import java.util.function.Predicate;

import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.syntax.SyntaxToken;

/**
 * Hooks a {@link LayoutEngine} exposes to formatting rules while it lays out
 * a span. Rules are applied in chain order, so a later rule sees and may
 * override what an earlier one configured.
 */
public interface LayoutContext {

	EditorFormattingOptions getOptions();

	/**
	 * Keeps the existing line breaks in front of every token matched by
	 * {@code tokens} instead of recomputing them.
	 */
	void preserveLineBreaksBefore(Predicate<SyntaxToken> tokens);
}
